package io.mcpconf.core.model;

public record Compatibility(
    String claudeDesktop,
    String mcpconf
) {
}
