package io.mcpconf.core.model;

import java.util.List;

public record Capabilities(
    List<String> tools,
    List<String> resources,
    List<String> prompts
) {
    public Capabilities {
        tools = Copies.list(tools);
        resources = Copies.list(resources);
        prompts = Copies.list(prompts);
    }
}
