package io.mcpconf.core.model;

import java.util.Objects;

public record ServerEntry(
    String name,
    String description,
    String version,
    DeploymentType deployment,
    ServerConfig config,
    String license,
    String sourceUrl,
    Capabilities capabilities,
    Requirements requirements,
    Security security,
    Compatibility compatibility
) {
    public ServerEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(deployment, "deployment must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    public static ServerEntry of(
        String name,
        String description,
        String version,
        DeploymentType deployment,
        ServerConfig config
    ) {
        return new ServerEntry(name, description, version, deployment, config, null, null, null, null, null, null);
    }
}
