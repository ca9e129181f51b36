package io.mcpconf.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String REGISTRY_ENV = "MCPCONF_REGISTRY";
    public static final String DEFAULT_REGISTRY_FILE = "mcp-registry.yaml";

    private ConfigPaths() {
    }

    public static Path defaultRegistryPath() {
        return resolveRegistry(System.getenv(REGISTRY_ENV));
    }

    public static Path resolveRegistry(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(DEFAULT_REGISTRY_FILE);
        }
        String trimmed = rawPath.trim();
        if (trimmed.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(trimmed.substring(2));
        }
        return Path.of(trimmed);
    }
}
