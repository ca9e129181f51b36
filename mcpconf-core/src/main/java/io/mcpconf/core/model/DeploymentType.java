package io.mcpconf.core.model;

import java.util.Optional;

public enum DeploymentType {
    LOCAL("local"),
    REMOTE("remote"),
    HYBRID("hybrid");

    private final String value;

    DeploymentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<DeploymentType> fromValue(Object raw) {
        for (DeploymentType type : values()) {
            if (type.value.equals(raw)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
