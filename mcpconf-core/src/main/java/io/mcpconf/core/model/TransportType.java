package io.mcpconf.core.model;

import java.util.Optional;

public enum TransportType {
    STDIO("stdio"),
    HTTP("http"),
    HTTPS("https"),
    WEBSOCKET("websocket");

    private final String value;

    TransportType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isHttp() {
        return this == HTTP || this == HTTPS;
    }

    /**
     * Exact, case-sensitive match against the wire literal. Anything that is not one of the
     * four literals (including non-string values) yields an empty result.
     */
    public static Optional<TransportType> fromValue(Object raw) {
        for (TransportType type : values()) {
            if (type.value.equals(raw)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
