package io.mcpconf.core.convert;

import java.util.Locale;
import java.util.Optional;

public enum ClientFormat {
    CLAUDE("claude"),
    GITHUB("github"),
    DXT("dxt"),
    HOSTS("hosts");

    private final String value;

    ClientFormat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ClientFormat> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ClientFormat format : values()) {
            if (format.value.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
