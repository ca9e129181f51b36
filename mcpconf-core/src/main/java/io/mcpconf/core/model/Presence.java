package io.mcpconf.core.model;

import java.util.Collection;
import java.util.Map;

/**
 * Emptiness checks for optional fields. Null and empty values are both treated as absent.
 */
public final class Presence {

    private Presence() {
    }

    public static boolean present(String value) {
        return value != null && !value.isEmpty();
    }

    public static boolean present(Collection<?> values) {
        return values != null && !values.isEmpty();
    }

    public static boolean present(Map<?, ?> values) {
        return values != null && !values.isEmpty();
    }
}
