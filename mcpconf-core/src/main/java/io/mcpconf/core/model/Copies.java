package io.mcpconf.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unmodifiable copies for record components. Null stays null; map iteration order is kept.
 */
final class Copies {

    private Copies() {
    }

    static List<String> list(List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    static Map<String, String> map(Map<String, String> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
