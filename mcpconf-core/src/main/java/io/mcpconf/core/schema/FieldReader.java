package io.mcpconf.core.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over a decoded JSON/YAML record. Shape mismatches are recorded into the shared
 * error map under the dotted field path and the read returns {@code null}.
 */
final class FieldReader {
    private final String path;
    private final Map<?, ?> raw;
    private final Map<String, String> errors;

    FieldReader(Map<?, ?> raw, Map<String, String> errors) {
        this("", raw, errors);
    }

    private FieldReader(String path, Map<?, ?> raw, Map<String, String> errors) {
        this.path = path;
        this.raw = raw;
        this.errors = errors;
    }

    boolean has(String key, String... aliases) {
        return resolveKey(key, aliases) != null;
    }

    String text(String key, String... aliases) {
        String resolved = resolveKey(key, aliases);
        if (resolved == null) {
            return null;
        }
        Object value = raw.get(resolved);
        if (value == null) {
            return null;
        }
        String text = scalar(value);
        if (text == null) {
            fail(resolved, "Expected a string");
        }
        return text;
    }

    List<String> textList(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> items)) {
            fail(key, "Expected a list of strings");
            return null;
        }
        List<String> out = new ArrayList<>(items.size());
        for (Object item : items) {
            String text = item == null ? null : scalar(item);
            if (text == null) {
                fail(key, "Expected a list of strings");
                return null;
            }
            out.add(text);
        }
        return out;
    }

    Map<String, String> textMap(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> entries)) {
            fail(key, "Expected a mapping of strings");
            return null;
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            String text = entry.getValue() == null ? null : scalar(entry.getValue());
            if (text == null) {
                fail(key, "Expected a mapping of strings");
                return null;
            }
            out.put(String.valueOf(entry.getKey()), text);
        }
        return out;
    }

    Boolean bool(String key, String... aliases) {
        String resolved = resolveKey(key, aliases);
        if (resolved == null || raw.get(resolved) == null) {
            return null;
        }
        Object value = raw.get(resolved);
        if (value instanceof Boolean b) {
            return b;
        }
        fail(resolved, "Expected a boolean");
        return null;
    }

    Integer integer(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            try {
                return Math.toIntExact(((Number) value).longValue());
            } catch (ArithmeticException e) {
                fail(key, "Expected an integer, got '" + value + "'");
                return null;
            }
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                fail(key, "Expected an integer, got '" + s + "'");
                return null;
            }
        }
        fail(key, "Expected an integer");
        return null;
    }

    FieldReader nested(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            fail(key, "Expected a mapping");
            return null;
        }
        return new FieldReader(path + key + ".", map, errors);
    }

    private String resolveKey(String key, String... aliases) {
        if (raw.containsKey(key)) {
            return key;
        }
        for (String alias : aliases) {
            if (raw.containsKey(alias)) {
                return alias;
            }
        }
        return null;
    }

    private void fail(String key, String message) {
        errors.putIfAbsent(path + key, message);
    }

    // YAML decodes unquoted numbers and booleans; their text form is kept for string fields.
    private static String scalar(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }
}
