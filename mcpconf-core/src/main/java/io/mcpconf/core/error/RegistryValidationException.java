package io.mcpconf.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

public final class RegistryValidationException extends RegistryException {
    private final String serverId;
    private final Map<String, String> errors;

    public RegistryValidationException(String serverId, Map<String, String> errors) {
        this(serverId, errors, serverId == null
            ? "Validation errors for server entry: "
            : "Validation errors for server '" + serverId + "': ");
    }

    private RegistryValidationException(String serverId, Map<String, String> errors, String prefix) {
        super(prefix + joinErrors(errors));
        this.serverId = serverId;
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /**
     * Problems with the registry document itself rather than with one of its entries.
     */
    public static RegistryValidationException forDocument(Map<String, String> errors) {
        return new RegistryValidationException(null, errors, "Invalid registry document: ");
    }

    /**
     * Id of the offending entry, or {@code null} for a standalone entry or a document-level problem.
     */
    public String serverId() {
        return serverId;
    }

    public Map<String, String> errors() {
        return errors;
    }

    public static String joinErrors(Map<String, String> errors) {
        return errors.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining(", "));
    }
}
