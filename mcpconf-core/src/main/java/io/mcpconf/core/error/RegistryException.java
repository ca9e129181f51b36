package io.mcpconf.core.error;

/**
 * Base type for failures raised by registry parsing, lookup and conversion.
 * Validation problems on a single entry are reported as data, not thrown.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
