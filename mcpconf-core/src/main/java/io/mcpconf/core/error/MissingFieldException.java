package io.mcpconf.core.error;

public final class MissingFieldException extends RegistryException {
    private final String field;

    public MissingFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
