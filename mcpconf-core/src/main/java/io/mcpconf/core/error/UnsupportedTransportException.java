package io.mcpconf.core.error;

import io.mcpconf.core.model.TransportType;

public final class UnsupportedTransportException extends RegistryException {
    private final String format;
    private final TransportType transport;

    public UnsupportedTransportException(String format, TransportType transport, String message) {
        super(message);
        this.format = format;
        this.transport = transport;
    }

    public String format() {
        return format;
    }

    public TransportType transport() {
        return transport;
    }
}
