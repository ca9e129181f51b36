package io.mcpconf.core.error;

public final class ServerNotFoundException extends RegistryException {
    private final String serverId;

    public ServerNotFoundException(String serverId) {
        super("Server '" + serverId + "' not found");
        this.serverId = serverId;
    }

    public String serverId() {
        return serverId;
    }
}
