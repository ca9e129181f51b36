package io.mcpconf.cli;

import io.mcpconf.core.model.ServerEntry;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show server details")
public final class ShowCommand extends RegistryCommand {

    @Parameters(index = "0", arity = "1", description = "Server ID to show")
    String serverId;

    public ShowCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        try {
            Optional<ServerEntry> server = loadRegistry().getServer(serverId);
            if (server.isEmpty()) {
                System.err.println("Server '" + serverId + "' not found.");
                return 1;
            }
            System.out.println(ServerFormatter.detailed(serverId, server.get()));
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
