package io.mcpconf.cli;

import io.mcpconf.core.registry.ServerRegistry;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List servers")
public final class ListCommand extends RegistryCommand {

    @Option(names = "--deployment", description = "Filter by deployment type (local, remote, hybrid)")
    String deployment;

    @Option(names = "--category", description = "Filter by category")
    String category;

    @Option(names = {"-d", "--detailed"}, description = "Show detailed information")
    boolean detailed;

    public ListCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        try {
            ServerRegistry registry = loadRegistry();
            List<String> servers = registry.listServers(deployment, category);
            if (servers.isEmpty()) {
                System.out.println("No servers found.");
                return 0;
            }

            if (!detailed) {
                System.out.println(ServerFormatter.TABLE_HEADER);
                System.out.println(ServerFormatter.TABLE_RULE);
            }
            for (int i = 0; i < servers.size(); i++) {
                String serverId = servers.get(i);
                var server = registry.requireServer(serverId);
                if (detailed) {
                    System.out.println(ServerFormatter.detailed(serverId, server));
                    if (i < servers.size() - 1) {
                        System.out.println();
                    }
                } else {
                    System.out.println(ServerFormatter.summary(serverId, server));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
