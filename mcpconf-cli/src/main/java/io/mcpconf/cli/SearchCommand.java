package io.mcpconf.cli;

import io.mcpconf.core.registry.ServerRegistry;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search servers by id, name, description or capabilities")
public final class SearchCommand extends RegistryCommand {

    @Parameters(index = "0", arity = "1", description = "Search query")
    String query;

    public SearchCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        try {
            ServerRegistry registry = loadRegistry();
            List<String> results = registry.searchServers(query);
            if (results.isEmpty()) {
                System.out.println("No servers found matching '" + query + "'.");
                return 0;
            }

            System.out.println("Found " + results.size() + " servers:");
            System.out.println(ServerFormatter.TABLE_HEADER);
            System.out.println(ServerFormatter.TABLE_RULE);
            for (String serverId : results) {
                System.out.println(ServerFormatter.summary(serverId, registry.requireServer(serverId)));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
