package io.mcpconf.cli;

import io.mcpconf.core.registry.ImportResult;
import io.mcpconf.core.registry.ServerRegistry;
import io.mcpconf.core.store.RegistryStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "import", description = "Import servers from a Claude Desktop configuration file")
public final class ImportCommand extends RegistryCommand {

    @Parameters(index = "0", arity = "1", description = "Claude Desktop configuration file (JSON or YAML)")
    Path configFile;

    @Option(names = "--save", description = "Save to registry after import")
    boolean save;

    public ImportCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        if (!Files.exists(configFile)) {
            System.err.println("Configuration file not found: " + configFile);
            return 1;
        }

        try {
            Map<String, Object> claudeConfig = context.codec().read(configFile);
            RegistryStore store = store();
            ServerRegistry registry = new ServerRegistry(store.load());
            ImportResult result = registry.importClaudeDesktop(claudeConfig == null ? Map.of() : claudeConfig);

            result.skipped().forEach((serverId, errors) ->
                System.out.println("Skipped '" + serverId + "': " + errors));
            if (save) {
                store.save(registry.document());
                System.out.println("Imported " + result.importedCount() + " servers and saved to registry.");
            } else {
                System.out.println("Imported " + result.importedCount() + " servers (not saved, use --save to persist).");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Import failed: " + e.getMessage());
            return 1;
        }
    }
}
