package io.mcpconf.cli;

import io.mcpconf.core.registry.ServerRegistry;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "validate", description = "Validate one server, or every server when no id is given")
public final class ValidateCommand extends RegistryCommand {

    @Parameters(index = "0", arity = "0..1", description = "Server ID to validate (default: all)")
    String serverId;

    public ValidateCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        try {
            ServerRegistry registry = loadRegistry();
            if (serverId != null) {
                Map<String, String> errors = registry.validateServer(serverId);
                if (!errors.isEmpty()) {
                    printErrors(serverId, errors);
                    return 1;
                }
                System.out.println("Server '" + serverId + "' is valid.");
                return 0;
            }

            Map<String, Map<String, String>> failures = registry.validateAll();
            if (failures.isEmpty()) {
                System.out.println("All servers are valid.");
                return 0;
            }
            failures.forEach(this::printErrors);
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printErrors(String id, Map<String, String> errors) {
        System.out.println("Validation errors for '" + id + "':");
        errors.forEach((field, message) -> System.out.println("  " + field + ": " + message));
    }
}
