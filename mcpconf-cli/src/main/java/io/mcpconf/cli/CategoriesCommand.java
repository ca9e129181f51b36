package io.mcpconf.cli;

import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;

@Command(name = "categories", description = "List categories and their servers")
public final class CategoriesCommand extends RegistryCommand {

    public CategoriesCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        try {
            Map<String, List<String>> categories = loadRegistry().categories();
            if (categories.isEmpty()) {
                System.out.println("No categories defined.");
                return 0;
            }
            categories.forEach((category, servers) -> System.out.println(category + ": " + String.join(", ", servers)));
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
