package io.mcpconf.cli;

import io.mcpconf.core.registry.ServerRegistry;
import io.mcpconf.core.store.RegistryStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.ParentCommand;

/**
 * Shared plumbing for subcommands that operate on the registry file. The path comes from the
 * root {@code --registry} option when present, otherwise from the context.
 */
abstract class RegistryCommand implements Callable<Integer> {
    protected final CliContext context;

    @ParentCommand
    McpconfCliCommand root;

    protected RegistryCommand(CliContext context) {
        this.context = context;
    }

    protected Path registryPath() {
        if (root != null && root.registry != null) {
            return root.registry;
        }
        return context.registryPath();
    }

    protected RegistryStore store() {
        return context.storeFactory().apply(registryPath());
    }

    protected ServerRegistry loadRegistry() throws IOException {
        return new ServerRegistry(store().load());
    }
}
