package io.mcpconf.app;

import io.mcpconf.cli.CliContext;
import io.mcpconf.cli.McpconfCommandLine;
import io.mcpconf.core.config.ConfigPaths;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class McpconfApplication {
    private static final Logger LOG = LoggerFactory.getLogger(McpconfApplication.class);

    private McpconfApplication() {
    }

    public static void main(String[] args) {
        Path registryPath = ConfigPaths.defaultRegistryPath();
        LOG.debug("Default registry path {}", registryPath);

        CommandLine commandLine = McpconfCommandLine.create(new CliContext(registryPath));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
