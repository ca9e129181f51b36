package io.mcpconf.cli;

import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "mcpconf", mixinStandardHelpOptions = true, description = "MCP server registry management")
public final class McpconfCliCommand implements Runnable {

    @Option(names = {"-r", "--registry"}, description = "Registry file path (YAML or JSON)")
    Path registry;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(System.out);
    }
}
