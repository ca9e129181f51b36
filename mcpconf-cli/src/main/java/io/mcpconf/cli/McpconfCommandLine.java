package io.mcpconf.cli;

import picocli.CommandLine;

public final class McpconfCommandLine {

    private McpconfCommandLine() {
    }

    public static CommandLine create(CliContext context) {
        CommandLine commandLine = new CommandLine(new McpconfCliCommand());
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("convert", new ConvertCommand(context));
        commandLine.addSubcommand("validate", new ValidateCommand(context));
        commandLine.addSubcommand("categories", new CategoriesCommand(context));
        commandLine.addSubcommand("import", new ImportCommand(context));
        return commandLine;
    }
}
