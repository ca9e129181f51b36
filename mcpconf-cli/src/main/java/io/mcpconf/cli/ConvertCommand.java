package io.mcpconf.cli;

import io.mcpconf.core.convert.ClientFormat;
import io.mcpconf.core.error.RegistryException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "convert", description = "Convert a server to a client configuration format")
public final class ConvertCommand extends RegistryCommand {

    @Parameters(index = "0", arity = "1", description = "Server ID to convert")
    String serverId;

    @Parameters(index = "1", arity = "1", description = "Target format: claude, github, dxt, hosts")
    String format;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    Path output;

    public ConvertCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        Optional<ClientFormat> target = ClientFormat.fromValue(format);
        if (target.isEmpty()) {
            System.err.println("Unknown format: " + format);
            return 1;
        }

        try {
            Object result = loadRegistry().convert(serverId, target.get());
            if (output == null) {
                System.out.println(result instanceof String line ? line : context.codec().toPrettyJson(result));
                return 0;
            }

            if (result instanceof String line) {
                Files.writeString(output, line + System.lineSeparator(), StandardCharsets.UTF_8);
            } else {
                context.codec().write(output, result);
            }
            System.out.println("Configuration written to " + output);
            return 0;
        } catch (RegistryException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Convert failed: " + e.getMessage());
            return 1;
        }
    }
}
