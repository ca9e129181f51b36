package io.mcpconf.cli;

import static io.mcpconf.core.model.Presence.present;

import io.mcpconf.core.model.Capabilities;
import io.mcpconf.core.model.Requirements;
import io.mcpconf.core.model.ServerConfig;
import io.mcpconf.core.model.ServerEntry;
import java.util.ArrayList;
import java.util.List;

final class ServerFormatter {
    static final String TABLE_HEADER = String.format("%-20s %-8s %-10s %s", "NAME", "DEPLOY", "TRANSPORT", "DESCRIPTION");
    static final String TABLE_RULE = "-".repeat(70);

    private ServerFormatter() {
    }

    static String summary(String serverId, ServerEntry server) {
        return String.format(
            "%-20s %-8s %-10s %s",
            serverId,
            server.deployment().value(),
            server.config().transport().value(),
            server.description()
        );
    }

    static String detailed(String serverId, ServerEntry server) {
        ServerConfig config = server.config();
        List<String> lines = new ArrayList<>();
        lines.add("Server: " + serverId);
        lines.add("Name: " + server.name());
        lines.add("Description: " + server.description());
        lines.add("Version: " + server.version());
        lines.add("Deployment: " + server.deployment().value());
        lines.add("Transport: " + config.transport().value());
        if (present(server.license())) {
            lines.add("License: " + server.license());
        }
        if (present(server.sourceUrl())) {
            lines.add("Source: " + server.sourceUrl());
        }

        lines.add("");
        lines.add("Configuration:");
        if (present(config.command())) {
            lines.add("  Command: " + config.command());
        }
        if (present(config.args())) {
            lines.add("  Args: " + String.join(" ", config.args()));
        }
        if (present(config.url())) {
            lines.add("  URL: " + config.url());
        }
        if (present(config.env())) {
            lines.add("  Environment:");
            config.env().forEach((key, value) -> lines.add("    " + key + ": " + value));
        }

        Capabilities capabilities = server.capabilities();
        if (capabilities != null) {
            lines.add("");
            lines.add("Capabilities:");
            if (present(capabilities.tools())) {
                lines.add("  Tools: " + String.join(", ", capabilities.tools()));
            }
            if (present(capabilities.resources())) {
                lines.add("  Resources: " + String.join(", ", capabilities.resources()));
            }
            if (present(capabilities.prompts())) {
                lines.add("  Prompts: " + String.join(", ", capabilities.prompts()));
            }
        }

        Requirements requirements = server.requirements();
        if (requirements != null) {
            lines.add("");
            lines.add("Requirements:");
            if (present(requirements.platforms())) {
                lines.add("  Platforms: " + String.join(", ", requirements.platforms()));
            }
            if (present(requirements.runtimes())) {
                requirements.runtimes().forEach((runtime, version) -> lines.add("  " + runtime + ": " + version));
            }
        }
        return String.join(System.lineSeparator(), lines);
    }
}
