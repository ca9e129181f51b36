package io.mcpconf.core.convert;

import static io.mcpconf.core.model.Presence.present;

import io.mcpconf.core.error.UnsupportedTransportException;
import io.mcpconf.core.model.ServerConfig;
import io.mcpconf.core.model.ServerEntry;
import io.mcpconf.core.model.TransportType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts registry entries to and from third-party client configuration dialects.
 * Every method is a pure function of its arguments.
 */
public final class FormatConverter {
    private static final Logger LOG = LoggerFactory.getLogger(FormatConverter.class);

    static final String IMPORTED_DESCRIPTION = "Imported from Claude Desktop configuration";
    static final String IMPORTED_VERSION = "1.0.0";
    static final String DXT_VERSION = "1.0";

    private static final Set<String> PYTHON_COMMANDS = Set.of("python", "python3", "uv", "uvx");

    private FormatConverter() {
    }

    public static Object convert(ServerEntry server, String serverId, ClientFormat format) {
        return switch (format) {
            case CLAUDE -> toClaudeDesktop(server, serverId);
            case GITHUB -> toGithubMcp(server, serverId);
            case DXT -> toDxtManifest(server, serverId);
            case HOSTS -> toHostsLine(server, serverId);
        };
    }

    public static Map<String, Object> toClaudeDesktop(ServerEntry server, String serverId) {
        ServerConfig config = server.config();
        Map<String, Object> serverConfig = new LinkedHashMap<>();

        if (config.transport() == TransportType.STDIO) {
            putCommand(serverConfig, config);
        } else if (config.transport().isHttp()) {
            if (present(config.url())) {
                serverConfig.put("url", config.url());
            }
            if (present(config.headers())) {
                serverConfig.put("headers", new LinkedHashMap<>(config.headers()));
            }
        }

        Map<String, Object> servers = new LinkedHashMap<>();
        servers.put(serverId, serverConfig);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("mcpServers", servers);
        return result;
    }

    public static Map<String, Object> toGithubMcp(ServerEntry server, String serverId) {
        ServerConfig config = server.config();
        if (!config.transport().isHttp()) {
            throw new UnsupportedTransportException(
                "github",
                config.transport(),
                "GitHub MCP format only supports http or https transport, got " + config.transport().value()
            );
        }

        Map<String, Object> serverConfig = new LinkedHashMap<>();
        serverConfig.put("type", "http");
        serverConfig.put("url", config.url());
        if (present(config.headers())) {
            serverConfig.put("headers", new LinkedHashMap<>(config.headers()));
        }

        Map<String, Object> servers = new LinkedHashMap<>();
        servers.put(serverId, serverConfig);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("servers", servers);
        return result;
    }

    public static Map<String, Object> toDxtManifest(ServerEntry server, String serverId) {
        ServerConfig config = server.config();
        if (config.transport() != TransportType.STDIO) {
            throw new UnsupportedTransportException(
                "dxt",
                config.transport(),
                "DXT manifest only supports stdio transport, got " + config.transport().value()
            );
        }

        Map<String, Object> mcpConfig = new LinkedHashMap<>();
        putCommand(mcpConfig, config);

        Map<String, Object> runtime = new LinkedHashMap<>();
        runtime.put("type", runtimeType(config.command()));
        runtime.put("mcp_config", mcpConfig);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("dxt_version", DXT_VERSION);
        result.put("name", serverId);
        result.put("display_name", server.name());
        result.put("version", server.version());
        result.put("description", server.description());
        result.put("server", runtime);

        if (present(server.license())) {
            result.put("license", server.license());
        }
        if (present(server.sourceUrl())) {
            result.put("repository", server.sourceUrl());
        }

        if (server.capabilities() != null && present(server.capabilities().tools())) {
            List<Map<String, String>> tools = new ArrayList<>();
            for (String tool : server.capabilities().tools()) {
                Map<String, String> descriptor = new LinkedHashMap<>();
                descriptor.put("name", tool);
                descriptor.put("description", "Tool: " + tool);
                tools.add(descriptor);
            }
            result.put("tools", tools);
        }

        Map<String, Object> compatibility = new LinkedHashMap<>();
        if (server.compatibility() != null && present(server.compatibility().claudeDesktop())) {
            compatibility.put("claude_desktop", server.compatibility().claudeDesktop());
        }
        if (server.requirements() != null && present(server.requirements().platforms())) {
            compatibility.put("platforms", new ArrayList<>(server.requirements().platforms()));
        }
        if (!compatibility.isEmpty()) {
            result.put("compatibility", compatibility);
        }
        return result;
    }

    /**
     * Renders a hosts-file style line: {@code <id> <deployment> <transport> <endpoint> [<options>]}.
     */
    public static String toHostsLine(ServerEntry server, String serverId) {
        ServerConfig config = server.config();
        List<String> parts = new ArrayList<>();
        parts.add(serverId);
        parts.add(server.deployment().value());
        parts.add(config.transport().value());
        parts.add(endpoint(config));

        List<String> options = new ArrayList<>();
        String auth = authOption(config);
        if (auth != null) {
            options.add(auth);
        }
        if (present(config.env())) {
            options.add("env=" + String.join(",", config.env().keySet()));
        }
        if (server.security() != null && server.security().sandbox()) {
            options.add("sandbox=true");
        }
        if (!options.isEmpty()) {
            parts.add(String.join(" ", options));
        }
        return String.join(" ", parts);
    }

    /**
     * Maps a Claude Desktop {@code mcpServers} document to raw registry entries keyed by server id.
     * Entries are not validated here; one with neither {@code command} nor {@code url} carries no
     * transport and is rejected by {@link io.mcpconf.core.schema.RegistrySchema#validateServerEntry}.
     */
    public static Map<String, Map<String, Object>> fromClaudeDesktop(Map<?, ?> claudeConfig) {
        Map<String, Map<String, Object>> servers = new LinkedHashMap<>();
        if (claudeConfig == null || !claudeConfig.containsKey("mcpServers")) {
            return servers;
        }
        if (!(claudeConfig.get("mcpServers") instanceof Map<?, ?> mcpServers)) {
            LOG.warn("Ignoring mcpServers section that is not a mapping");
            return servers;
        }

        for (Map.Entry<?, ?> server : mcpServers.entrySet()) {
            String serverId = String.valueOf(server.getKey());
            Map<?, ?> source = server.getValue() instanceof Map<?, ?> map ? map : Map.of();
            boolean local = source.containsKey("command");

            Map<String, Object> config = new LinkedHashMap<>();
            if (local) {
                config.put("transport", TransportType.STDIO.value());
                config.put("command", source.get("command"));
                copyIfPresent(source, config, "args");
                copyIfPresent(source, config, "env");
            } else if (source.containsKey("url")) {
                String url = String.valueOf(source.get("url"));
                config.put("transport", url.startsWith("https") ? TransportType.HTTPS.value() : TransportType.HTTP.value());
                config.put("url", source.get("url"));
                copyIfPresent(source, config, "headers");
            }

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", displayName(serverId));
            entry.put("description", IMPORTED_DESCRIPTION);
            entry.put("version", IMPORTED_VERSION);
            entry.put("deployment", local ? "local" : "remote");
            entry.put("config", config);
            servers.put(serverId, entry);
        }
        LOG.debug("Mapped {} Claude Desktop servers to registry entries", servers.size());
        return servers;
    }

    static String runtimeType(String command) {
        return command != null && PYTHON_COMMANDS.contains(command) ? "python" : "node";
    }

    // "my-server" -> "My Server"; letters following a non-letter are upper-cased, the rest lower-cased
    static String displayName(String serverId) {
        String spaced = serverId.replace('-', ' ');
        StringBuilder out = new StringBuilder(spaced.length());
        boolean previousLetter = false;
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            if (Character.isLetter(c)) {
                out.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                out.append(c);
                previousLetter = false;
            }
        }
        return out.toString();
    }

    private static void putCommand(Map<String, Object> target, ServerConfig config) {
        if (present(config.command())) {
            target.put("command", config.command());
        }
        if (present(config.args())) {
            target.put("args", new ArrayList<>(config.args()));
        }
        if (present(config.env())) {
            target.put("env", new LinkedHashMap<>(config.env()));
        }
    }

    private static String endpoint(ServerConfig config) {
        if (config.transport() == TransportType.STDIO && present(config.command())) {
            if (present(config.args())) {
                return config.command() + ":" + String.join(":", config.args());
            }
            return config.command();
        }
        if (present(config.url())) {
            return config.url();
        }
        return "unknown";
    }

    private static String authOption(ServerConfig config) {
        if (present(config.headers()) && config.headers().containsKey("Authorization")) {
            String header = config.headers().get("Authorization");
            return header != null && header.startsWith("Bearer") ? "auth=bearer" : "auth=key";
        }
        if (present(config.env())) {
            for (String key : config.env().keySet()) {
                if (key.endsWith("KEY") || key.endsWith("TOKEN")) {
                    return "auth=key";
                }
            }
        }
        return null;
    }

    private static void copyIfPresent(Map<?, ?> source, Map<String, Object> target, String key) {
        if (source.containsKey(key)) {
            target.put(key, source.get(key));
        }
    }
}
