package io.mcpconf.core.schema;

import io.mcpconf.core.error.MissingFieldException;
import io.mcpconf.core.error.RegistryValidationException;
import io.mcpconf.core.model.Capabilities;
import io.mcpconf.core.model.Compatibility;
import io.mcpconf.core.model.DeploymentType;
import io.mcpconf.core.model.RegistryDocument;
import io.mcpconf.core.model.Requirements;
import io.mcpconf.core.model.Security;
import io.mcpconf.core.model.ServerConfig;
import io.mcpconf.core.model.ServerEntry;
import io.mcpconf.core.model.TransportType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RegistrySchema {
    private static final Logger LOG = LoggerFactory.getLogger(RegistrySchema.class);

    public static final List<String> REQUIRED_FIELDS = List.of("name", "description", "version", "deployment", "config");

    private RegistrySchema() {
    }

    /**
     * Checks one raw server entry. Every violation is collected; an empty map means the entry
     * can be parsed.
     */
    public static Map<String, String> validateServerEntry(Map<?, ?> data) {
        Map<String, String> errors = new LinkedHashMap<>();

        for (String field : REQUIRED_FIELDS) {
            if (!data.containsKey(field)) {
                errors.put(field, "Required field '" + field + "' is missing");
            }
        }

        if (data.containsKey("deployment") && DeploymentType.fromValue(data.get("deployment")).isEmpty()) {
            errors.put("deployment", "Invalid deployment type: " + data.get("deployment"));
        }

        // a non-mapping config is not reported beyond the presence check above
        if (data.get("config") instanceof Map<?, ?> config) {
            Object transport = config.get("transport");
            if (!config.containsKey("transport")) {
                errors.put("config.transport", "Transport type is required in config");
            } else if (TransportType.fromValue(transport).isEmpty()) {
                errors.put("config.transport", "Invalid transport type: " + transport);
            }

            if ("stdio".equals(transport) && !config.containsKey("command")) {
                errors.put("config.command", "Command is required for stdio transport");
            } else if (("http".equals(transport) || "https".equals(transport)) && !config.containsKey("url")) {
                errors.put("config.url", "URL is required for HTTP transport");
            }
        }

        return errors;
    }

    public static ServerEntry parseServerEntry(Map<?, ?> data) {
        return parseServerEntry(null, data);
    }

    /**
     * Validates and parses one raw entry. Unlike a bare field copy, this never yields an entry
     * with a required field missing: any problem fails with {@link RegistryValidationException}.
     */
    public static ServerEntry parseServerEntry(String serverId, Map<?, ?> data) {
        Map<String, String> errors = validateServerEntry(data);
        if (!errors.isEmpty()) {
            throw new RegistryValidationException(serverId, errors);
        }

        FieldReader entry = new FieldReader(data, errors);
        FieldReader configReader = entry.nested("config");
        if (configReader == null) {
            errors.putIfAbsent("config", "Expected a mapping");
            throw new RegistryValidationException(serverId, errors);
        }
        ServerConfig config = parseConfig(configReader);
        String name = entry.text("name");
        String description = entry.text("description");
        String version = entry.text("version");
        requireText("name", name, errors);
        requireText("description", description, errors);
        requireText("version", version, errors);

        Capabilities capabilities = null;
        FieldReader cap = entry.nested("capabilities");
        if (cap != null) {
            capabilities = new Capabilities(cap.textList("tools"), cap.textList("resources"), cap.textList("prompts"));
        }

        Requirements requirements = null;
        FieldReader req = entry.nested("requirements");
        if (req != null) {
            requirements = new Requirements(
                req.textList("platforms"),
                req.textMap("runtimes"),
                req.textList("dependencies"),
                req.bool("network")
            );
        }

        Security security = null;
        FieldReader sec = entry.nested("security");
        if (sec != null) {
            Boolean requiresAuth = sec.bool("requires_auth", "requiresAuth");
            Boolean sandbox = sec.bool("sandbox");
            security = new Security(
                requiresAuth != null && requiresAuth,
                sec.textList("permissions"),
                sandbox != null && sandbox
            );
        }

        Compatibility compatibility = null;
        FieldReader compat = entry.nested("compatibility");
        if (compat != null) {
            compatibility = new Compatibility(compat.text("claude_desktop", "claudeDesktop"), compat.text("mcpconf"));
        }

        String license = entry.text("license");
        String sourceUrl = entry.text("source_url", "sourceUrl");

        if (!errors.isEmpty()) {
            throw new RegistryValidationException(serverId, errors);
        }

        return new ServerEntry(
            name,
            description,
            version,
            DeploymentType.fromValue(data.get("deployment")).orElseThrow(),
            config,
            license,
            sourceUrl,
            capabilities,
            requirements,
            security,
            compatibility
        );
    }

    /**
     * Parses a whole registry document. All-or-nothing: the first invalid entry aborts the parse.
     */
    public static RegistryDocument parseRegistry(Map<?, ?> data) {
        if (data == null || data.get("version") == null) {
            throw new MissingFieldException("version", "Registry version is required");
        }
        if (!data.containsKey("servers")) {
            throw new MissingFieldException("servers", "Servers section is required");
        }

        Map<String, String> documentErrors = new LinkedHashMap<>();
        FieldReader document = new FieldReader(data, documentErrors);
        String version = document.text("version");

        Object rawServers = data.get("servers");
        if (rawServers != null && !(rawServers instanceof Map<?, ?>)) {
            documentErrors.put("servers", "Expected a mapping of server entries");
        }
        Map<String, List<String>> categories = parseCategories(data.get("categories"), documentErrors);
        if (!documentErrors.isEmpty()) {
            throw RegistryValidationException.forDocument(documentErrors);
        }

        Map<String, ServerEntry> servers = new LinkedHashMap<>();
        if (rawServers instanceof Map<?, ?> serverMap) {
            for (Map.Entry<?, ?> server : serverMap.entrySet()) {
                String serverId = String.valueOf(server.getKey());
                if (!(server.getValue() instanceof Map<?, ?> serverData)) {
                    throw new RegistryValidationException(serverId, Map.of("entry", "Server entry must be a mapping"));
                }
                servers.put(serverId, parseServerEntry(serverId, serverData));
            }
        }

        LOG.debug("Parsed registry version {} with {} servers", version, servers.size());
        return new RegistryDocument(version, servers, categories);
    }

    private static ServerConfig parseConfig(FieldReader config) {
        Integer timeout = config.integer("timeout");
        return new ServerConfig(
            TransportType.fromValue(config.text("transport")).orElseThrow(),
            config.text("command"),
            config.textList("args"),
            config.text("url"),
            config.textMap("headers"),
            config.textMap("env"),
            config.text("working_dir", "workingDir"),
            timeout == null ? ServerConfig.DEFAULT_TIMEOUT_SECONDS : timeout
        );
    }

    private static void requireText(String field, String value, Map<String, String> errors) {
        if (value == null) {
            errors.putIfAbsent(field, "Required field '" + field + "' is missing");
        }
    }

    private static Map<String, List<String>> parseCategories(Object raw, Map<String, String> errors) {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        if (raw == null) {
            return categories;
        }
        if (!(raw instanceof Map<?, ?> rawCategories)) {
            errors.put("categories", "Expected a mapping of category names to server ids");
            return categories;
        }
        for (Map.Entry<?, ?> category : rawCategories.entrySet()) {
            String name = String.valueOf(category.getKey());
            Object members = category.getValue();
            if (members == null) {
                categories.put(name, List.of());
            } else if (members instanceof List<?> ids) {
                List<String> copy = new ArrayList<>(ids.size());
                for (Object id : ids) {
                    if (id == null) {
                        errors.putIfAbsent("categories." + name, "Expected a list of server ids");
                    } else {
                        copy.add(String.valueOf(id));
                    }
                }
                categories.put(name, copy);
            } else {
                errors.put("categories." + name, "Expected a list of server ids");
            }
        }
        return categories;
    }
}
