package io.mcpconf.core.registry;

import static io.mcpconf.core.model.Presence.present;

import io.mcpconf.core.convert.ClientFormat;
import io.mcpconf.core.convert.FormatConverter;
import io.mcpconf.core.error.RegistryValidationException;
import io.mcpconf.core.error.ServerNotFoundException;
import io.mcpconf.core.model.Capabilities;
import io.mcpconf.core.model.DeploymentType;
import io.mcpconf.core.model.RegistryDocument;
import io.mcpconf.core.model.ServerEntry;
import io.mcpconf.core.schema.RegistrySchema;
import io.mcpconf.core.schema.ServerEntryMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one in-memory {@link RegistryDocument}. Not thread-safe; callers serialize access.
 */
public final class ServerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ServerRegistry.class);

    private final RegistryDocument document;

    public ServerRegistry() {
        this(RegistryDocument.empty());
    }

    public ServerRegistry(RegistryDocument document) {
        this.document = Objects.requireNonNull(document, "document must not be null");
    }

    public RegistryDocument document() {
        return document;
    }

    public void addServer(String serverId, ServerEntry server) {
        document.putServer(serverId, server);
    }

    public boolean removeServer(String serverId) {
        return document.removeServer(serverId);
    }

    public Optional<ServerEntry> getServer(String serverId) {
        return document.server(serverId);
    }

    public ServerEntry requireServer(String serverId) {
        return document.server(serverId).orElseThrow(() -> new ServerNotFoundException(serverId));
    }

    public List<String> listServers() {
        return listServers(null, null);
    }

    /**
     * Lists server ids, sorted. An unrecognised deployment value or an unknown category yields
     * an empty list; category members missing from the registry are ignored.
     */
    public List<String> listServers(String deployment, String category) {
        DeploymentType deploymentType = null;
        if (present(deployment)) {
            Optional<DeploymentType> parsed = DeploymentType.fromValue(deployment);
            if (parsed.isEmpty()) {
                return List.of();
            }
            deploymentType = parsed.get();
        }

        List<String> members = present(category) ? document.category(category) : null;
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, ServerEntry> server : document.servers().entrySet()) {
            if (deploymentType != null && server.getValue().deployment() != deploymentType) {
                continue;
            }
            if (members != null && !members.contains(server.getKey())) {
                continue;
            }
            ids.add(server.getKey());
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * Case-insensitive substring search over id, name, description and declared capabilities.
     */
    public List<String> searchServers(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> results = new ArrayList<>();
        for (Map.Entry<String, ServerEntry> server : document.servers().entrySet()) {
            if (matches(server.getKey(), server.getValue(), needle)) {
                results.add(server.getKey());
            }
        }
        Collections.sort(results);
        return results;
    }

    public Map<String, List<String>> categories() {
        return document.categories();
    }

    public void addToCategory(String category, String serverId) {
        document.addToCategory(category, serverId);
    }

    public boolean removeFromCategory(String category, String serverId) {
        return document.removeFromCategory(category, serverId);
    }

    public Map<String, Object> toClaudeDesktop(String serverId) {
        return FormatConverter.toClaudeDesktop(requireServer(serverId), serverId);
    }

    public Map<String, Object> toGithubMcp(String serverId) {
        return FormatConverter.toGithubMcp(requireServer(serverId), serverId);
    }

    public Map<String, Object> toDxtManifest(String serverId) {
        return FormatConverter.toDxtManifest(requireServer(serverId), serverId);
    }

    public String toHostsLine(String serverId) {
        return FormatConverter.toHostsLine(requireServer(serverId), serverId);
    }

    public Object convert(String serverId, ClientFormat format) {
        ServerEntry server = requireServer(serverId);
        LOG.debug("Converting server {} to {} format", serverId, format);
        return FormatConverter.convert(server, serverId, format);
    }

    /**
     * Imports every valid server from a Claude Desktop configuration. Invalid servers are skipped
     * and reported in the result rather than failing the import.
     */
    public ImportResult importClaudeDesktop(Map<?, ?> claudeConfig) {
        List<String> imported = new ArrayList<>();
        Map<String, Map<String, String>> skipped = new LinkedHashMap<>();

        FormatConverter.fromClaudeDesktop(claudeConfig).forEach((serverId, raw) -> {
            try {
                addServer(serverId, RegistrySchema.parseServerEntry(serverId, raw));
                imported.add(serverId);
            } catch (RegistryValidationException e) {
                LOG.warn("Skipping server '{}' due to validation errors: {}", serverId, e.errors());
                skipped.put(serverId, e.errors());
            }
        });

        LOG.debug("Imported {} servers, skipped {}", imported.size(), skipped.size());
        return new ImportResult(List.copyOf(imported), Collections.unmodifiableMap(skipped));
    }

    public Map<String, String> validateServer(String serverId) {
        ServerEntry server = requireServer(serverId);
        return RegistrySchema.validateServerEntry(ServerEntryMapper.toRaw(server));
    }

    /**
     * Validates every server; only servers with at least one error appear in the result.
     */
    public Map<String, Map<String, String>> validateAll() {
        Map<String, Map<String, String>> failures = new LinkedHashMap<>();
        for (String serverId : listServers()) {
            Map<String, String> errors = validateServer(serverId);
            if (!errors.isEmpty()) {
                failures.put(serverId, errors);
            }
        }
        return failures;
    }

    private boolean matches(String serverId, ServerEntry server, String needle) {
        if (contains(serverId, needle) || contains(server.name(), needle) || contains(server.description(), needle)) {
            return true;
        }
        Capabilities capabilities = server.capabilities();
        if (capabilities == null) {
            return false;
        }
        return anyContains(capabilities.tools(), needle)
            || anyContains(capabilities.resources(), needle)
            || anyContains(capabilities.prompts(), needle);
    }

    private boolean anyContains(List<String> values, String needle) {
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (contains(value, needle)) {
                return true;
            }
        }
        return false;
    }

    private boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
