package io.mcpconf.core.schema;

import static io.mcpconf.core.model.Presence.present;

import io.mcpconf.core.model.Capabilities;
import io.mcpconf.core.model.Compatibility;
import io.mcpconf.core.model.RegistryDocument;
import io.mcpconf.core.model.Requirements;
import io.mcpconf.core.model.Security;
import io.mcpconf.core.model.ServerConfig;
import io.mcpconf.core.model.ServerEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders parsed entries back into the raw registry shape accepted by {@link RegistrySchema}.
 * Absent and empty optionals are dropped, as is a timeout equal to the default.
 */
public final class ServerEntryMapper {

    private ServerEntryMapper() {
    }

    public static Map<String, Object> toRawDocument(RegistryDocument document) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", document.version());

        Map<String, Object> servers = new LinkedHashMap<>();
        document.servers().forEach((id, entry) -> servers.put(id, toRaw(entry)));
        data.put("servers", servers);

        if (!document.categories().isEmpty()) {
            data.put("categories", new LinkedHashMap<>(document.categories()));
        }
        return data;
    }

    public static Map<String, Object> toRaw(ServerEntry entry) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", entry.name());
        result.put("description", entry.description());
        result.put("version", entry.version());
        result.put("deployment", entry.deployment().value());
        result.put("config", configToRaw(entry.config()));

        if (present(entry.license())) {
            result.put("license", entry.license());
        }
        if (present(entry.sourceUrl())) {
            result.put("source_url", entry.sourceUrl());
        }
        putIfNotEmpty(result, "capabilities", capabilitiesToRaw(entry.capabilities()));
        putIfNotEmpty(result, "requirements", requirementsToRaw(entry.requirements()));
        putIfNotEmpty(result, "security", securityToRaw(entry.security()));
        putIfNotEmpty(result, "compatibility", compatibilityToRaw(entry.compatibility()));
        return result;
    }

    private static Map<String, Object> configToRaw(ServerConfig config) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("transport", config.transport().value());
        if (present(config.command())) {
            raw.put("command", config.command());
        }
        if (present(config.args())) {
            raw.put("args", new ArrayList<>(config.args()));
        }
        if (present(config.url())) {
            raw.put("url", config.url());
        }
        if (present(config.headers())) {
            raw.put("headers", new LinkedHashMap<>(config.headers()));
        }
        if (present(config.env())) {
            raw.put("env", new LinkedHashMap<>(config.env()));
        }
        if (present(config.workingDir())) {
            raw.put("working_dir", config.workingDir());
        }
        if (config.timeout() != ServerConfig.DEFAULT_TIMEOUT_SECONDS) {
            raw.put("timeout", config.timeout());
        }
        return raw;
    }

    private static Map<String, Object> capabilitiesToRaw(Capabilities capabilities) {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (capabilities == null) {
            return raw;
        }
        if (present(capabilities.tools())) {
            raw.put("tools", new ArrayList<>(capabilities.tools()));
        }
        if (present(capabilities.resources())) {
            raw.put("resources", new ArrayList<>(capabilities.resources()));
        }
        if (present(capabilities.prompts())) {
            raw.put("prompts", new ArrayList<>(capabilities.prompts()));
        }
        return raw;
    }

    private static Map<String, Object> requirementsToRaw(Requirements requirements) {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (requirements == null) {
            return raw;
        }
        if (present(requirements.platforms())) {
            raw.put("platforms", new ArrayList<>(requirements.platforms()));
        }
        if (present(requirements.runtimes())) {
            raw.put("runtimes", new LinkedHashMap<>(requirements.runtimes()));
        }
        if (present(requirements.dependencies())) {
            raw.put("dependencies", new ArrayList<>(requirements.dependencies()));
        }
        if (requirements.network() != null) {
            raw.put("network", requirements.network());
        }
        return raw;
    }

    private static Map<String, Object> securityToRaw(Security security) {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (security == null) {
            return raw;
        }
        if (security.requiresAuth()) {
            raw.put("requires_auth", true);
        }
        if (present(security.permissions())) {
            raw.put("permissions", new ArrayList<>(security.permissions()));
        }
        if (security.sandbox()) {
            raw.put("sandbox", true);
        }
        return raw;
    }

    private static Map<String, Object> compatibilityToRaw(Compatibility compatibility) {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (compatibility == null) {
            return raw;
        }
        if (present(compatibility.claudeDesktop())) {
            raw.put("claude_desktop", compatibility.claudeDesktop());
        }
        if (present(compatibility.mcpconf())) {
            raw.put("mcpconf", compatibility.mcpconf());
        }
        return raw;
    }

    private static void putIfNotEmpty(Map<String, Object> target, String key, Map<String, Object> section) {
        if (!section.isEmpty()) {
            target.put(key, section);
        }
    }
}
