package io.mcpconf.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory registry: version, server entries keyed by id, and optional categories.
 * Category members are not required to exist in {@link #servers()}.
 */
public final class RegistryDocument {
    public static final String DEFAULT_VERSION = "1.0";

    private final String version;
    private final Map<String, ServerEntry> servers = new LinkedHashMap<>();
    private final Map<String, List<String>> categories = new LinkedHashMap<>();

    public RegistryDocument(String version) {
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    public RegistryDocument(String version, Map<String, ServerEntry> servers, Map<String, List<String>> categories) {
        this(version);
        if (servers != null) {
            this.servers.putAll(servers);
        }
        if (categories != null) {
            categories.forEach((name, members) -> this.categories.put(name, new ArrayList<>(members)));
        }
    }

    public static RegistryDocument empty() {
        return new RegistryDocument(DEFAULT_VERSION);
    }

    public String version() {
        return version;
    }

    public Map<String, ServerEntry> servers() {
        return Collections.unmodifiableMap(servers);
    }

    public Optional<ServerEntry> server(String id) {
        return Optional.ofNullable(servers.get(id));
    }

    public void putServer(String id, ServerEntry entry) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        servers.put(id, entry);
    }

    public boolean removeServer(String id) {
        return servers.remove(id) != null;
    }

    public Map<String, List<String>> categories() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        categories.forEach((name, members) -> copy.put(name, List.copyOf(members)));
        return Collections.unmodifiableMap(copy);
    }

    public List<String> category(String name) {
        List<String> members = categories.get(name);
        return members == null ? List.of() : List.copyOf(members);
    }

    public void addToCategory(String category, String id) {
        List<String> members = categories.computeIfAbsent(category, key -> new ArrayList<>());
        if (!members.contains(id)) {
            members.add(id);
        }
    }

    public boolean removeFromCategory(String category, String id) {
        List<String> members = categories.get(category);
        if (members == null || !members.remove(id)) {
            return false;
        }
        if (members.isEmpty()) {
            categories.remove(category);
        }
        return true;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RegistryDocument that)) {
            return false;
        }
        return version.equals(that.version) && servers.equals(that.servers) && categories.equals(that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, servers, categories);
    }

    @Override
    public String toString() {
        return "RegistryDocument[version=" + version + ", servers=" + servers.keySet() + ", categories=" + categories + "]";
    }
}
