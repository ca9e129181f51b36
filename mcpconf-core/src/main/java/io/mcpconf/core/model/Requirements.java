package io.mcpconf.core.model;

import java.util.List;
import java.util.Map;

public record Requirements(
    List<String> platforms,
    Map<String, String> runtimes,
    List<String> dependencies,
    Boolean network
) {
    public Requirements {
        platforms = Copies.list(platforms);
        runtimes = Copies.map(runtimes);
        dependencies = Copies.list(dependencies);
    }
}
