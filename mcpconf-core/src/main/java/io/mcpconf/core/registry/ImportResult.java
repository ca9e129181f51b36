package io.mcpconf.core.registry;

import java.util.List;
import java.util.Map;

public record ImportResult(
    List<String> imported,
    Map<String, Map<String, String>> skipped
) {
    public int importedCount() {
        return imported.size();
    }
}
