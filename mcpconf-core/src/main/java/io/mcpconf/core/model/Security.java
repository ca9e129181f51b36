package io.mcpconf.core.model;

import java.util.List;

public record Security(
    boolean requiresAuth,
    List<String> permissions,
    boolean sandbox
) {
    public Security {
        permissions = Copies.list(permissions);
    }
}
