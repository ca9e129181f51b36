package io.mcpconf.core.store;

import io.mcpconf.core.model.RegistryDocument;
import java.io.IOException;

public interface RegistryStore {
    RegistryDocument load() throws IOException;

    void save(RegistryDocument document) throws IOException;
}
