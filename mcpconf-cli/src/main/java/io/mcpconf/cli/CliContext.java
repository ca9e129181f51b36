package io.mcpconf.cli;

import io.mcpconf.core.store.DocumentCodec;
import io.mcpconf.core.store.FileRegistryStore;
import io.mcpconf.core.store.RegistryStore;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    Path registryPath,
    DocumentCodec codec,
    Function<Path, RegistryStore> storeFactory
) {
    public CliContext(Path registryPath) {
        this(registryPath, new DocumentCodec());
    }

    public CliContext(Path registryPath, DocumentCodec codec) {
        this(registryPath, codec, path -> new FileRegistryStore(path, codec));
    }
}
