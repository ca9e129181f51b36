package io.mcpconf.core.store;

import io.mcpconf.core.model.RegistryDocument;
import io.mcpconf.core.schema.RegistrySchema;
import io.mcpconf.core.schema.ServerEntryMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileRegistryStore implements RegistryStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileRegistryStore.class);

    private final Path path;
    private final DocumentCodec codec;

    public FileRegistryStore(Path path) {
        this(path, new DocumentCodec());
    }

    public FileRegistryStore(Path path, DocumentCodec codec) {
        this.path = path;
        this.codec = codec;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public RegistryDocument load() throws IOException {
        if (!Files.exists(path)) {
            LOG.debug("Registry {} does not exist, starting empty", path);
            return RegistryDocument.empty();
        }
        Map<String, Object> data = codec.read(path);
        if (data == null) {
            return RegistryDocument.empty();
        }
        RegistryDocument document = RegistrySchema.parseRegistry(data);
        LOG.debug("Loaded {} servers from {}", document.servers().size(), path);
        return document;
    }

    @Override
    public void save(RegistryDocument document) throws IOException {
        codec.write(path, ServerEntryMapper.toRawDocument(document));
        LOG.debug("Saved {} servers to {}", document.servers().size(), path);
    }
}
