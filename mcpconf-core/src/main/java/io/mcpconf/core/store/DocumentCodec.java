package io.mcpconf.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes untyped document trees as JSON or YAML, chosen by file extension.
 */
public final class DocumentCodec {
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentCodec() {
        jsonMapper = new ObjectMapper();
        yamlMapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    }

    public static boolean isYaml(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    /**
     * Returns the decoded top-level mapping, or {@code null} when the file has no content.
     */
    public Map<String, Object> read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return null;
        }
        return mapperFor(path).readValue(text, TREE);
    }

    public void write(Path path, Object document) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String text = mapperFor(path).writerWithDefaultPrettyPrinter().writeValueAsString(document);
        if (!text.endsWith(System.lineSeparator())) {
            text = text + System.lineSeparator();
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, text, StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public String toPrettyJson(Object document) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        return isYaml(path) ? yamlMapper : jsonMapper;
    }
}
