package nl.vu.kai.ontostructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores every entry as {@code <directory>/<key>.json} holding {@code {"version": n, "payload": ...}}.
 * Payloads must be JSON documents.
 */
public class FileAnalysisCache implements AnalysisCache {

    private final Path directory;
    private final ObjectMapper mapper;

    public FileAnalysisCache(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public Optional<CacheEntry<byte[]>> get(String key) throws CacheCorruptException {
        Path file = file(key);
        if (!Files.exists(file))
            return Optional.empty();
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.has("version") || !root.has("payload"))
                throw new CacheCorruptException(key, new IOException("Missing version or payload in " + file));
            JsonNode version = root.get("version");
            if (!version.canConvertToLong())
                throw new CacheCorruptException(key, new IOException("Version is not an integer in " + file));
            return Optional.of(new CacheEntry<>(version.asLong(), mapper.writeValueAsBytes(root.get("payload"))));
        } catch (CacheCorruptException e) {
            throw e;
        } catch (IOException e) {
            throw new CacheCorruptException(key, e);
        }
    }

    @Override
    public void put(String key, long version, byte[] payload) throws IOException {
        Path file = file(key);
        Files.createDirectories(file.getParent());

        ObjectNode root = mapper.createObjectNode();
        root.put("version", version);
        try {
            root.set("payload", mapper.readTree(payload));
        } catch (JsonProcessingException e) {
            throw new IOException("Payload for " + key + " is not JSON", e);
        }

        Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        mapper.writeValue(tmp.toFile(), root);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    Path file(String key) {
        return directory.resolve(key + ".json");
    }
}
