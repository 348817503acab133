package nl.vu.kai.ontostructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Typed view on an {@link AnalysisCache}: payloads of type {@code T} are stored as JSON.
 * Entries stamped with another version, and entries that cannot be decoded, are misses.
 */
public class VersionedCache<T> {

    private static final Logger log = LoggerFactory.getLogger(VersionedCache.class);

    private final AnalysisCache cache;
    private final ObjectMapper mapper;
    private final TypeReference<T> type;

    public VersionedCache(AnalysisCache cache, ObjectMapper mapper, TypeReference<T> type) {
        this.cache = cache;
        this.mapper = mapper;
        this.type = type;
    }

    public Optional<T> load(String key, long currentVersion) {
        Optional<CacheEntry<byte[]>> entry;
        try {
            entry = cache.get(key);
        } catch (CacheCorruptException e) {
            log.warn("{}, recomputing", e.getMessage(), e);
            return Optional.empty();
        }
        if (entry.isEmpty())
            return Optional.empty();
        if (!entry.get().isCurrent(currentVersion)) {
            log.debug("Cache entry {} is stale (version {} != {})", key, entry.get().getVersion(), currentVersion);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(entry.get().getPayload(), type));
        } catch (IOException e) {
            log.warn("Corrupt cache entry {}, recomputing", key, e);
            return Optional.empty();
        }
    }

    /**
     * Failing to persist is not fatal for an analysis; it only costs a recomputation next time.
     */
    public void store(String key, long version, T payload) {
        try {
            cache.put(key, version, mapper.writeValueAsBytes(payload));
        } catch (IOException e) {
            log.warn("Could not persist cache entry {}", key, e);
        }
    }
}
