package nl.vu.kai.ontostructure.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Versioned key-value storage for analysis results.
 */
public interface AnalysisCache {

    Optional<CacheEntry<byte[]>> get(String key) throws CacheCorruptException;

    void put(String key, long version, byte[] payload) throws IOException;
}
