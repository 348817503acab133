package nl.vu.kai.ontostructure.cache;

import java.io.IOException;

/**
 * A cache entry exists but cannot be read back.
 */
public class CacheCorruptException extends IOException {

    public CacheCorruptException(String key, Throwable cause) {
        super("Corrupt cache entry " + key, cause);
    }
}
