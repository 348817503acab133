package nl.vu.kai.ontostructure.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A cached payload stamped with the history version it was computed at.
 */
public final class CacheEntry<T> {

    private final long version;
    private final T payload;

    @JsonCreator
    public CacheEntry(@JsonProperty("version") long version, @JsonProperty("payload") T payload) {
        this.version = version;
        this.payload = payload;
    }

    @JsonProperty("version")
    public long getVersion() {
        return version;
    }

    @JsonProperty("payload")
    public T getPayload() {
        return payload;
    }

    public boolean isCurrent(long currentVersion) {
        return version == currentVersion;
    }
}
