package nl.vu.kai.ontostructure.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAnalysisCache implements AnalysisCache {

    private final Map<String, CacheEntry<byte[]>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry<byte[]>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, long version, byte[] payload) {
        entries.put(key, new CacheEntry<>(version, payload.clone()));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }
}
