package nl.vu.kai.ontostructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.vu.kai.ontostructure.predicates.PredicateStats;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class TestAnalysisCache {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();
    private FileAnalysisCache cache;

    @Before
    public void setUp() {
        cache = new FileAnalysisCache(folder.getRoot().toPath(), mapper);
    }

    @Test
    public void testRoundTrip() throws Exception {
        VersionedCache<List<PredicateStats>> typed =
                new VersionedCache<>(cache, mapper, new TypeReference<List<PredicateStats>>() {});
        PredicateStats stats = new PredicateStats("http://schema.org/author", 1.0, 0.8, 0.123456789, 1.0 / 3)
                .withEdgeRank(0.25);
        typed.store("predicates/library/http_schema.org_Book", 5, List.of(stats));

        Optional<CacheEntry<byte[]>> raw = cache.get("predicates/library/http_schema.org_Book");
        assertTrue(raw.isPresent());
        assertEquals(5, raw.get().getVersion());

        List<PredicateStats> loaded = typed.load("predicates/library/http_schema.org_Book", 5).orElseThrow();
        assertEquals(1, loaded.size());
        PredicateStats back = loaded.get(0);
        assertEquals("http://schema.org/author", back.getPredicate());
        assertEquals(1.0, back.getFrequency(), 1e-9);
        assertEquals(0.8, back.getUniqueness(), 1e-9);
        assertEquals(0.123456789, back.getEntropy(), 1e-9);
        assertEquals(1.0 / 3, back.getQuality(), 1e-9);
        assertEquals(0.25, back.getEdgeRank(), 1e-9);
    }

    @Test
    public void testMissingEntry() throws Exception {
        assertFalse(cache.get("relations/nothing").isPresent());
    }

    @Test
    public void testStaleEntryIsMiss() {
        VersionedCache<List<String>> typed = new VersionedCache<>(cache, mapper, new TypeReference<List<String>>() {});
        typed.store("relations/library", 3, List.of("a", "b"));
        assertEquals(List.of("a", "b"), typed.load("relations/library", 3).orElseThrow());
        assertFalse(typed.load("relations/library", 4).isPresent());
    }

    @Test
    public void testCorruptFile() throws Exception {
        Path file = cache.file("relations/library");
        Files.createDirectories(file.getParent());
        Files.write(file, "{\"version\": 2, \"payl".getBytes(StandardCharsets.UTF_8));
        try {
            cache.get("relations/library");
            fail("corrupt entry returned");
        } catch (CacheCorruptException e) {
            assertTrue(e.getMessage().contains("relations/library"));
        }

        VersionedCache<List<String>> typed = new VersionedCache<>(cache, mapper, new TypeReference<List<String>>() {});
        assertFalse(typed.load("relations/library", 2).isPresent());

        typed.store("relations/library", 2, List.of("x"));
        assertEquals(List.of("x"), typed.load("relations/library", 2).orElseThrow());
    }

    @Test
    public void testUndecodablePayloadIsMiss() throws Exception {
        Files.createDirectories(folder.getRoot().toPath().resolve("relations"));
        Files.write(cache.file("relations/library"), "{\"version\": 1, \"payload\": {\"not\": \"a list\"}}".getBytes(StandardCharsets.UTF_8));
        VersionedCache<List<String>> typed = new VersionedCache<>(cache, mapper, new TypeReference<List<String>>() {});
        assertFalse(typed.load("relations/library", 1).isPresent());
    }

    @Test
    public void testInMemoryCache() {
        InMemoryAnalysisCache memory = new InMemoryAnalysisCache();
        memory.put("k", 7, new byte[]{1, 2});
        assertTrue(memory.contains("k"));
        assertEquals(7, memory.get("k").orElseThrow().getVersion());
        assertArrayEquals(new byte[]{1, 2}, memory.get("k").orElseThrow().getPayload());
        assertFalse(memory.get("other").isPresent());
    }

    @Test
    public void testKeys() {
        assertEquals("http__schema.org_Book", CacheKeys.sanitize("<http://schema.org/Book>"));
        assertEquals("relations/library", CacheKeys.relations("library"));
        assertEquals("predicates/library/http__schema.org_Person", CacheKeys.predicates("library", "http://schema.org/Person"));
    }
}
