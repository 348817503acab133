package nl.vu.kai.ontostructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class TestAnalyzerConfig {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() throws Exception {
        AnalyzerConfig config = AnalyzerConfig.load(folder.getRoot().toPath().resolve("missing.json"), new ObjectMapper());
        assertEquals("http://schema.org/", config.classNamespace);
        assertEquals(Fixtures.RDF_TYPE, config.typePredicate);
        assertEquals(3, config.levels);
        assertEquals(10_000, config.walks);
        assertEquals(10, config.walkLength);
        assertEquals(60, config.keepBudget, 0);
        assertEquals(0.5, config.classifierThreshold, 0);
        assertNull(config.seed);
    }

    @Test
    public void testLoadAndValidate() throws Exception {
        Path file = folder.getRoot().toPath().resolve("analyzer.json");
        Files.write(file, ("{\"levels\": 0, \"walks\": 500, \"seed\": 17, \"classifierThreshold\": 3," +
                " \"cacheDirectory\": \"\", \"unknown\": true}").getBytes(StandardCharsets.UTF_8));

        AnalyzerConfig config = AnalyzerConfig.load(file, new ObjectMapper());
        assertEquals(1, config.levels);
        assertEquals(500, config.walks);
        assertEquals(Long.valueOf(17), config.seed);
        assertEquals(0.5, config.classifierThreshold, 0);
        assertEquals("cache", config.cacheDirectory);
    }
}
