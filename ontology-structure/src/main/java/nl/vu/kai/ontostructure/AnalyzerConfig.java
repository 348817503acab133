package nl.vu.kai.ontostructure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.semanticweb.owlapi.vocab.OWLRDFVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Analyzer settings. Defaults live in the fields; {@link #validate()} puts out-of-range values back to them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String DEFAULT_NAMESPACE = "http://schema.org/";

    public String classNamespace = DEFAULT_NAMESPACE;
    public String typePredicate = OWLRDFVocabulary.RDF_TYPE.getIRI().toString();
    public String additionalTypePredicate = DEFAULT_NAMESPACE + "additionalType";

    // pruning
    public int levels = 3;
    public int walks = 10_000;
    public int walkLength = 10;
    /** Seed for the walk simulation. Absent means a fresh seed per run. */
    public Long seed = null;

    // predicate decisions
    public double keepBudget = 60;
    public double classifierThreshold = 0.5;
    public int workerThreads = 4;

    public String cacheDirectory = "cache";
    public String modelPath = "ml/model.onnx";

    /**
     * Reads the configuration from a JSON file, or returns the defaults when there is none.
     */
    public static AnalyzerConfig load(Path configFile, ObjectMapper mapper) throws IOException {
        if (configFile == null || !Files.exists(configFile)) {
            log.info("No config file {}, using defaults", configFile);
            AnalyzerConfig defaults = new AnalyzerConfig();
            defaults.validate();
            return defaults;
        }
        AnalyzerConfig cfg = mapper.readValue(configFile.toFile(), AnalyzerConfig.class);
        if (cfg == null) cfg = new AnalyzerConfig();
        cfg.validate();
        return cfg;
    }

    public void validate() {
        if (classNamespace == null || classNamespace.isBlank()) classNamespace = DEFAULT_NAMESPACE;
        if (typePredicate == null || typePredicate.isBlank()) typePredicate = OWLRDFVocabulary.RDF_TYPE.getIRI().toString();
        if (additionalTypePredicate == null || additionalTypePredicate.isBlank())
            additionalTypePredicate = DEFAULT_NAMESPACE + "additionalType";

        if (levels < 1) levels = 1;
        if (walks < 1) walks = 1;
        if (walkLength < 0) walkLength = 0;

        if (!Double.isFinite(keepBudget)) keepBudget = 60;
        if (!Double.isFinite(classifierThreshold) || classifierThreshold < 0 || classifierThreshold > 1)
            classifierThreshold = 0.5;
        if (workerThreads < 1) workerThreads = 1;

        if (cacheDirectory == null || cacheDirectory.isBlank()) cacheDirectory = "cache";
        if (modelPath == null || modelPath.isBlank()) modelPath = "ml/model.onnx";
    }
}
