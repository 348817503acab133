package nl.vu.kai.ontostructure.cmd;

import com.fasterxml.jackson.databind.ObjectMapper;
import nl.vu.kai.ontostructure.AnalysisException;
import nl.vu.kai.ontostructure.AnalysisReport;
import nl.vu.kai.ontostructure.AnalyzerConfig;
import nl.vu.kai.ontostructure.OntologyStructureAnalyzer;
import nl.vu.kai.ontostructure.SchemaSummaryConverter;
import nl.vu.kai.ontostructure.cache.FileAnalysisCache;
import nl.vu.kai.ontostructure.classifier.ClassifierUnavailableException;
import nl.vu.kai.ontostructure.classifier.OnnxClassifier;
import nl.vu.kai.ontostructure.mutation.MutationReport;
import nl.vu.kai.ontostructure.store.JenaStore;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.OWLOntology;
import org.semanticweb.owlapi.model.OWLOntologyCreationException;
import org.semanticweb.owlapi.model.OWLOntologyManager;
import org.semanticweb.owlapi.model.OWLOntologyStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AnalyzeDataset {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeDataset.class);

    public static void main(String[] args) throws IOException, AnalysisException, ClassifierUnavailableException,
            OWLOntologyCreationException, OWLOntologyStorageException {
        if(args.length<2 || args.length>3){
            System.out.println("Usage:");
            System.out.println(AnalyzeDataset.class.getName()+" DATASET_FILE ROOT_CLASS [CONFIG_JSON]");
            System.exit(0);
        }

        Path datasetFile = Paths.get(args[0]);
        String rootClass = args[1];
        ObjectMapper mapper = new ObjectMapper();
        AnalyzerConfig config = AnalyzerConfig.load(args.length == 3 ? Paths.get(args[2]) : null, mapper);

        log.info("Dataset: {}", datasetFile);
        log.info("Root class: {}", rootClass);
        log.info("Cache directory: {}", config.cacheDirectory);

        Path cacheDirectory = Paths.get(config.cacheDirectory);
        JenaStore store = JenaStore.fromFile(datasetFile,
                cacheDirectory.resolve(JenaStore.datasetName(datasetFile) + ".history.txt"));

        AnalysisReport report;
        try (OnnxClassifier classifier = OnnxClassifier.load(Paths.get(config.modelPath));
             OntologyStructureAnalyzer analyzer = new OntologyStructureAnalyzer(
                     store, new FileAnalysisCache(cacheDirectory, mapper), classifier, config)) {
            report = analyzer.analyze(rootClass);
            report.getClassRanking().forEach(r -> log.info("{}", r));
            report.getClassAnalyses().values().forEach(c ->
                    c.getDecisions().ifPresent(ds -> ds.forEach(d -> log.info("{}: {}", c.getClassIri(), d))));

            MutationReport mutations = analyzer.apply(report);
            log.info("{}", mutations);
        }

        OWLOntologyManager manager = OWLManager.createOWLOntologyManager();
        SchemaSummaryConverter converter = new SchemaSummaryConverter(manager);
        OWLOntology summary = converter.convert(report);
        converter.addScores2Label(summary, report);
        log.info("Saving the schema summary");
        try (OutputStream out = new FileOutputStream(new File("schema-summary.owl"))) {
            manager.saveOntology(summary, out);
        }
    }
}
