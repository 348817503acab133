package nl.vu.kai.ontostructure;

import nl.vu.kai.ontostructure.classifier.Classifier;
import nl.vu.kai.ontostructure.store.HistoryLog;
import nl.vu.kai.ontostructure.store.JenaStore;
import org.apache.jena.query.DatasetFactory;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared test data. library.ttl holds 100 books, 80 persons and 10 reviews.
 */
public final class Fixtures {

    public static final String SCHEMA = "http://schema.org/";
    public static final String BOOK = SCHEMA + "Book";
    public static final String PERSON = SCHEMA + "Person";
    public static final String REVIEW = SCHEMA + "Review";
    public static final String AUTHOR = SCHEMA + "author";
    public static final String NAME = SCHEMA + "name";
    public static final String GENRE = SCHEMA + "genre";
    public static final String NATIONALITY = SCHEMA + "nationality";
    public static final String RDF_TYPE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#type";

    public static final long LIBRARY_TRIPLES = 670;

    private Fixtures() {
    }

    public static Path resource(String name) {
        try {
            return Paths.get(Fixtures.class.getResource("/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static JenaStore library(TemporaryFolder folder) throws IOException {
        return JenaStore.fromFile(resource("library.ttl"), folder.getRoot().toPath().resolve("library.history.txt"));
    }

    public static JenaStore empty(TemporaryFolder folder, String name) throws IOException {
        return new JenaStore(name, DatasetFactory.createTxnMem(),
                new HistoryLog(folder.getRoot().toPath().resolve(name + ".history.txt")));
    }

    /**
     * Classifier stub returning the same confidence for every predicate.
     */
    public static class FixedClassifier implements Classifier {

        private final double confidence;
        private int calls = 0;

        public FixedClassifier(double confidence) {
            this.confidence = confidence;
        }

        @Override
        public double score(double[] features) {
            calls++;
            return confidence;
        }

        public int getCalls() {
            return calls;
        }
    }
}
