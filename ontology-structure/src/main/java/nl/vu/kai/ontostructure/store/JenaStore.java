package nl.vu.kai.ontostructure.store;

import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ReadWrite;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFLanguages;
import org.apache.jena.riot.RiotException;
import org.apache.jena.shared.JenaException;
import org.apache.jena.update.UpdateAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Store} over an in-memory transactional Jena dataset.
 */
public class JenaStore implements Store {

    private static final Logger log = LoggerFactory.getLogger(JenaStore.class);

    private final String name;
    private final Dataset dataset;
    private final HistoryLog history;

    public JenaStore(String name, Dataset dataset, HistoryLog history) {
        this.name = name;
        this.dataset = dataset;
        this.history = history;
    }

    /**
     * Loads a Turtle, N-Triples or N-Quads file into a fresh dataset.
     *
     * @param historyFile audit log of the dataset, created when missing
     */
    public static JenaStore fromFile(Path file, Path historyFile) throws IOException {
        Lang lang = RDFLanguages.filenameToLang(file.getFileName().toString());
        if (lang == null)
            throw new IOException("Format not supported, provide a .ttl, .nt or .nq file: " + file);

        Dataset dataset = DatasetFactory.createTxnMem();
        dataset.begin(ReadWrite.WRITE);
        try {
            RDFDataMgr.read(dataset, file.toUri().toString(), lang);
            dataset.commit();
        } catch (RiotException e) {
            dataset.abort();
            throw new IOException("Cannot parse " + file, e);
        } finally {
            dataset.end();
        }

        JenaStore store = new JenaStore(datasetName(file), dataset, new HistoryLog(historyFile));
        try {
            log.info("Loaded {} ({} triples)", file, StoreOperations.countTriples(store));
        } catch (QueryFailedException e) {
            throw new IOException("Cannot count the triples of " + file, e);
        }
        return store;
    }

    public static String datasetName(Path file) {
        String fileName = file.getFileName().toString();
        for (String extension : new String[]{".nt", ".ttl", ".nq", ".db"}) {
            if (fileName.endsWith(extension))
                return fileName.substring(0, fileName.length() - extension.length());
        }
        return fileName;
    }

    @Override
    public List<QueryRow> query(String sparql) throws QueryFailedException {
        dataset.begin(ReadWrite.READ);
        try (QueryExecution qexec = QueryExecutionFactory.create(sparql, dataset)) {
            ResultSet results = qexec.execSelect();
            List<String> variables = results.getResultVars();
            List<QueryRow> rows = new ArrayList<>();
            while (results.hasNext()) {
                QuerySolution solution = results.next();
                Map<String, RdfTerm> bindings = new LinkedHashMap<>();
                for (String variable : variables) {
                    RDFNode node = solution.get(variable);
                    if (node != null)
                        bindings.put(variable, toTerm(node));
                }
                rows.add(new QueryRow(bindings));
            }
            return rows;
        } catch (JenaException e) {
            throw new QueryFailedException(sparql, e);
        } finally {
            dataset.end();
        }
    }

    @Override
    public void update(String sparql) throws QueryFailedException {
        dataset.begin(ReadWrite.WRITE);
        try {
            UpdateAction.parseExecute(sparql, dataset);
            dataset.commit();
        } catch (JenaException e) {
            dataset.abort();
            throw new QueryFailedException(sparql, e);
        } finally {
            dataset.end();
        }
    }

    @Override
    public int historyVersion() {
        return history.lineCount();
    }

    @Override
    public void writeHistory(String line) {
        history.append(line);
    }

    @Override
    public String datasetName() {
        return name;
    }

    public HistoryLog getHistory() {
        return history;
    }

    private static RdfTerm toTerm(RDFNode node) {
        if (node.isURIResource())
            return RdfTerm.iri(node.asResource().getURI());
        else if (node.isLiteral()) {
            Literal literal = node.asLiteral();
            return RdfTerm.literal(literal.getLexicalForm(), literal.getDatatypeURI(), literal.getLanguage());
        }
        else
            return RdfTerm.blank(node.asResource().getId().getLabelString());
    }
}
