package nl.vu.kai.ontostructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Small procedures built on top of {@link Store}.
 */
public final class StoreOperations {

    private static final Logger log = LoggerFactory.getLogger(StoreOperations.class);

    private StoreOperations() {
    }

    public static String iri(String iri) {
        return "<" + iri + ">";
    }

    /**
     * Number of triples in the default graph.
     */
    public static long countTriples(Store store) throws QueryFailedException {
        List<QueryRow> rows = store.query("SELECT (COUNT(*) AS ?count) WHERE { ?s ?p ?o }");
        return rows.isEmpty() ? 0 : (long) rows.get(0).number("count");
    }

    /**
     * Runs {@code select}, then for every row runs {@code updateTemplate} with each {@code {{variable}}}
     * replaced by the SPARQL rendering of the bound term.
     *
     * @return number of updates executed
     */
    public static int iterativeUpdate(Store store, String select, String updateTemplate) throws QueryFailedException {
        List<QueryRow> rows = store.query(select);
        for (QueryRow row : rows) {
            String update = updateTemplate;
            for (String variable : row.variables()) {
                RdfTerm term = row.get(variable).orElseThrow();
                update = update.replace("{{" + variable + "}}", term.toSparql());
            }
            store.update(update);
        }
        log.debug("Ran {} templated updates", rows.size());
        return rows.size();
    }

    /**
     * Replaces every {@code $key} placeholder with the bracketed IRI bound to {@code key}.
     */
    public static String bind(String template, Map<String, String> iris) {
        String result = template;
        for (Map.Entry<String, String> entry : iris.entrySet())
            result = result.replace("$" + entry.getKey(), iri(entry.getValue()));
        return result;
    }
}
