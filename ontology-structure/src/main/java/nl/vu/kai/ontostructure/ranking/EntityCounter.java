package nl.vu.kai.ontostructure.ranking;

import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.QueryRow;
import nl.vu.kai.ontostructure.store.Store;
import nl.vu.kai.ontostructure.store.StoreOperations;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Number of distinct instances per class.
 */
public class EntityCounter {

    private static final String COUNT_QUERY =
            "SELECT (COUNT(DISTINCT ?s) AS ?count) WHERE { ?s $type $cls }";

    private final Store store;
    private final String typePredicate;

    public EntityCounter(Store store, String typePredicate) {
        this.store = store;
        this.typePredicate = typePredicate;
    }

    public long count(String classIri) throws QueryFailedException {
        List<QueryRow> rows = store.query(StoreOperations.bind(COUNT_QUERY, Map.of("type", typePredicate, "cls", classIri)));
        return rows.isEmpty() ? 0 : (long) rows.get(0).number("count");
    }

    public Map<String, Long> count(Collection<String> classes) throws QueryFailedException {
        Map<String, Long> result = new LinkedHashMap<>();
        for (String cls : classes)
            result.put(cls, count(cls));
        return result;
    }
}
