package nl.vu.kai.ontostructure.mutation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.Store;
import nl.vu.kai.ontostructure.store.StoreOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes analysis decisions back to the store. Every update is recorded in the store history: a plain
 * line describing the decision, then the executed SPARQL once it succeeded.
 * <p>
 * Updates are not grouped in a transaction; when one fails, the ones before it stay applied.
 */
public class Mutator {

    private static final Logger log = LoggerFactory.getLogger(Mutator.class);

    private static final String DELETE_SINGLY_TYPED =
            "DELETE { ?s ?p ?o } WHERE {\n" +
            "  ?s $type $cls .\n" +
            "  FILTER NOT EXISTS { ?s $type ?other . FILTER(?other != $cls) }\n" +
            "  ?s ?p ?o\n" +
            "}";

    private static final String DELETE_TYPE =
            "DELETE WHERE { ?s $type $cls }";

    private static final String DROP_PREDICATE =
            "DELETE { ?s $pred ?o } WHERE { ?s $type $cls . ?s $pred ?o }";

    private static final String MERGE_TEMPLATE =
            "DELETE { ?sub ?pred {{s2}} }\n" +
            "INSERT { ?sub ?pred {{s1}} }\n" +
            "WHERE { ?sub ?pred {{s2}} } ;\n" +
            "DELETE { {{s2}} ?p ?o }\n" +
            "INSERT { {{s1}} ?p ?o }\n" +
            "WHERE { {{s2}} ?p ?o }";

    private final Store store;
    private final String typePredicate;
    private final DuplicateTypeResolver duplicateTypes;

    public Mutator(Store store, String typePredicate, String additionalTypePredicate) {
        this.store = store;
        this.typePredicate = typePredicate;
        this.duplicateTypes = new DuplicateTypeResolver(store, typePredicate, additionalTypePredicate);
    }

    static String sparqlBlock(String sparql) {
        return "```sparql\n" + sparql + "\n```";
    }

    /**
     * Removes the given classes, drops the given predicates and resolves duplicate types.
     *
     * @param removedClasses    classes that did not survive pruning
     * @param droppedPredicates class to predicates to delete from its instances
     * @param classScores       final class scores, used to pick the primary type
     */
    public MutationReport apply(Collection<String> removedClasses, ListMultimap<String, String> droppedPredicates,
                                Map<String, Double> classScores) throws QueryFailedException {
        long before = StoreOperations.countTriples(store);

        List<String> removed = new ArrayList<>();
        for (String cls : removedClasses) {
            removeClass(cls);
            removed.add(cls);
        }

        ListMultimap<String, String> dropped = ArrayListMultimap.create();
        for (Map.Entry<String, String> entry : droppedPredicates.entries()) {
            if (removed.contains(entry.getKey()))
                continue;
            dropPredicate(entry.getKey(), entry.getValue());
            dropped.put(entry.getKey(), entry.getValue());
        }

        int rewrites = duplicateTypes.resolve(classScores);

        long after = StoreOperations.countTriples(store);
        MutationReport report = new MutationReport(removed, dropped, rewrites, before, after);
        log.info("Applied decisions: {}", report);
        return report;
    }

    /**
     * Deletes the entities typed only with {@code classIri}, then every remaining assertion of it.
     */
    public void removeClass(String classIri) throws QueryFailedException {
        Map<String, String> binding = Map.of("type", typePredicate, "cls", classIri);
        store.writeHistory("Removing class " + classIri);
        run(StoreOperations.bind(DELETE_SINGLY_TYPED, binding));
        run(StoreOperations.bind(DELETE_TYPE, binding));
    }

    public void dropPredicate(String classIri, String predicate) throws QueryFailedException {
        store.writeHistory("Dropping predicate " + predicate + " from " + classIri);
        run(StoreOperations.bind(DROP_PREDICATE, Map.of("type", typePredicate, "cls", classIri, "pred", predicate)));
    }

    /**
     * Merges instances of {@code classIri} that agree on the values of all {@code predicates}: the entity with
     * the smaller IRI takes over the triples of the other one and every reference to it.
     *
     * @return number of merged pairs
     */
    public int mergeEntities(String classIri, List<String> predicates) throws QueryFailedException {
        Preconditions.checkArgument(!predicates.isEmpty(), "merging needs at least one predicate");
        StringBuilder criteria = new StringBuilder();
        for (int i = 0; i < predicates.size(); i++) {
            String p = StoreOperations.iri(predicates.get(i));
            criteria.append("  ?s1 ").append(p).append(" ?o").append(i).append(" . ")
                    .append("?s2 ").append(p).append(" ?o").append(i).append(" .\n");
        }
        String select = "SELECT ?s1 ?s2 WHERE {\n" +
                "  ?s1 " + StoreOperations.iri(typePredicate) + " " + StoreOperations.iri(classIri) + " .\n" +
                "  ?s2 " + StoreOperations.iri(typePredicate) + " " + StoreOperations.iri(classIri) + " .\n" +
                criteria +
                "  FILTER(STR(?s1) < STR(?s2))\n" +
                "}";

        store.writeHistory("Merging " + classIri + " entities sharing " + predicates);
        int merged = StoreOperations.iterativeUpdate(store, select, MERGE_TEMPLATE);
        store.writeHistory(sparqlBlock(select + "\n#\n" + MERGE_TEMPLATE));
        log.info("Merged {} pairs of {} entities", merged, classIri);
        return merged;
    }

    private void run(String update) throws QueryFailedException {
        store.update(update);
        store.writeHistory(sparqlBlock(update));
        log.debug("Executed {}", update);
    }
}
