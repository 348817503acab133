package nl.vu.kai.ontostructure.mutation;

import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.QueryRow;
import nl.vu.kai.ontostructure.store.Store;
import nl.vu.kai.ontostructure.store.StoreOperations;
import nl.vu.kai.ontostructure.tools.UnorderedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Makes every entity carry at most one primary type. For each pair of classes asserted on the same
 * entity the class with the higher score stays the type and the other one is moved to the additional
 * type predicate. Classes without a score count as zero; equal scores go to the lexicographically
 * smaller IRI. Runs until no entity has two types left.
 * <p>
 * Each rewrite is a separate update, so a failure leaves the rewrites done so far in place.
 */
public class DuplicateTypeResolver {

    private static final Logger log = LoggerFactory.getLogger(DuplicateTypeResolver.class);

    private static final String CONFLICTS_QUERY =
            "SELECT DISTINCT ?a ?b WHERE {\n" +
            "  ?e $type ?a .\n" +
            "  ?e $type ?b .\n" +
            "  FILTER(isIRI(?a) && isIRI(?b) && STR(?a) < STR(?b))\n" +
            "} ORDER BY ?a ?b";

    private static final String DEMOTE_UPDATE =
            "DELETE { ?e $type $loser }\n" +
            "INSERT { ?e $additional $loser }\n" +
            "WHERE { ?e $type $winner . ?e $type $loser }";

    private static final String COOCCURRENCE_QUERY =
            "SELECT ?e WHERE { ?e $type $winner . ?e $type $loser } LIMIT 1";

    private final Store store;
    private final String typePredicate;
    private final String additionalTypePredicate;

    public DuplicateTypeResolver(Store store, String typePredicate, String additionalTypePredicate) {
        this.store = store;
        this.typePredicate = typePredicate;
        this.additionalTypePredicate = additionalTypePredicate;
    }

    /**
     * @return number of rewrites that changed the store
     */
    public int resolve(Map<String, Double> classScores) throws QueryFailedException {
        int rewrites = 0;
        while (true) {
            Set<UnorderedPair<String>> conflicts = conflicts();
            if (conflicts.isEmpty())
                break;
            for (UnorderedPair<String> conflict : conflicts) {
                String winner = winner(conflict, classScores);
                String loser = winner.equals(conflict.getKey()) ? conflict.getValue() : conflict.getKey();

                Map<String, String> binding = Map.of(
                        "type", typePredicate,
                        "additional", additionalTypePredicate,
                        "winner", winner,
                        "loser", loser);
                // an earlier rewrite in this pass may already have demoted the loser
                if (store.query(StoreOperations.bind(COOCCURRENCE_QUERY, binding)).isEmpty())
                    continue;

                String update = StoreOperations.bind(DEMOTE_UPDATE, binding);
                store.writeHistory("Duplicate types " + winner + " and " + loser + ": keeping " + winner);
                store.update(update);
                store.writeHistory(Mutator.sparqlBlock(update));
                log.info("Demoted {} to additional type where {} is asserted", loser, winner);
                rewrites++;
            }
        }
        return rewrites;
    }

    Set<UnorderedPair<String>> conflicts() throws QueryFailedException {
        Set<UnorderedPair<String>> result = new LinkedHashSet<>();
        for (QueryRow row : store.query(StoreOperations.bind(CONFLICTS_QUERY, Map.of("type", typePredicate))))
            result.add(new UnorderedPair<>(row.value("a"), row.value("b")));
        return result;
    }

    static String winner(UnorderedPair<String> conflict, Map<String, Double> classScores) {
        String a = conflict.getKey();
        String b = conflict.getValue();
        int byScore = Double.compare(classScores.getOrDefault(a, 0.0), classScores.getOrDefault(b, 0.0));
        if (byScore != 0)
            return byScore > 0 ? a : b;
        return a.compareTo(b) <= 0 ? a : b;
    }
}
