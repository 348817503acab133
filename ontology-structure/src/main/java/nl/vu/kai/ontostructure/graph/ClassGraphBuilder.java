package nl.vu.kai.ontostructure.graph;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.vu.kai.ontostructure.cache.AnalysisCache;
import nl.vu.kai.ontostructure.cache.CacheKeys;
import nl.vu.kai.ontostructure.cache.VersionedCache;
import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.QueryRow;
import nl.vu.kai.ontostructure.store.RdfTerm;
import nl.vu.kai.ontostructure.store.Store;
import nl.vu.kai.ontostructure.store.StoreOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the class relation graph of a dataset. For every typed class the predicates used by
 * its instances are grouped by the type of their object; objects without a type are counted
 * against the {@link ClassGraph#LITERAL} sink.
 * <p>
 * The aggregated relations are cached under the history version of the store.
 */
public class ClassGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ClassGraphBuilder.class);

    private static final String CLASSES_QUERY =
            "SELECT DISTINCT ?class WHERE { ?s $type ?class }";

    private static final String RELATIONS_QUERY =
            "SELECT ?p ?otype (COUNT(*) AS ?count) WHERE {\n" +
            "  ?s $type $cls .\n" +
            "  ?s ?p ?o .\n" +
            "  FILTER(?p != $type)\n" +
            "  OPTIONAL { ?o $type ?otype }\n" +
            "} GROUP BY ?p ?otype";

    private final Store store;
    private final VersionedCache<ClassRelations> cache;
    private final String typePredicate;

    public ClassGraphBuilder(Store store, AnalysisCache cache, ObjectMapper mapper, String typePredicate) {
        this.store = store;
        this.cache = new VersionedCache<>(cache, mapper, new TypeReference<ClassRelations>() {});
        this.typePredicate = typePredicate;
    }

    public ClassGraph build() throws QueryFailedException {
        String key = CacheKeys.relations(store.datasetName());
        int version = store.historyVersion();

        Optional<ClassRelations> cached = cache.load(key, version);
        if (cached.isPresent()) {
            log.debug("Using cached relations for {}", store.datasetName());
            return cached.get().toGraph();
        }

        ClassRelations relations = queryRelations();
        cache.store(key, version, relations);
        ClassGraph graph = relations.toGraph();
        log.info("Built {} for {}", graph, store.datasetName());
        return graph;
    }

    ClassRelations queryRelations() throws QueryFailedException {
        List<String> classes = new ArrayList<>();
        for (QueryRow row : store.query(StoreOperations.bind(CLASSES_QUERY, Map.of("type", typePredicate)))) {
            Optional<RdfTerm> cls = row.get("class");
            if (cls.isPresent() && cls.get().isIri())
                classes.add(cls.get().value());
        }

        List<RelationCount> relations = new ArrayList<>();
        for (String cls : classes) {
            String query = StoreOperations.bind(RELATIONS_QUERY, Map.of("type", typePredicate, "cls", cls));
            for (QueryRow row : store.query(query)) {
                String predicate = row.value("p");
                Optional<RdfTerm> otype = row.get("otype");
                String target = otype.isPresent() && otype.get().isIri() ? otype.get().value() : ClassGraph.LITERAL;
                relations.add(new RelationCount(cls, predicate, target, row.number("count")));
            }
        }
        return new ClassRelations(classes, relations);
    }
}
