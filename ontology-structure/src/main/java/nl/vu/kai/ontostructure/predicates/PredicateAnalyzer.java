package nl.vu.kai.ontostructure.predicates;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import nl.vu.kai.ontostructure.cache.AnalysisCache;
import nl.vu.kai.ontostructure.cache.CacheKeys;
import nl.vu.kai.ontostructure.cache.VersionedCache;
import nl.vu.kai.ontostructure.ranking.EntityCounter;
import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.QueryRow;
import nl.vu.kai.ontostructure.store.Store;
import nl.vu.kai.ontostructure.store.StoreOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Per-class predicate statistics. For every predicate used by instances of a class:
 * <ul>
 *     <li>frequency: share of instances using it</li>
 *     <li>uniqueness: distinct objects per use</li>
 *     <li>entropy: entropy of the object value distribution</li>
 *     <li>quality: summed over the subjects using it, the number of predicates of the class divided by
 *     the number of distinct predicates on that subject</li>
 * </ul>
 * Predicates whose objects are all distinct are dropped. The statistics of the predicates of one class
 * are computed in parallel and cached under the history version of the store.
 */
public class PredicateAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PredicateAnalyzer.class);

    private static final double UNIQUE = 1e-9;

    private static final String PREDICATES_QUERY =
            "SELECT DISTINCT ?p WHERE { ?s $type $cls . ?s ?p ?o . FILTER(?p != $type) } ORDER BY ?p";

    private static final String SUBJECTS_QUERY =
            "SELECT (COUNT(DISTINCT ?s) AS ?count) WHERE { ?s $type $cls . ?s $pred ?o }";

    private static final String OBJECTS_QUERY =
            "SELECT ?o (COUNT(*) AS ?count) WHERE { ?s $type $cls . ?s $pred ?o } GROUP BY ?o";

    private static final String SIBLINGS_QUERY =
            "SELECT ?s (COUNT(DISTINCT ?q) AS ?count) WHERE {\n" +
            "  ?s $type $cls .\n" +
            "  ?s $pred ?o .\n" +
            "  ?s ?q ?x .\n" +
            "  FILTER(?q != $type)\n" +
            "} GROUP BY ?s";

    private final Store store;
    private final VersionedCache<List<PredicateStats>> cache;
    private final String typePredicate;
    private final EntityCounter entityCounter;
    private final ExecutorService workers;

    public PredicateAnalyzer(Store store, AnalysisCache cache, ObjectMapper mapper, String typePredicate, int workerThreads) {
        this.store = store;
        this.cache = new VersionedCache<>(cache, mapper, new TypeReference<List<PredicateStats>>() {});
        this.typePredicate = typePredicate;
        this.entityCounter = new EntityCounter(store, typePredicate);
        this.workers = Executors.newFixedThreadPool(workerThreads,
                new ThreadFactoryBuilder().setNameFormat("predicate-stats-%d").setDaemon(true).build());
    }

    /**
     * @param classIri class to analyse
     * @param edgeRank traversal share per predicate leaving the class
     * @return the statistics, or empty when the class has no informative predicate
     */
    public Optional<List<PredicateStats>> analyze(String classIri, Map<String, Double> edgeRank) throws QueryFailedException {
        String key = CacheKeys.predicates(store.datasetName(), classIri);
        int version = store.historyVersion();

        List<PredicateStats> stats = cache.load(key, version).orElse(null);
        if (stats == null) {
            stats = compute(classIri);
            cache.store(key, version, stats);
        } else {
            log.debug("Using cached predicate statistics for {}", classIri);
        }

        if (stats.isEmpty())
            return Optional.empty();
        List<PredicateStats> result = new ArrayList<>(stats.size());
        for (PredicateStats s : stats)
            result.add(s.withEdgeRank(edgeRank.getOrDefault(s.getPredicate(), 0.0)));
        return Optional.of(result);
    }

    List<PredicateStats> compute(String classIri) throws QueryFailedException {
        List<String> predicates = new ArrayList<>();
        for (QueryRow row : store.query(bind(PREDICATES_QUERY, classIri, null)))
            predicates.add(row.value("p"));
        long total = entityCounter.count(classIri);
        if (predicates.isEmpty() || total == 0)
            return List.of();

        List<Callable<PredicateStats>> tasks = new ArrayList<>();
        for (String predicate : predicates)
            tasks.add(() -> statistics(classIri, predicate, total, predicates.size()));

        List<PredicateStats> raw = new ArrayList<>();
        try {
            for (Future<PredicateStats> future : workers.invokeAll(tasks))
                raw.add(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryFailedException(bind(PREDICATES_QUERY, classIri, null), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof QueryFailedException)
                throw (QueryFailedException) e.getCause();
            throw new IllegalStateException("Predicate statistics failed for " + classIri, e.getCause());
        }

        List<PredicateStats> informative = new ArrayList<>();
        for (PredicateStats s : raw) {
            if (Math.abs(s.getUniqueness() - 1) < UNIQUE)
                log.debug("Dropping {} on {}: every object is distinct", s.getPredicate(), classIri);
            else
                informative.add(s);
        }

        double[] entropy = PredicateStatistics.normalize(informative.stream().mapToDouble(PredicateStats::getEntropy).toArray());
        double[] quality = PredicateStatistics.normalize(informative.stream().mapToDouble(PredicateStats::getQuality).toArray());
        List<PredicateStats> result = new ArrayList<>(informative.size());
        for (int i = 0; i < informative.size(); i++)
            result.add(informative.get(i).withEntropyAndQuality(entropy[i], quality[i]));

        log.debug("{}: {} of {} predicates are informative", classIri, result.size(), predicates.size());
        return result;
    }

    private PredicateStats statistics(String classIri, String predicate, long total, int predicateCount)
            throws QueryFailedException {
        List<QueryRow> subjects = store.query(bind(SUBJECTS_QUERY, classIri, predicate));
        double frequency = subjects.isEmpty() ? 0 : subjects.get(0).number("count") / total;

        List<Double> groups = new ArrayList<>();
        for (QueryRow row : store.query(bind(OBJECTS_QUERY, classIri, predicate)))
            groups.add(row.number("count"));
        double uses = groups.stream().mapToDouble(Double::doubleValue).sum();
        double uniqueness = uses == 0 ? 0 : groups.size() / uses;
        double entropy = PredicateStatistics.entropy(groups);

        double quality = 0;
        for (QueryRow row : store.query(bind(SIBLINGS_QUERY, classIri, predicate))) {
            // the predicate itself is among the siblings, so the count is at least one
            quality += predicateCount / row.number("count");
        }
        return new PredicateStats(predicate, frequency, uniqueness, entropy, quality);
    }

    private String bind(String template, String classIri, String predicate) {
        if (predicate == null)
            return StoreOperations.bind(template, Map.of("type", typePredicate, "cls", classIri));
        return StoreOperations.bind(template, Map.of("type", typePredicate, "cls", classIri, "pred", predicate));
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS))
                workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
