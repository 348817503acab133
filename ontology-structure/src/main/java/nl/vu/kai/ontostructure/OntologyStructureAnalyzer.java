package nl.vu.kai.ontostructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import nl.vu.kai.ontostructure.cache.AnalysisCache;
import nl.vu.kai.ontostructure.classifier.Classifier;
import nl.vu.kai.ontostructure.classifier.ClassifierUnavailableException;
import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.graph.ClassGraphBuilder;
import nl.vu.kai.ontostructure.graph.Reachability;
import nl.vu.kai.ontostructure.graph.ReachabilityOrderer;
import nl.vu.kai.ontostructure.mutation.MutationReport;
import nl.vu.kai.ontostructure.mutation.Mutator;
import nl.vu.kai.ontostructure.predicates.DecisionPolicy;
import nl.vu.kai.ontostructure.predicates.PredicateAnalyzer;
import nl.vu.kai.ontostructure.predicates.PredicateDecision;
import nl.vu.kai.ontostructure.predicates.PredicateStats;
import nl.vu.kai.ontostructure.predicates.ScoreFusion;
import nl.vu.kai.ontostructure.ranking.EntityCounter;
import nl.vu.kai.ontostructure.ranking.IterativePruner;
import nl.vu.kai.ontostructure.ranking.PruningResult;
import nl.vu.kai.ontostructure.ranking.RandomSource;
import nl.vu.kai.ontostructure.ranking.RandomWalkRanker;
import nl.vu.kai.ontostructure.ranking.SeededRandomSource;
import nl.vu.kai.ontostructure.store.QueryFailedException;
import nl.vu.kai.ontostructure.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides which classes and predicates of a dataset carry its structure.
 * <p>
 * {@link #analyze(String)} builds the class graph, prunes it from the given root and scores the
 * predicates of the surviving classes without touching the store. {@link #apply(AnalysisReport)}
 * writes the decisions back.
 */
public class OntologyStructureAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OntologyStructureAnalyzer.class);

    private final Store store;
    private final AnalyzerConfig config;
    private final ClassGraphBuilder graphBuilder;
    private final EntityCounter entityCounter;
    private final IterativePruner pruner;
    private final PredicateAnalyzer predicateAnalyzer;
    private final ScoreFusion scoreFusion;
    private final DecisionPolicy decisionPolicy;
    private final Mutator mutator;

    public OntologyStructureAnalyzer(Store store, AnalysisCache cache, Classifier classifier, AnalyzerConfig config) {
        this(store, cache, classifier, config,
                config.seed == null ? SeededRandomSource.unseeded() : new SeededRandomSource(config.seed));
    }

    public OntologyStructureAnalyzer(Store store, AnalysisCache cache, Classifier classifier, AnalyzerConfig config,
                                     RandomSource random) {
        ObjectMapper mapper = new ObjectMapper();
        this.store = store;
        this.config = config;
        this.graphBuilder = new ClassGraphBuilder(store, cache, mapper, config.typePredicate);
        this.entityCounter = new EntityCounter(store, config.typePredicate);
        this.pruner = new IterativePruner(new RandomWalkRanker(random, config.walks, config.walkLength), config.levels);
        this.predicateAnalyzer = new PredicateAnalyzer(store, cache, mapper, config.typePredicate, config.workerThreads);
        this.scoreFusion = new ScoreFusion(classifier);
        this.decisionPolicy = new DecisionPolicy(config.keepBudget, config.classifierThreshold);
        this.mutator = new Mutator(store, config.typePredicate, config.additionalTypePredicate);
    }

    public AnalysisReport analyze(String rootHint) throws AnalysisException {
        String root = ReachabilityOrderer.resolveRoot(config.classNamespace, rootHint);
        log.info("Analysing {} from root {}", store.datasetName(), root);

        ClassGraph graph;
        try {
            graph = graphBuilder.build();
        } catch (QueryFailedException e) {
            throw new AnalysisException(AnalysisPhase.GRAPH_BUILD, "Could not build the class graph", e);
        }
        if (!graph.contains(root) || graph.isLiteral(graph.node(root)))
            throw new AnalysisException(AnalysisPhase.GRAPH_BUILD, "Root class " + root + " does not occur in " + store.datasetName());
        List<Reachability> order = ReachabilityOrderer.order(graph, root);
        log.info("{} of {} classes are reachable from {}", order.size(), graph.classes().size(), root);

        PruningResult pruning;
        try {
            Map<String, Long> counts = entityCounter.count(
                    order.stream().map(Reachability::getClassIri).collect(Collectors.toList()));
            pruning = pruner.prune(graph, order, counts);
        } catch (QueryFailedException e) {
            throw new AnalysisException(AnalysisPhase.RANKING, "Could not count class instances", e);
        }
        pruning.getRanking().forEach(r -> log.debug("{}", r));

        Map<String, ClassAnalysis> classes = new LinkedHashMap<>();
        for (String cls : pruning.getKeepSet()) {
            try {
                classes.put(cls, analyzeClass(cls, pruning.getForwardRanks().edgeRank(cls)));
            } catch (QueryFailedException e) {
                throw new AnalysisException(AnalysisPhase.PREDICATE_ANALYSIS, "Predicate analysis failed for " + cls, e);
            } catch (ClassifierUnavailableException e) {
                throw new AnalysisException(AnalysisPhase.PREDICATE_ANALYSIS, "Classifier failed for " + cls, e);
            }
        }
        return new AnalysisReport(root, graph, pruning, classes);
    }

    private ClassAnalysis analyzeClass(String cls, Map<String, Double> edgeRank)
            throws QueryFailedException, ClassifierUnavailableException {
        Optional<List<PredicateStats>> stats = predicateAnalyzer.analyze(cls, edgeRank);
        if (stats.isEmpty()) {
            log.warn("No informative predicates for {}", cls);
            return ClassAnalysis.uninformative(cls);
        }
        List<PredicateDecision> decisions = decisionPolicy.decide(scoreFusion.computeScores(stats.get()));
        decisions.forEach(d -> log.debug("{}: {}", cls, d));
        return ClassAnalysis.of(cls, decisions);
    }

    public MutationReport apply(AnalysisReport report) throws AnalysisException {
        try {
            return mutator.apply(report.getRemovedClasses(), report.getDroppedPredicates(), report.getClassScores());
        } catch (QueryFailedException e) {
            throw new AnalysisException(AnalysisPhase.MUTATION,
                    "Mutation failed, updates before it remain applied", e);
        }
    }

    @Override
    public void close() {
        predicateAnalyzer.close();
    }
}
