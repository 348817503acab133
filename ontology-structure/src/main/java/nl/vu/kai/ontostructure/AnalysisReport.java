package nl.vu.kai.ontostructure;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.ranking.ClassRoundRecord;
import nl.vu.kai.ontostructure.ranking.PruningResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of an analysis run, before anything is written back to the store.
 */
public final class AnalysisReport {

    private final String rootIri;
    private final ClassGraph graph;
    private final PruningResult pruning;
    private final Map<String, ClassAnalysis> classes;

    public AnalysisReport(String rootIri, ClassGraph graph, PruningResult pruning, Map<String, ClassAnalysis> classes) {
        this.rootIri = rootIri;
        this.graph = graph;
        this.pruning = pruning;
        this.classes = ImmutableMap.copyOf(classes);
    }

    public String getRootIri() {
        return rootIri;
    }

    /**
     * The full class graph the run started from.
     */
    public ClassGraph getGraph() {
        return graph;
    }

    public PruningResult getPruning() {
        return pruning;
    }

    public List<String> getKeepSet() {
        return pruning.getKeepSet();
    }

    /**
     * Classes of the graph that are not kept, unreachable ones included.
     */
    public List<String> getRemovedClasses() {
        return graph.classes().stream()
                .filter(cls -> !pruning.isKept(cls))
                .sorted()
                .collect(Collectors.toList());
    }

    public List<ClassRoundRecord> getClassRanking() {
        return pruning.getRanking();
    }

    public Map<String, Double> getClassScores() {
        return pruning.getScores();
    }

    public Optional<ClassAnalysis> getClassAnalysis(String classIri) {
        return Optional.ofNullable(classes.get(classIri));
    }

    public Map<String, ClassAnalysis> getClassAnalyses() {
        return classes;
    }

    public ListMultimap<String, String> getDroppedPredicates() {
        ListMultimap<String, String> dropped = ArrayListMultimap.create();
        classes.values().forEach(c -> dropped.putAll(c.getClassIri(), c.droppedPredicates()));
        return dropped;
    }
}
