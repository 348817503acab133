package nl.vu.kai.ontostructure.ranking;

import com.google.common.base.Preconditions;
import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.graph.Direction;
import nl.vu.kai.ontostructure.graph.ProbabilityModel;
import nl.vu.kai.ontostructure.graph.Reachability;
import nl.vu.kai.ontostructure.tools.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shrinks the class graph over a fixed number of rounds. Each round ranks the remaining classes in
 * both directions, scores them from instance share, depth and rank, and keeps the best classes until
 * their softmax mass exceeds {@code (round + 1) / (levels + 1)}.
 */
public class IterativePruner {

    private static final Logger log = LoggerFactory.getLogger(IterativePruner.class);

    public static final int DEFAULT_LEVELS = 3;

    private static class ScoreComparator implements Comparator<Pair<String, Double>> {

        @Override
        public int compare(Pair<String, Double> o1, Pair<String, Double> o2) {
            int result = o2.getValue().compareTo(o1.getValue());
            if (result == 0)
                return o1.getKey().compareTo(o2.getKey());
            else
                return result;
        }
    }

    private final RandomWalkRanker ranker;
    private final int levels;

    public IterativePruner(RandomWalkRanker ranker) {
        this(ranker, DEFAULT_LEVELS);
    }

    public IterativePruner(RandomWalkRanker ranker, int levels) {
        Preconditions.checkArgument(levels > 0, "at least one round is needed");
        this.ranker = ranker;
        this.levels = levels;
    }

    /**
     * @param graph        class graph, probabilities are recomputed every round
     * @param order        reachable classes as produced by the reachability orderer
     * @param entityCounts instance count per class
     */
    public PruningResult prune(ClassGraph graph, List<Reachability> order, Map<String, Long> entityCounts) {
        List<Reachability> remaining = new ArrayList<>(order);
        Set<String> reachable = remaining.stream().map(Reachability::getClassIri).collect(Collectors.toSet());

        List<String> unreachable = new ArrayList<>(graph.classes());
        unreachable.removeAll(reachable);
        ClassGraph current = graph.withoutNodes(unreachable);

        Map<String, Long> counts = new LinkedHashMap<>();
        for (Reachability r : remaining)
            counts.put(r.getClassIri(), entityCounts.getOrDefault(r.getClassIri(), 0L));

        Map<String, ClassRoundRecord> records = new HashMap<>();
        RankTables forward = RankTables.empty();

        for (int round = 0; round < levels; round++) {
            ClassGraph weighted = ProbabilityModel.apply(current);
            forward = ranker.rank(weighted, Direction.FORWARD, counts);
            RankTables backward = ranker.rank(weighted, Direction.BACKWARD, counts);

            double total = counts.values().stream().mapToLong(Long::longValue).sum();
            Preconditions.checkState(total > 0, "no instances left for the remaining classes");

            Map<String, Double> scores = new HashMap<>();
            List<Pair<String, Double>> ranking = new ArrayList<>();
            for (Reachability r : remaining) {
                String cls = r.getClassIri();
                double depthScore = 1.0 / (1 + r.getDepth());
                double s = Math.sqrt(Math.sqrt(counts.get(cls) / total)) * Math.sqrt(depthScore)
                        * (3 * forward.pageRank(cls) + backward.pageRank(cls));
                scores.put(cls, s);
                ranking.add(Pair.of(cls, s));
            }
            ranking.sort(new ScoreComparator());

            double denominator = ranking.stream().mapToDouble(p -> Math.exp(p.getValue())).sum();
            double threshold = (round + 1.0) / (levels + 1);
            Set<String> kept = new HashSet<>();
            double cumulative = 0;
            for (Pair<String, Double> p : ranking) {
                kept.add(p.getKey());
                cumulative += Math.exp(p.getValue()) / denominator;
                if (cumulative > threshold)
                    break;
            }

            for (Reachability r : remaining) {
                String cls = r.getClassIri();
                records.put(cls, new ClassRoundRecord(cls, counts.get(cls), 1.0 / (1 + r.getDepth()),
                        forward.pageRank(cls), backward.pageRank(cls), round, kept.contains(cls), scores.get(cls)));
            }

            List<String> removed = remaining.stream()
                    .map(Reachability::getClassIri)
                    .filter(cls -> !kept.contains(cls))
                    .collect(Collectors.toList());
            log.debug("Round {}: threshold {}, keeping {} of {} classes", round, threshold, kept.size(), remaining.size());

            current = current.withoutNodes(removed);
            remaining.removeIf(r -> !kept.contains(r.getClassIri()));
            counts.keySet().retainAll(kept);
        }

        List<String> keepSet = remaining.stream().map(Reachability::getClassIri).collect(Collectors.toList());
        log.info("Pruning kept {} of {} reachable classes", keepSet.size(), order.size());
        return new PruningResult(keepSet, records, forward);
    }
}
