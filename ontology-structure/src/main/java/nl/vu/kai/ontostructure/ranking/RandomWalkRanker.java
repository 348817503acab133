package nl.vu.kai.ontostructure.ranking;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import nl.vu.kai.ontostructure.graph.ClassEdge;
import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.graph.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Monte-Carlo estimate of class centrality. Walks start at a class drawn proportionally to its
 * weight and follow edges in the given direction with their transition probabilities for a bounded
 * number of steps. A walk stops early at a class without edges, or when it enters the literal sink,
 * in which case the forward probability of the entering edge is credited to the class it left.
 * <p>
 * Page ranks are visits per walk, edge ranks are shares of all edge traversals.
 * The graph must carry probabilities, see {@link nl.vu.kai.ontostructure.graph.ProbabilityModel}.
 */
public class RandomWalkRanker {

    private static final Logger log = LoggerFactory.getLogger(RandomWalkRanker.class);

    public static final int DEFAULT_WALKS = 10_000;
    public static final int DEFAULT_WALK_LENGTH = 10;

    private final RandomSource random;
    private final int walks;
    private final int walkLength;

    public RandomWalkRanker(RandomSource random) {
        this(random, DEFAULT_WALKS, DEFAULT_WALK_LENGTH);
    }

    public RandomWalkRanker(RandomSource random, int walks, int walkLength) {
        Preconditions.checkArgument(walks > 0, "walks must be positive");
        Preconditions.checkArgument(walkLength >= 0, "walk length must not be negative");
        this.random = random;
        this.walks = walks;
        this.walkLength = walkLength;
    }

    public RankTables rank(ClassGraph graph, Direction direction, Map<String, ? extends Number> nodeWeights) {
        double[] startWeights = new double[graph.size()];
        for (Map.Entry<String, ? extends Number> entry : nodeWeights.entrySet()) {
            int node = graph.node(entry.getKey());
            if (node >= 0 && !graph.isLiteral(node))
                startWeights[node] = entry.getValue().doubleValue();
        }

        double[] visits = new double[graph.size()];
        Table<String, String, Double> edgeVisits = HashBasedTable.create();
        long totalEdgeVisits = 0;

        for (int walk = 0; walk < walks; walk++) {
            int current = WeightedChoice.choose(startWeights, random);
            visits[current]++;

            for (int step = 0; step < walkLength; step++) {
                List<ClassEdge> edges = direction.edges(graph, current);
                if (edges.isEmpty())
                    break;

                double[] probabilities = new double[edges.size()];
                for (int i = 0; i < edges.size(); i++)
                    probabilities[i] = direction.probability(edges.get(i));
                ClassEdge edge = edges.get(WeightedChoice.choose(probabilities, random));

                String from = graph.iri(current);
                Double seen = edgeVisits.get(from, edge.predicate());
                edgeVisits.put(from, edge.predicate(), seen == null ? 1.0 : seen + 1);
                totalEdgeVisits++;

                int next = direction.next(edge);
                if (graph.isLiteral(next)) {
                    visits[current] += edge.forwardProbability();
                    break;
                }
                visits[next]++;
                current = next;
            }
        }

        Map<String, Double> pageRank = new HashMap<>();
        for (int node = 0; node < graph.size(); node++) {
            if (!graph.isLiteral(node))
                pageRank.put(graph.iri(node), visits[node] / walks);
        }
        Table<String, String, Double> edgeRank = HashBasedTable.create();
        for (Table.Cell<String, String, Double> cell : edgeVisits.cellSet())
            edgeRank.put(cell.getRowKey(), cell.getColumnKey(), cell.getValue() / totalEdgeVisits);

        log.debug("{} ranking over {}: {} walks, {} edge traversals", direction, graph, walks, totalEdgeVisits);
        return new RankTables(pageRank, edgeRank);
    }
}
