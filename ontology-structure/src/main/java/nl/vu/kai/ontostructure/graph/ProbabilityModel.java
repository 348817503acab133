package nl.vu.kai.ontostructure.graph;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw edge counts into transition probabilities. For every node the counts of its outgoing
 * edges are normalised to sum to one (forward), and independently the counts of its incoming edges
 * (backward). A node without edges in a direction is left alone in that direction.
 */
public final class ProbabilityModel {

    private ProbabilityModel() {
    }

    public static ClassGraph apply(ClassGraph graph) {
        Map<ClassEdge, Double> forward = new IdentityHashMap<>();
        Map<ClassEdge, Double> backward = new IdentityHashMap<>();

        for (int node = 0; node < graph.size(); node++) {
            normalise(graph.outgoing(node), forward);
            normalise(graph.incoming(node), backward);
        }

        List<ClassEdge> edges = new ArrayList<>(graph.edges().size());
        for (ClassEdge edge : graph.edges())
            edges.add(edge.withProbabilities(forward.get(edge), backward.get(edge)));
        return graph.withEdges(edges);
    }

    private static void normalise(List<ClassEdge> edges, Map<ClassEdge, Double> probabilities) {
        double sum = edges.stream().mapToDouble(ClassEdge::count).sum();
        if (sum == 0)
            return;
        edges.forEach(edge -> probabilities.put(edge, edge.count() / sum));
    }
}
