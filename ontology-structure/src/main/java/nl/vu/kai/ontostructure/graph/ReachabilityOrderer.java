package nl.vu.kai.ontostructure.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first traversal from a root class along outgoing edges. The sink is never visited.
 */
public final class ReachabilityOrderer {

    private ReachabilityOrderer() {
    }

    /**
     * @return reachable classes in reverse discovery order, so the deepest classes come first and
     * the root last
     */
    public static List<Reachability> order(ClassGraph graph, String rootIri) {
        int root = graph.node(rootIri);
        Preconditions.checkArgument(root >= 0 && !graph.isLiteral(root), "%s is not a class of the graph", rootIri);

        int[] depth = new int[graph.size()];
        Arrays.fill(depth, -1);
        depth[root] = 0;

        List<Reachability> discovered = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            discovered.add(new Reachability(graph.iri(node), depth[node]));
            for (ClassEdge edge : graph.outgoing(node)) {
                int next = edge.target();
                if (depth[next] < 0 && !graph.isLiteral(next)) {
                    depth[next] = depth[node] + 1;
                    queue.add(next);
                }
            }
        }
        return Lists.reverse(discovered);
    }

    /**
     * Root IRI for a hint: absolute IRIs are kept, anything else is resolved against the class namespace.
     */
    public static String resolveRoot(String classNamespace, String hint) {
        if (hint.contains("://") || hint.startsWith("urn:"))
            return hint;
        return classNamespace + hint;
    }
}
