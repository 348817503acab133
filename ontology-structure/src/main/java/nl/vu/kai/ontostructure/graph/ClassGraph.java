package nl.vu.kai.ontostructure.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of class relations. Nodes are class IRIs plus the {@link #LITERAL} sink,
 * addressed by integer handles; edges are addressed by their position in {@link #edges()}.
 * <p>
 * Instances are immutable: shrinking the graph or attaching probabilities yields a new snapshot,
 * so handles taken from one snapshot must not be used with another.
 */
public final class ClassGraph {

    public static final String LITERAL = "Literal";

    private final List<String> nodes;
    private final Map<String, Integer> handles;
    private final List<ClassEdge> edges;
    private final List<List<ClassEdge>> outgoing;
    private final List<List<ClassEdge>> incoming;

    private ClassGraph(List<String> nodes, List<ClassEdge> edges) {
        this.nodes = ImmutableList.copyOf(nodes);
        this.edges = ImmutableList.copyOf(edges);
        this.handles = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++)
            handles.put(nodes.get(i), i);

        List<List<ClassEdge>> out = new ArrayList<>();
        List<List<ClassEdge>> in = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        for (ClassEdge edge : edges) {
            out.get(edge.source()).add(edge);
            in.get(edge.target()).add(edge);
        }
        this.outgoing = new ArrayList<>();
        this.incoming = new ArrayList<>();
        out.forEach(list -> outgoing.add(Collections.unmodifiableList(list)));
        in.forEach(list -> incoming.add(Collections.unmodifiableList(list)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return nodes.size();
    }

    public String iri(int node) {
        return nodes.get(node);
    }

    /**
     * @return the handle of the node, or -1 when the graph has no such node
     */
    public int node(String iri) {
        return handles.getOrDefault(iri, -1);
    }

    public boolean contains(String iri) {
        return handles.containsKey(iri);
    }

    public int literal() {
        return handles.get(LITERAL);
    }

    public boolean isLiteral(int node) {
        return LITERAL.equals(nodes.get(node));
    }

    /**
     * Class IRIs, without the sink.
     */
    public List<String> classes() {
        List<String> result = new ArrayList<>(nodes);
        result.remove(LITERAL);
        return result;
    }

    public List<ClassEdge> edges() {
        return edges;
    }

    public List<ClassEdge> outgoing(int node) {
        return outgoing.get(node);
    }

    public List<ClassEdge> incoming(int node) {
        return incoming.get(node);
    }

    /**
     * Snapshot with the same topology and the given edges, which must be derived from {@link #edges()}
     * position by position.
     */
    ClassGraph withEdges(List<ClassEdge> replacement) {
        Preconditions.checkArgument(replacement.size() == edges.size(), "edge count changed");
        return new ClassGraph(nodes, replacement);
    }

    /**
     * Snapshot without the given classes and every edge touching them. The sink is never removed.
     * Probabilities are not carried over.
     */
    public ClassGraph withoutNodes(Collection<String> removed) {
        Set<String> toRemove = new HashSet<>(removed);
        toRemove.remove(LITERAL);

        Builder builder = builder();
        nodes.stream()
                .filter(iri -> !toRemove.contains(iri))
                .forEach(builder::addNode);
        for (ClassEdge edge : edges) {
            String source = nodes.get(edge.source());
            String target = nodes.get(edge.target());
            if (!toRemove.contains(source) && !toRemove.contains(target))
                builder.addEdge(source, edge.predicate(), target, edge.count());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "ClassGraph[" + (nodes.size() - 1) + " classes, " + edges.size() + " edges]";
    }

    public static final class Builder {

        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> handles = new HashMap<>();
        private final List<ClassEdge> edges = new ArrayList<>();

        private Builder() {
            addNode(LITERAL);
        }

        public int addNode(String iri) {
            Integer handle = handles.get(iri);
            if (handle != null)
                return handle;
            nodes.add(iri);
            handles.put(iri, nodes.size() - 1);
            return nodes.size() - 1;
        }

        public Builder addEdge(String source, String predicate, String target, double count) {
            Preconditions.checkArgument(!LITERAL.equals(source), "the literal sink has no outgoing edges");
            edges.add(new ClassEdge(addNode(source), addNode(target), predicate, count));
            return this;
        }

        public ClassGraph build() {
            return new ClassGraph(nodes, edges);
        }
    }
}
