package nl.vu.kai.ontostructure.graph;

import org.junit.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class TestClassGraph {

    static ClassGraph sample() {
        return ClassGraph.builder()
                .addEdge("A", "p", "B", 3)
                .addEdge("A", "q", "C", 1)
                .addEdge("A", "name", ClassGraph.LITERAL, 4)
                .addEdge("B", "r", "C", 2)
                .addEdge("D", "s", "A", 5)
                .build();
    }

    @Test
    public void testStructure() {
        ClassGraph graph = sample();
        assertEquals(5, graph.size());
        assertEquals(List.of("A", "B", "C", "D"), graph.classes().stream().sorted().collect(Collectors.toList()));
        assertTrue(graph.isLiteral(graph.literal()));
        assertEquals(3, graph.outgoing(graph.node("A")).size());
        assertEquals(2, graph.incoming(graph.node("C")).size());
        assertTrue(graph.outgoing(graph.literal()).isEmpty());
        assertEquals(-1, graph.node("E"));
    }

    @Test
    public void testForwardProbabilitiesSumToOne() {
        ClassGraph graph = ProbabilityModel.apply(sample());
        for (int node = 0; node < graph.size(); node++) {
            List<ClassEdge> out = graph.outgoing(node);
            if (!out.isEmpty())
                assertEquals(1.0, out.stream().mapToDouble(ClassEdge::forwardProbability).sum(), 1e-9);
            List<ClassEdge> in = graph.incoming(node);
            if (!in.isEmpty())
                assertEquals(1.0, in.stream().mapToDouble(ClassEdge::backwardProbability).sum(), 1e-9);
        }
        ClassEdge ab = graph.outgoing(graph.node("A")).get(0);
        assertEquals("p", ab.predicate());
        assertEquals(3.0 / 8, ab.forwardProbability(), 1e-9);
        // B has a single incoming edge
        assertEquals(1.0, ab.backwardProbability(), 1e-9);
    }

    @Test
    public void testProbabilitiesDoNotMutateInput() {
        ClassGraph graph = sample();
        ProbabilityModel.apply(graph);
        assertFalse(graph.edges().get(0).hasProbabilities());
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingProbability() {
        sample().edges().get(0).forwardProbability();
    }

    @Test
    public void testWithoutNodes() {
        ClassGraph graph = sample();
        ClassGraph shrunk = graph.withoutNodes(Set.of("B", ClassGraph.LITERAL));
        assertFalse(shrunk.contains("B"));
        assertTrue(shrunk.contains(ClassGraph.LITERAL));
        assertEquals(3, shrunk.edges().size());
        for (ClassEdge edge : shrunk.edges()) {
            assertNotEquals("p", edge.predicate());
            assertNotEquals("r", edge.predicate());
        }
        // the source snapshot is untouched
        assertTrue(graph.contains("B"));
        assertEquals(5, graph.edges().size());
    }

    @Test
    public void testReachability() {
        List<Reachability> order = ReachabilityOrderer.order(sample(), "A");
        assertEquals(List.of(new Reachability("C", 1), new Reachability("B", 1), new Reachability("A", 0)), order);
    }

    @Test
    public void testReachabilityDepth() {
        ClassGraph chain = ClassGraph.builder()
                .addEdge("A", "p", "B", 1)
                .addEdge("B", "p", "C", 1)
                .addEdge("C", "p", "A", 1)
                .addEdge("C", "v", ClassGraph.LITERAL, 1)
                .build();
        List<Reachability> order = ReachabilityOrderer.order(chain, "A");
        assertEquals(List.of(new Reachability("C", 2), new Reachability("B", 1), new Reachability("A", 0)), order);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownRoot() {
        ReachabilityOrderer.order(sample(), "Z");
    }

    @Test
    public void testResolveRoot() {
        assertEquals("http://schema.org/Book", ReachabilityOrderer.resolveRoot("http://schema.org/", "Book"));
        assertEquals("http://example.org/Thing", ReachabilityOrderer.resolveRoot("http://schema.org/", "http://example.org/Thing"));
    }
}
