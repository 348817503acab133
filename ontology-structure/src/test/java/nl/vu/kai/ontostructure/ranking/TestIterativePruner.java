package nl.vu.kai.ontostructure.ranking;

import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.graph.Reachability;
import nl.vu.kai.ontostructure.graph.ReachabilityOrderer;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TestIterativePruner {

    private static ClassGraph graph() {
        return ClassGraph.builder()
                .addEdge("Root", "a", "Small1", 5)
                .addEdge("Root", "b", "Small2", 5)
                .addEdge("Root", "name", ClassGraph.LITERAL, 1000)
                .addEdge("Small1", "c", "Small3", 2)
                .addEdge("Small2", "name", ClassGraph.LITERAL, 5)
                .addEdge("Small3", "name", ClassGraph.LITERAL, 2)
                .addEdge("Orphan", "d", "Root", 3)
                .build();
    }

    private static final Map<String, Long> COUNTS =
            Map.of("Root", 1000L, "Small1", 5L, "Small2", 5L, "Small3", 2L, "Orphan", 3L);

    @Test
    public void testDominantClassSurvivesEveryRound() {
        List<Reachability> order = ReachabilityOrderer.order(graph(), "Root");
        IterativePruner pruner = new IterativePruner(new RandomWalkRanker(new SeededRandomSource(11)), 3);
        PruningResult result = pruner.prune(graph(), order, COUNTS);

        assertTrue(result.isKept("Root"));
        ClassRoundRecord root = result.getRecords().get("Root");
        assertEquals(2, root.getRound());
        assertTrue(root.isKept());
        assertEquals(1.0, root.getDepthScore(), 0);
        assertEquals(1000, root.getEntityCount());

        for (ClassRoundRecord record : result.getRecords().values())
            assertTrue(record.getScore() <= root.getScore() || record.getRound() < root.getRound());
    }

    @Test
    public void testRecordsAndRanking() {
        List<Reachability> order = ReachabilityOrderer.order(graph(), "Root");
        PruningResult result = new IterativePruner(new RandomWalkRanker(new SeededRandomSource(5))).prune(graph(), order, COUNTS);

        // unreachable classes take no part
        assertFalse(result.getRecords().containsKey("Orphan"));
        assertEquals(4, result.getRecords().size());

        for (ClassRoundRecord record : result.getRecords().values()) {
            if (result.isKept(record.getClassIri()))
                assertEquals(2, record.getRound());
            else
                assertFalse(record.isKept());
        }

        List<ClassRoundRecord> ranking = result.getRanking();
        assertEquals("Root", ranking.get(0).getClassIri());
        for (int i = 1; i < ranking.size(); i++) {
            ClassRoundRecord previous = ranking.get(i - 1);
            ClassRoundRecord current = ranking.get(i);
            assertTrue(previous.getRound() > current.getRound()
                    || (previous.getRound() == current.getRound() && previous.getScore() >= current.getScore()));
        }
        assertEquals(result.getScores().keySet(), result.getRecords().keySet());
    }

    @Test
    public void testSingleClass() {
        ClassGraph graph = ClassGraph.builder().addEdge("Only", "name", ClassGraph.LITERAL, 4).build();
        PruningResult result = new IterativePruner(new RandomWalkRanker(new SeededRandomSource(1), 100, 10))
                .prune(graph, ReachabilityOrderer.order(graph, "Only"), Map.of("Only", 4L));
        assertEquals(List.of("Only"), result.getKeepSet());
        assertEquals(1.0, result.getForwardRanks().edgeRank("Only").get("name"), 1e-9);
    }
}
