package nl.vu.kai.ontostructure.predicates;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestPredicateStatistics {

    @Test
    public void testEntropy() {
        assertEquals(0.0, PredicateStatistics.entropy(List.of(10, 0, 0)), 1e-9);
        assertEquals(1.0, PredicateStatistics.entropy(List.of(5, 5)), 1e-9);
        assertEquals(2.0, PredicateStatistics.entropy(List.of(1, 1, 1, 1)), 1e-9);
        assertEquals(0.0, PredicateStatistics.entropy(List.of()), 1e-9);
    }

    @Test
    public void testNormalize() {
        assertArrayEquals(new double[]{0, 0.5, 1}, PredicateStatistics.normalize(new double[]{1, 3, 5}), 1e-9);
        assertArrayEquals(new double[]{0, 0, 0}, PredicateStatistics.normalize(new double[]{2, 2, 2}), 1e-9);
        assertArrayEquals(new double[]{1, 0}, PredicateStatistics.normalize(new double[]{-1, -4}), 1e-9);
        assertEquals(0, PredicateStatistics.normalize(new double[0]).length);
    }
}
