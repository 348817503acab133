package nl.vu.kai.ontostructure.graph;

import java.util.List;

/**
 * Which way a walk follows edges.
 */
public enum Direction {

    FORWARD {
        @Override
        public List<ClassEdge> edges(ClassGraph graph, int node) {
            return graph.outgoing(node);
        }

        @Override
        public int next(ClassEdge edge) {
            return edge.target();
        }

        @Override
        public double probability(ClassEdge edge) {
            return edge.forwardProbability();
        }
    },

    BACKWARD {
        @Override
        public List<ClassEdge> edges(ClassGraph graph, int node) {
            return graph.incoming(node);
        }

        @Override
        public int next(ClassEdge edge) {
            return edge.source();
        }

        @Override
        public double probability(ClassEdge edge) {
            return edge.backwardProbability();
        }
    };

    public abstract List<ClassEdge> edges(ClassGraph graph, int node);

    public abstract int next(ClassEdge edge);

    public abstract double probability(ClassEdge edge);
}
