package nl.vu.kai.ontostructure.graph;

import com.google.common.base.Preconditions;

/**
 * Predicate usage between two classes: {@code count} triples link an instance of the source class
 * to an instance of the target class (or to a literal value when the target is the sink).
 * Endpoints are node handles of the owning {@link ClassGraph}.
 */
public final class ClassEdge {

    private final int source;
    private final int target;
    private final String predicate;
    private final double count;
    private final Double forwardProbability;
    private final Double backwardProbability;

    ClassEdge(int source, int target, String predicate, double count) {
        this(source, target, predicate, count, null, null);
    }

    private ClassEdge(int source, int target, String predicate, double count,
                      Double forwardProbability, Double backwardProbability) {
        this.source = source;
        this.target = target;
        this.predicate = predicate;
        this.count = count;
        this.forwardProbability = forwardProbability;
        this.backwardProbability = backwardProbability;
    }

    ClassEdge withProbabilities(Double forward, Double backward) {
        return new ClassEdge(source, target, predicate, count, forward, backward);
    }

    public int source() {
        return source;
    }

    public int target() {
        return target;
    }

    public String predicate() {
        return predicate;
    }

    public double count() {
        return count;
    }

    public boolean hasProbabilities() {
        return forwardProbability != null && backwardProbability != null;
    }

    /**
     * Share of this edge among the outgoing edges of its source.
     */
    public double forwardProbability() {
        Preconditions.checkState(forwardProbability != null, "forward probability not computed for %s", this);
        return forwardProbability;
    }

    /**
     * Share of this edge among the incoming edges of its target.
     */
    public double backwardProbability() {
        Preconditions.checkState(backwardProbability != null, "backward probability not computed for %s", this);
        return backwardProbability;
    }

    @Override
    public String toString() {
        return source + " -" + predicate + "(" + count + ")-> " + target;
    }
}
