package nl.vu.kai.ontostructure.predicates;

import java.util.OptionalDouble;

public final class PredicateDecision {

    private final PredicateStats stats;
    private final boolean classifierKeep;
    private final boolean scoreKeep;
    private final OptionalDouble hybrid;
    private final boolean keep;

    public PredicateDecision(PredicateStats stats, boolean classifierKeep, boolean scoreKeep, OptionalDouble hybrid, boolean keep) {
        this.stats = stats;
        this.classifierKeep = classifierKeep;
        this.scoreKeep = scoreKeep;
        this.hybrid = hybrid;
        this.keep = keep;
    }

    public String getPredicate() {
        return stats.getPredicate();
    }

    public PredicateStats getStats() {
        return stats;
    }

    public boolean isClassifierKeep() {
        return classifierKeep;
    }

    public boolean isScoreKeep() {
        return scoreKeep;
    }

    /**
     * Present only when the classifier dropped a predicate that the score budget kept.
     */
    public OptionalDouble getHybrid() {
        return hybrid;
    }

    public boolean isKeep() {
        return keep;
    }

    @Override
    public String toString() {
        return (keep ? "keep " : "drop ") + stats;
    }
}
