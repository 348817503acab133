package nl.vu.kai.ontostructure.ranking;

/**
 * State of a class after a pruning round. Classes removed in a round keep the record of that round.
 */
public final class ClassRoundRecord {

    private final String classIri;
    private final long entityCount;
    private final double depthScore;
    private final double forwardRank;
    private final double backwardRank;
    private final int round;
    private final boolean kept;
    private final double score;

    public ClassRoundRecord(String classIri, long entityCount, double depthScore, double forwardRank,
                            double backwardRank, int round, boolean kept, double score) {
        this.classIri = classIri;
        this.entityCount = entityCount;
        this.depthScore = depthScore;
        this.forwardRank = forwardRank;
        this.backwardRank = backwardRank;
        this.round = round;
        this.kept = kept;
        this.score = score;
    }

    public String getClassIri() {
        return classIri;
    }

    public long getEntityCount() {
        return entityCount;
    }

    public double getDepthScore() {
        return depthScore;
    }

    public double getForwardRank() {
        return forwardRank;
    }

    public double getBackwardRank() {
        return backwardRank;
    }

    public int getRound() {
        return round;
    }

    public boolean isKept() {
        return kept;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("%s round=%d kept=%s score=%.4f (count=%d, depth=%.3f, fwd=%.4f, bwd=%.4f)",
                classIri, round, kept, score, entityCount, depthScore, forwardRank, backwardRank);
    }
}
