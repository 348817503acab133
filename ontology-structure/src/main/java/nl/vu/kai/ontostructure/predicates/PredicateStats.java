package nl.vu.kai.ontostructure.predicates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of one predicate on the instances of one class. Entropy and quality are min-max
 * normalised over the predicates of the class; score and classifier confidence are only set once
 * the stats went through {@link ScoreFusion}.
 */
public final class PredicateStats {

    private final String predicate;
    private final double frequency;
    private final double uniqueness;
    private final double entropy;
    private final double quality;
    private final double edgeRank;
    private final double score;
    private final double classifierConfidence;

    @JsonCreator
    public PredicateStats(@JsonProperty("predicate") String predicate,
                          @JsonProperty("frequency") double frequency,
                          @JsonProperty("uniqueness") double uniqueness,
                          @JsonProperty("entropy") double entropy,
                          @JsonProperty("quality") double quality,
                          @JsonProperty("edgeRank") double edgeRank,
                          @JsonProperty("score") double score,
                          @JsonProperty("classifierConfidence") double classifierConfidence) {
        this.predicate = predicate;
        this.frequency = frequency;
        this.uniqueness = uniqueness;
        this.entropy = entropy;
        this.quality = quality;
        this.edgeRank = edgeRank;
        this.score = score;
        this.classifierConfidence = classifierConfidence;
    }

    public PredicateStats(String predicate, double frequency, double uniqueness, double entropy, double quality) {
        this(predicate, frequency, uniqueness, entropy, quality, 0, 0, 0);
    }

    public PredicateStats withEdgeRank(double edgeRank) {
        return new PredicateStats(predicate, frequency, uniqueness, entropy, quality, edgeRank, score, classifierConfidence);
    }

    public PredicateStats withEntropyAndQuality(double entropy, double quality) {
        return new PredicateStats(predicate, frequency, uniqueness, entropy, quality, edgeRank, score, classifierConfidence);
    }

    public PredicateStats withScore(double score, double classifierConfidence) {
        return new PredicateStats(predicate, frequency, uniqueness, entropy, quality, edgeRank, score, classifierConfidence);
    }

    /**
     * Classifier input, in the order the model was trained with.
     */
    public double[] features() {
        return new double[]{frequency, uniqueness, entropy, quality, edgeRank};
    }

    @JsonProperty
    public String getPredicate() {
        return predicate;
    }

    @JsonProperty
    public double getFrequency() {
        return frequency;
    }

    @JsonProperty
    public double getUniqueness() {
        return uniqueness;
    }

    @JsonProperty
    public double getEntropy() {
        return entropy;
    }

    @JsonProperty
    public double getQuality() {
        return quality;
    }

    @JsonProperty
    public double getEdgeRank() {
        return edgeRank;
    }

    @JsonProperty
    public double getScore() {
        return score;
    }

    @JsonProperty
    public double getClassifierConfidence() {
        return classifierConfidence;
    }

    @Override
    public String toString() {
        return String.format("%s f=%.3f u=%.3f h=%.3f q=%.3f r=%.4f score=%.3f conf=%.3f",
                predicate, frequency, uniqueness, entropy, quality, edgeRank, score, classifierConfidence);
    }
}
