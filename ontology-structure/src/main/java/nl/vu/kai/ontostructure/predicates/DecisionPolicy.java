package nl.vu.kai.ontostructure.predicates;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Keep/drop decision for scored predicates. The classifier decides, except when it drops a predicate
 * that fits within the score budget: walking the predicates by descending score, each one is
 * score-kept while the remaining budget is positive and then consumes its score. Such a predicate is
 * kept when {@code confidence + confidence * score / mean score of the score-kept predicates} reaches
 * the threshold.
 */
public class DecisionPolicy {

    public static final double DEFAULT_BUDGET = 60;
    public static final double DEFAULT_THRESHOLD = 0.5;

    private final double budget;
    private final double threshold;

    public DecisionPolicy() {
        this(DEFAULT_BUDGET, DEFAULT_THRESHOLD);
    }

    public DecisionPolicy(double budget, double threshold) {
        this.budget = budget;
        this.threshold = threshold;
    }

    /**
     * @param scored output of {@link ScoreFusion#computeScores}, highest score first
     */
    public List<PredicateDecision> decide(List<PredicateStats> scored) {
        Set<String> scoreKept = new HashSet<>();
        double remaining = budget;
        double keptScoreSum = 0;
        for (PredicateStats s : scored) {
            if (s.getScore() <= 0)
                continue;
            if (remaining > 0) {
                scoreKept.add(s.getPredicate());
                keptScoreSum += s.getScore();
            }
            remaining -= s.getScore();
        }
        double meanKeptScore = scoreKept.isEmpty() ? 0 : keptScoreSum / scoreKept.size();

        List<PredicateDecision> decisions = new ArrayList<>(scored.size());
        for (PredicateStats s : scored) {
            double confidence = s.getClassifierConfidence();
            boolean classifierKeep = confidence > threshold;
            boolean scoreKeep = scoreKept.contains(s.getPredicate());
            if (!classifierKeep && scoreKeep) {
                double hybrid = confidence + confidence * s.getScore() / meanKeptScore;
                decisions.add(new PredicateDecision(s, false, true, OptionalDouble.of(hybrid), hybrid >= threshold));
            } else {
                decisions.add(new PredicateDecision(s, classifierKeep, scoreKeep, OptionalDouble.empty(), classifierKeep));
            }
        }
        return decisions;
    }
}
