package nl.vu.kai.ontostructure.predicates;

import nl.vu.kai.ontostructure.classifier.Classifier;
import nl.vu.kai.ontostructure.classifier.ClassifierUnavailableException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Combines the statistics of the predicates of one class into a relative score. The raw score
 * {@code sqrt(frequency) * quality * ln(1 + edgeRank) * entropy * uniqueness} goes through a softmax with
 * the predicate count as inverse temperature, scaled to sum to 100. Predicates with a raw score of zero
 * score zero and take no part in the softmax. Every predicate also gets the classifier confidence.
 */
public class ScoreFusion {

    private final Classifier classifier;

    public ScoreFusion(Classifier classifier) {
        this.classifier = classifier;
    }

    public static double rawScore(PredicateStats s) {
        double structural = Math.sqrt(s.getFrequency()) * s.getQuality() * Math.log1p(s.getEdgeRank());
        double dataBased = s.getEntropy() * s.getUniqueness();
        return structural * dataBased;
    }

    /**
     * @return the stats with score and confidence set, highest score first
     */
    public List<PredicateStats> computeScores(List<PredicateStats> stats) throws ClassifierUnavailableException {
        double inverseTemperature = stats.size();
        double[] exponentials = new double[stats.size()];
        double denominator = 0;
        for (int i = 0; i < stats.size(); i++) {
            double raw = rawScore(stats.get(i));
            if (raw != 0) {
                exponentials[i] = Math.exp(raw * inverseTemperature);
                denominator += exponentials[i];
            }
        }

        List<PredicateStats> result = new ArrayList<>(stats.size());
        for (int i = 0; i < stats.size(); i++) {
            PredicateStats s = stats.get(i);
            double score = exponentials[i] == 0 ? 0 : exponentials[i] / (denominator / 100);
            result.add(s.withScore(score, classifier.score(s.features())));
        }
        result.sort(Comparator.comparingDouble(PredicateStats::getScore).reversed()
                .thenComparing(PredicateStats::getPredicate));
        return result;
    }
}
