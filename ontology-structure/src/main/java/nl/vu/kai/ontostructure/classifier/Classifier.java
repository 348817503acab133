package nl.vu.kai.ontostructure.classifier;

/**
 * Pre-trained keep/drop model for predicates.
 */
public interface Classifier {

    int FEATURES = 5;

    /**
     * @param features frequency, uniqueness, entropy, quality and edge rank, in that order
     * @return confidence in [0, 1] that the predicate should be kept
     */
    double score(double[] features) throws ClassifierUnavailableException;
}
