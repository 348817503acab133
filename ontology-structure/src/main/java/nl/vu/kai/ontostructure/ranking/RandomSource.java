package nl.vu.kai.ontostructure.ranking;

/**
 * Source of uniform random numbers for the walk simulation.
 */
public interface RandomSource {

    /**
     * @return a value in [0, 1)
     */
    double nextDouble();
}
