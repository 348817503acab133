package nl.vu.kai.ontostructure.ranking;

import com.google.common.base.Preconditions;

/**
 * Roulette-wheel selection. Entries with a weight of zero or less are never chosen.
 */
public final class WeightedChoice {

    private WeightedChoice() {
    }

    public static int choose(double[] weights, RandomSource random) {
        double total = 0;
        int last = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) {
                total += weights[i];
                last = i;
            }
        }
        Preconditions.checkArgument(last >= 0, "no positive weight to choose from");

        double r = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0)
                continue;
            cumulative += weights[i];
            if (r < cumulative)
                return i;
        }
        // rounding
        return last;
    }
}
