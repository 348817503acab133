package nl.vu.kai.ontostructure.predicates;

import java.util.Collection;

public final class PredicateStatistics {

    private static final double CONSTANT_RANGE = 1e-12;

    private PredicateStatistics() {
    }

    /**
     * Shannon entropy in bits of the distribution given by the group sizes. Empty groups contribute nothing.
     */
    public static double entropy(Collection<? extends Number> groupSizes) {
        double total = groupSizes.stream().mapToDouble(Number::doubleValue).sum();
        if (total == 0)
            return 0;
        double entropy = 0;
        for (Number size : groupSizes) {
            double p = size.doubleValue() / total;
            if (p > 0)
                entropy -= p * Math.log(p) / Math.log(2);
        }
        return entropy;
    }

    /**
     * Min-max scaling to [0, 1]. A constant column becomes all zeros.
     */
    public static double[] normalize(double[] column) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : column) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double[] result = new double[column.length];
        if (column.length == 0 || Math.abs(max - min) < CONSTANT_RANGE)
            return result;
        for (int i = 0; i < column.length; i++)
            result[i] = (column[i] - min) / (max - min);
        return result;
    }
}
