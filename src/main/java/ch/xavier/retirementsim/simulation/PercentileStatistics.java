package ch.xavier.retirementsim.simulation;

import java.util.Arrays;

public final class PercentileStatistics {

    // Never trim more than an eighth of the paths from each tail
    private static final double MAX_TRIM_FRACTION = 0.125;

    private PercentileStatistics() {
    }

    public static int trimCount(int pathCount, double trimFraction) {
        return (int) Math.floor(pathCount * Math.min(trimFraction, MAX_TRIM_FRACTION));
    }

    /**
     * Sorts a copy of the values and drops {@code trimCount} entries from each end.
     *
     * @throws IllegalArgumentException when nothing would be left
     */
    public static double[] trimExtremeValues(double[] values, int trimCount) {
        if (values.length <= trimCount * 2) {
            throw new IllegalArgumentException(String.format(
                    "Cannot trim %d values from array of length %d", trimCount * 2, values.length));
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return Arrays.copyOfRange(sorted, trimCount, sorted.length - trimCount);
    }

    /**
     * Linear interpolation between the two closest order statistics.
     *
     * @param p percentile between 0 and 100
     */
    public static double percentile(double[] values, double p) {
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100, got " + p);
        }
        if (values.length == 0) {
            return 0;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double index = p / 100 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }
}
