package ch.xavier.retirementsim.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PercentileStatisticsTest {

    @Test
    @DisplayName("Trim count is 2.5% per tail of the batch, capped at an eighth")
    void trimCount_defaultAndCapped() {
        assertEquals(50, PercentileStatistics.trimCount(2000, 0.025));
        assertEquals(0, PercentileStatistics.trimCount(20, 0.025));
        assertEquals(12, PercentileStatistics.trimCount(100, 0.5));
    }

    @Test
    @DisplayName("Trimming sorts and drops the same number from each end")
    void trimExtremeValues_dropsBothTails() {
        double[] values = {5, 1, 4, 2, 3};

        assertArrayEquals(new double[]{2, 3, 4}, PercentileStatistics.trimExtremeValues(values, 1));
        assertArrayEquals(new double[]{5, 1, 4, 2, 3}, values);
    }

    @Test
    @DisplayName("Trimming everything away is refused")
    void trimExtremeValues_tooMuch_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> PercentileStatistics.trimExtremeValues(new double[]{1, 2}, 1));
    }

    @Test
    @DisplayName("Percentiles interpolate linearly between order statistics")
    void percentile_interpolates() {
        double[] values = {4, 1, 3, 2};

        assertEquals(1, PercentileStatistics.percentile(values, 0));
        assertEquals(2.5, PercentileStatistics.percentile(values, 50), 1e-12);
        assertEquals(1.3, PercentileStatistics.percentile(values, 10), 1e-12);
        assertEquals(4, PercentileStatistics.percentile(values, 100));
    }

    @Test
    @DisplayName("Higher percentiles are never below lower ones")
    void percentile_isOrdered() {
        double[] values = {12, -3, 7, 7, 0, 45, 2, 19, 3};
        double previous = Double.NEGATIVE_INFINITY;

        for (int p = 0; p <= 100; p += 5) {
            double value = PercentileStatistics.percentile(values, p);
            assertThat(value).isGreaterThanOrEqualTo(previous);
            previous = value;
        }
    }

    @Test
    @DisplayName("Percentile of nothing is zero, percentile outside 0-100 is refused")
    void percentile_edgeCases() {
        assertEquals(0, PercentileStatistics.percentile(new double[0], 50));
        assertThrows(IllegalArgumentException.class, () -> PercentileStatistics.percentile(new double[]{1}, 101));
    }
}
