package ch.xavier.retirementsim.returns;

import ch.xavier.retirementsim.TestFixtures;
import ch.xavier.retirementsim.exception.HistoricalDataIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HistoricalReturnSeriesTest {

    @Test
    @DisplayName("The shipped table covers 1928-2024 and the pool adds half-magnitude copies")
    void loadSeries_shippedTable() {
        HistoricalReturnSeries series = TestFixtures.history();

        assertEquals(1928, series.getStartYear());
        assertEquals(2024, series.getEndYear());
        assertEquals(97, series.getYearCount());
        assertEquals(194, series.poolSize());
        assertEquals(43.81, series.rawReturnPct(1928), 1e-9);
    }

    @Test
    @DisplayName("Pool values are capped, the second half holds halves of the capped values")
    void pool_isCappedAndAugmented() {
        HistoricalReturnSeries series = TestFixtures.history();

        assertEquals(15.0, series.poolValuePct(0), 1e-9);
        assertEquals(-15.0, series.poolValuePct(series.poolIndexOf(1931)), 1e-9);
        assertEquals(7.5, series.poolValuePct(97), 1e-9);
        for (int i = 0; i < series.poolSize(); i++) {
            assertThat(series.poolValuePct(i)).isBetween(-15.0, 15.0);
        }
    }

    @Test
    @DisplayName("A table shorter than the declared range is rejected")
    void of_lengthMismatch_throws() {
        List<AnnualReturn> returns = List.of(annual(2000, 1), annual(2001, 2));

        assertThatThrownBy(() -> HistoricalReturnSeries.of(returns, 2000, 2002, 15, true))
                .isInstanceOf(HistoricalDataIntegrityException.class)
                .hasMessageContaining("expected 3 years");
    }

    @Test
    @DisplayName("A gap in the years is rejected")
    void of_nonContiguous_throws() {
        List<AnnualReturn> returns = List.of(annual(2000, 1), annual(2002, 2), annual(2003, 3));

        assertThatThrownBy(() -> HistoricalReturnSeries.of(returns, 2000, 2002, 15, true))
                .isInstanceOf(HistoricalDataIntegrityException.class)
                .hasMessageContaining("not contiguous");
    }

    @Test
    @DisplayName("An empty table is rejected")
    void of_empty_throws() {
        assertThatThrownBy(() -> HistoricalReturnSeries.of(List.of(), 2000, 2002, 15, true))
                .isInstanceOf(HistoricalDataIntegrityException.class);
    }

    @Test
    @DisplayName("Without augmentation the pool is just the capped table")
    void of_withoutAugmentation() {
        List<AnnualReturn> returns = List.of(annual(2000, 30), annual(2001, -2));
        HistoricalReturnSeries series = HistoricalReturnSeries.of(returns, 2000, 2001, 15, false);

        assertEquals(2, series.poolSize());
        assertEquals(15, series.poolValuePct(0), 1e-9);
        assertEquals(-2, series.poolValuePct(1), 1e-9);
    }

    @Test
    @DisplayName("Malformed rows fail with an integrity error")
    void annualReturnFrom_malformedRow_throws() {
        assertThatThrownBy(() -> AnnualReturn.from("1999"))
                .isInstanceOf(HistoricalDataIntegrityException.class);
        assertThatThrownBy(() -> AnnualReturn.from("1999,abc"))
                .isInstanceOf(HistoricalDataIntegrityException.class);
    }

    private static AnnualReturn annual(int year, double pct) {
        return AnnualReturn.builder().year(year).totalReturnPct(pct).build();
    }
}
