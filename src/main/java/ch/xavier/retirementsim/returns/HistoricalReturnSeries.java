package ch.xavier.retirementsim.returns;

import ch.xavier.retirementsim.exception.HistoricalDataIntegrityException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Validated historical return table plus the pool the generators sample from.
 * <p>
 * The pool holds every raw return clamped to {@code ±capPct}, optionally followed by a half-magnitude copy of
 * each clamped value. Historical playback indexes the same pool, so a horizon running past the last year
 * continues into the moderated half.
 */
public class HistoricalReturnSeries {

    @Getter
    private final int startYear;
    @Getter
    private final int endYear;

    private final double[] rawReturnsPct;
    private final double[] samplingPoolPct;

    private HistoricalReturnSeries(int startYear, int endYear, double[] rawReturnsPct, double[] samplingPoolPct) {
        this.startYear = startYear;
        this.endYear = endYear;
        this.rawReturnsPct = rawReturnsPct;
        this.samplingPoolPct = samplingPoolPct;
    }

    public static HistoricalReturnSeries of(List<AnnualReturn> returns, int declaredStartYear, int declaredEndYear,
                                            double capPct, boolean augmentWithHalfValues) {
        int expectedLength = declaredEndYear - declaredStartYear + 1;
        if (returns.isEmpty()) {
            throw new HistoricalDataIntegrityException("Historical return series is empty");
        }
        if (returns.size() != expectedLength) {
            throw new HistoricalDataIntegrityException(String.format(
                    "Historical return series integrity error: expected %d years (%d-%d) but got %d values",
                    expectedLength, declaredStartYear, declaredEndYear, returns.size()));
        }

        double[] raw = new double[expectedLength];
        for (int i = 0; i < expectedLength; i++) {
            AnnualReturn annualReturn = returns.get(i);
            if (annualReturn.getYear() != declaredStartYear + i) {
                throw new HistoricalDataIntegrityException(String.format(
                        "Historical return series is not contiguous: expected year %d at position %d but found %d",
                        declaredStartYear + i, i, annualReturn.getYear()));
            }
            raw[i] = annualReturn.getTotalReturnPct();
        }

        return new HistoricalReturnSeries(declaredStartYear, declaredEndYear, raw,
                buildPool(raw, capPct, augmentWithHalfValues));
    }

    private static double[] buildPool(double[] raw, double capPct, boolean augmentWithHalfValues) {
        double[] capped = Arrays.stream(raw)
                .map(value -> Math.max(-capPct, Math.min(capPct, value)))
                .toArray();
        if (!augmentWithHalfValues) {
            return capped;
        }

        double[] pool = Arrays.copyOf(capped, capped.length * 2);
        for (int i = 0; i < capped.length; i++) {
            pool[capped.length + i] = capped[i] / 2;
        }
        return pool;
    }

    public int getYearCount() {
        return rawReturnsPct.length;
    }

    double rawReturnPct(int year) {
        if (year < startYear || year > endYear) {
            throw new IllegalArgumentException("No historical return for " + year);
        }
        return rawReturnsPct[year - startYear];
    }

    public int poolSize() {
        return samplingPoolPct.length;
    }

    public double poolValuePct(int index) {
        return samplingPoolPct[index];
    }

    /**
     * Pool position of a calendar year, for sequential playback.
     */
    public int poolIndexOf(int year) {
        return year - startYear;
    }
}
