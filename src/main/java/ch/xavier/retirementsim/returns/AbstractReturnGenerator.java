package ch.xavier.retirementsim.returns;

import java.util.NoSuchElementException;

/**
 * Turns a sequence of equity returns into growth factors, blending in bonds when a glide path is set. Index
 * {@code i} is priced at age {@code startAge + i}.
 */
abstract class AbstractReturnGenerator implements ReturnGenerator {

    private final int horizon;
    private final ReturnSeries series;
    private final double inflationPct;
    private final BondGlidePath glidePath;
    private final int startAge;
    private int produced;

    protected AbstractReturnGenerator(int horizon, ReturnSeries series, double inflationPct,
                                      BondGlidePath glidePath, int startAge) {
        this.horizon = Math.max(0, horizon);
        this.series = series == null ? ReturnSeries.NOMINAL : series;
        this.inflationPct = inflationPct;
        this.glidePath = glidePath;
        this.startAge = startAge;
    }

    @Override
    public int horizon() {
        return horizon;
    }

    @Override
    public boolean hasNext() {
        return produced < horizon;
    }

    @Override
    public double nextDouble() {
        if (!hasNext()) {
            throw new NoSuchElementException("Return horizon of " + horizon + " years exhausted");
        }
        int index = produced++;
        double stockPct = stockReturnPct(index);
        double returnPct = glidePath == null
                ? stockPct
                : BondGlidePath.blendedReturnPct(stockPct, bondReturnPct(stockPct),
                glidePath.bondAllocationPct(startAge + index));

        double nominalFactor = 1 + returnPct / 100;
        return series == ReturnSeries.REAL ? nominalFactor / (1 + inflationPct / 100) : nominalFactor;
    }

    /**
     * Equity return in percent for the {@code index}-th year. Called once per index, in order.
     */
    protected abstract double stockReturnPct(int index);

    protected double bondReturnPct(double stockReturnPct) {
        return BondGlidePath.bondReturnPct(stockReturnPct);
    }
}
