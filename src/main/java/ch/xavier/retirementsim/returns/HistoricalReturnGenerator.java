package ch.xavier.retirementsim.returns;

/**
 * Replays the pool in order from a start year, wrapping around at the end.
 */
public class HistoricalReturnGenerator extends AbstractReturnGenerator {

    private final HistoricalReturnSeries history;
    private final int startIndex;

    public HistoricalReturnGenerator(HistoricalReturnSeries history, int horizon, ReturnSeries series,
                                     double inflationPct, int startYear, BondGlidePath glidePath, int startAge) {
        super(horizon, series, inflationPct, glidePath, startAge);
        this.history = history;
        this.startIndex = history.poolIndexOf(startYear);
    }

    @Override
    protected double stockReturnPct(int index) {
        return history.poolValuePct(Math.floorMod(startIndex + index, history.poolSize()));
    }
}
