package ch.xavier.retirementsim.returns;

/**
 * Resamples the historical pool with replacement, one uniformly chosen year per step.
 */
public class BootstrapReturnGenerator extends AbstractReturnGenerator {

    private final HistoricalReturnSeries history;
    private final SeededRandom random;

    public BootstrapReturnGenerator(HistoricalReturnSeries history, int horizon, ReturnSeries series,
                                    double inflationPct, int seed, BondGlidePath glidePath, int startAge) {
        super(horizon, series, inflationPct, glidePath, startAge);
        this.history = history;
        this.random = new SeededRandom(seed);
    }

    @Override
    protected double stockReturnPct(int index) {
        return history.poolValuePct(random.nextInt(history.poolSize()));
    }
}
