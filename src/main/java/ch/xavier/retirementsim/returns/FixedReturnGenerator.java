package ch.xavier.retirementsim.returns;

/**
 * Same return every year. Bonds, when blended in, earn their long-run average.
 */
public class FixedReturnGenerator extends AbstractReturnGenerator {

    private final double nominalPct;

    public FixedReturnGenerator(int horizon, double nominalPct, BondGlidePath glidePath, int startAge) {
        super(horizon, ReturnSeries.NOMINAL, 0, glidePath, startAge);
        this.nominalPct = nominalPct;
    }

    @Override
    protected double stockReturnPct(int index) {
        return nominalPct;
    }

    @Override
    protected double bondReturnPct(double stockReturnPct) {
        return BondGlidePath.BOND_NOMINAL_AVG_PCT;
    }
}
