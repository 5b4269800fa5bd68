package ch.xavier.retirementsim.tax;

import org.springframework.stereotype.Component;

/**
 * Splits a gross withdrawal across the three account types and computes the taxes it triggers.
 * <p>
 * The RMD is taken from the pre-tax account first. Whatever the gross amount exceeds it by is spread
 * pro-rata over the taxable account, the pre-tax balance left after the RMD and the Roth account; a bucket
 * that cannot cover its share passes the shortfall on in the order taxable, pre-tax, Roth.
 * Ordinary income is taxed at the margin over {@code baseIncome} (Social Security and other income already
 * counted for the year).
 */
@Component
public class WithdrawalTaxCalculator {

    private final TaxCalculator taxCalculator;

    public WithdrawalTaxCalculator(TaxCalculator taxCalculator) {
        this.taxCalculator = taxCalculator;
    }

    /**
     * @param statePct   flat state income tax rate in percent
     * @param rmd        required minimum distribution for the year, zero before RMD age
     * @param baseIncome ordinary income received outside the portfolio this year
     */
    public WithdrawalTaxes compute(double gross, FilingStatus status,
                                   double taxableBalance, double pretaxBalance, double rothBalance,
                                   double taxableBasis, double statePct, double rmd, double baseIncome) {
        double totalBalance = taxableBalance + pretaxBalance + rothBalance;
        if (totalBalance <= 0 || gross <= 0) {
            return WithdrawalTaxes.none(taxableBasis);
        }

        double rmdDraw = Math.min(Math.max(0, rmd), pretaxBalance);

        double drawTaxable;
        double drawPretax;
        double drawRoth;

        if (rmdDraw >= gross) {
            drawTaxable = 0;
            drawPretax = gross;
            drawRoth = 0;
        } else {
            double remainder = gross - rmdDraw;
            double pretaxAvailable = pretaxBalance - rmdDraw;
            double available = taxableBalance + pretaxAvailable + rothBalance;

            double wantTaxable = 0;
            double wantPretax = 0;
            double wantRoth = 0;
            if (available > 0) {
                wantTaxable = remainder * taxableBalance / available;
                wantPretax = remainder * pretaxAvailable / available;
                wantRoth = remainder * rothBalance / available;
            }

            double usedTaxable = Math.min(wantTaxable, taxableBalance);
            double shortTaxable = wantTaxable - usedTaxable;

            double usedPretax = Math.min(wantPretax + shortTaxable, pretaxAvailable);
            double shortPretax = wantPretax + shortTaxable - usedPretax;

            double usedRoth = Math.min(wantRoth + shortPretax, rothBalance);

            drawTaxable = usedTaxable;
            drawPretax = rmdDraw + usedPretax;
            drawRoth = usedRoth;
        }

        double unrealizedGain = Math.max(0, taxableBalance - taxableBasis);
        double gainRatio = taxableBalance > 0 ? unrealizedGain / taxableBalance : 0;
        double gains = drawTaxable * gainRatio;
        double basisPortion = drawTaxable - gains;

        double base = Math.max(0, baseIncome);
        double ordinaryIncome = base + drawPretax;

        double ordinaryTax = taxCalculator.ordinaryTax(ordinaryIncome, status) - taxCalculator.ordinaryTax(base, status);
        double capitalGainsTax = taxCalculator.capitalGainsTax(gains, status, ordinaryIncome);
        double niit = taxCalculator.netInvestmentIncomeTax(gains, status, ordinaryIncome + gains);
        double stateTax = (drawPretax + gains) * (statePct / 100);

        return WithdrawalTaxes.builder()
                .totalTax(ordinaryTax + capitalGainsTax + niit + stateTax)
                .ordinaryTax(ordinaryTax)
                .capitalGainsTax(capitalGainsTax)
                .niit(niit)
                .stateTax(stateTax)
                .taxableDraw(drawTaxable)
                .pretaxDraw(drawPretax)
                .rothDraw(drawRoth)
                .realizedGains(gains)
                .newBasis(Math.max(0, taxableBasis - basisPortion))
                .build();
    }
}
