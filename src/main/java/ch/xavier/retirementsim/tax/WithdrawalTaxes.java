package ch.xavier.retirementsim.tax;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class WithdrawalTaxes {
    private final double totalTax;
    private final double ordinaryTax;
    private final double capitalGainsTax;
    private final double niit;
    private final double stateTax;

    // Amounts taken from each bucket
    private final double taxableDraw;
    private final double pretaxDraw;
    private final double rothDraw;

    private final double realizedGains;
    private final double newBasis;

    static WithdrawalTaxes none(double basis) {
        return WithdrawalTaxes.builder().newBasis(basis).build();
    }
}
