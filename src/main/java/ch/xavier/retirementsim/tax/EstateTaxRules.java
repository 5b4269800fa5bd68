package ch.xavier.retirementsim.tax;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EstateTaxRules {
    private final int baseYear;
    private final double singleExemption;
    private final double marriedExemption;
    private final double exemptionGrowthRate;
    private final double rate;

    public double exemption(FilingStatus status, int yearsAfterBase) {
        double base = status == FilingStatus.MARRIED ? marriedExemption : singleExemption;
        return yearsAfterBase > 0 ? base * Math.pow(1 + exemptionGrowthRate, yearsAfterBase) : base;
    }
}
