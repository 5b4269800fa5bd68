package ch.xavier.retirementsim.tax;

import lombok.Builder;
import lombok.Getter;

/**
 * Payroll (FICA) and self-employment (SECA) rates. Rates are decimals.
 */
@Getter
@Builder
public class EmploymentTaxRules {
    private final double socialSecurityWageBase;
    private final double socialSecurityEmployeeRate;
    private final double socialSecuritySelfEmployedRate;
    private final double medicareEmployeeRate;
    private final double medicareSelfEmployedRate;
    private final double additionalMedicareThreshold;
    private final double additionalMedicareRate;

    // Share of net self-employment earnings subject to SECA
    private final double selfEmploymentFactor;
}
