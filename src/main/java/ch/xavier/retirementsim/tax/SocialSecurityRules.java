package ch.xavier.retirementsim.tax;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SocialSecurityRules {
    // Bend points on average indexed monthly earnings
    private final double firstBendPoint;
    private final double secondBendPoint;
    private final double firstReplacementRate;
    private final double secondReplacementRate;
    private final double thirdReplacementRate;

    private final double fullRetirementAge;

    // Claiming adjustments, in percent per month
    private final double earlyReductionFirst36Months;
    private final double earlyReductionBeyond36Months;
    private final double delayedCreditPerMonth;

    // Spousal benefit
    private final double spousalShareOfPia;
    private final double spousalEarlyReductionFirst36Months;
}
