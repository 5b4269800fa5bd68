package ch.xavier.retirementsim.legacy.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class GenerationDataPoint {
    private final int generation;
    private final int year;
    private final double estateValue;
    private final double estateTax;
    private final double netToHeirs;
    private final double fundRealValue;
    private final double livingBeneficiaries;
}
