package ch.xavier.retirementsim.optimization.model;

import ch.xavier.retirementsim.tax.FilingStatus;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RothOptimizerParams {
    private final int retirementAge;
    private final double pretaxBalance;

    @JsonAlias("marital")
    @Builder.Default
    private final FilingStatus filingStatus = FilingStatus.SINGLE;

    private final double ssIncome;
    private final double annualWithdrawal;

    @Builder.Default
    private final double targetBracket = 0.24;
    @Builder.Default
    private final double growthRate = 0.07;

    // When present, conversion taxes are paid out of this account
    private final Double taxableBalance;
}
