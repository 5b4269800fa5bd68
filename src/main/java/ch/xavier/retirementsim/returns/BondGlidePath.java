package ch.xavier.retirementsim.returns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Bond share of the portfolio by age. Percentages are in percent ({@code 60} for 60% bonds).
 * <p>
 * {@code aggressive} holds no bonds, {@code ageBased} moves from 10% before 40 to 60% from 60 on, and
 * {@code custom} moves from {@code startPct} to {@code endPct} between {@code startAge} and {@code endAge}
 * following {@code shape}.
 */
@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class BondGlidePath {

    // Long-run nominal bond return, and how much of the equity surprise bonds follow
    public static final double BOND_NOMINAL_AVG_PCT = 4.5;
    private static final double EQUITY_REFERENCE_PCT = 9.8;
    private static final double EQUITY_SENSITIVITY = 0.3;

    private static final int AGE_BASED_START_AGE = 40;
    private static final int AGE_BASED_END_AGE = 60;
    private static final double AGE_BASED_START_PCT = 10;
    private static final double AGE_BASED_END_PCT = 60;

    public enum Strategy {
        @JsonProperty("aggressive") AGGRESSIVE,
        @JsonProperty("ageBased") AGE_BASED,
        @JsonProperty("custom") CUSTOM
    }

    public enum Shape {
        @JsonProperty("linear") LINEAR,
        // Most of the shift happens early
        @JsonProperty("accelerated") ACCELERATED,
        // Most of the shift happens late
        @JsonProperty("decelerated") DECELERATED
    }

    @Builder.Default
    private final Strategy strategy = Strategy.CUSTOM;
    private final int startAge;
    private final int endAge;
    private final double startPct;
    private final double endPct;
    @Builder.Default
    private final Shape shape = Shape.LINEAR;

    public double bondAllocationPct(int age) {
        if (strategy == Strategy.AGGRESSIVE) {
            return 0;
        }
        if (strategy == Strategy.AGE_BASED) {
            return interpolate(age, AGE_BASED_START_AGE, AGE_BASED_END_AGE, AGE_BASED_START_PCT, AGE_BASED_END_PCT,
                    Shape.LINEAR);
        }
        return interpolate(age, startAge, endAge, startPct, endPct, shape);
    }

    private static double interpolate(int age, int fromAge, int toAge, double fromPct, double toPct, Shape shape) {
        if (age < fromAge) {
            return fromPct;
        }
        if (age >= toAge) {
            return toPct;
        }
        double progress = (double) (age - fromAge) / (toAge - fromAge);
        double adjusted = switch (shape == null ? Shape.LINEAR : shape) {
            case LINEAR -> progress;
            case ACCELERATED -> Math.sqrt(progress);
            case DECELERATED -> progress * progress;
        };
        return fromPct + (toPct - fromPct) * adjusted;
    }

    /**
     * Bond return for a year in which equities returned {@code stockReturnPct}.
     */
    public static double bondReturnPct(double stockReturnPct) {
        return BOND_NOMINAL_AVG_PCT + (stockReturnPct - EQUITY_REFERENCE_PCT) * EQUITY_SENSITIVITY;
    }

    public static double blendedReturnPct(double stockReturnPct, double bondReturnPct, double bondAllocationPct) {
        double bondShare = bondAllocationPct / 100;
        return (1 - bondShare) * stockReturnPct + bondShare * bondReturnPct;
    }
}
