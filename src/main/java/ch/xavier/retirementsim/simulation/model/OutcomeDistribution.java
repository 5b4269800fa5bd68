package ch.xavier.retirementsim.simulation.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class OutcomeDistribution {
    private final double p25;
    private final double p50;
    private final double p75;
}
