package ch.xavier.retirementsim.simulation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One earner's yearly contributions, split by destination account.
 */
@Builder
@Getter
@ToString
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Contributions {
    public static final Contributions NONE = new Contributions(0, 0, 0, 0);

    private double taxable;
    private double pretax;
    private double roth;
    private double employerMatch; // Lands in the pre-tax account

    public double total() {
        return taxable + pretax + roth + employerMatch;
    }

    public Contributions scaled(double factor) {
        return new Contributions(taxable * factor, pretax * factor, roth * factor, employerMatch * factor);
    }
}
