package ch.xavier.retirementsim.tax;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One bracket of a progressive schedule. {@code limit} is the cumulative upper bound of the bracket,
 * {@link Double#POSITIVE_INFINITY} for the top one.
 */
@Data
@AllArgsConstructor
public class TaxBracket {
    private final double limit;
    private final double rate;
}
