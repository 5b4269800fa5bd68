package ch.xavier.retirementsim.optimization.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ConversionYear {
    private final int age;
    private final double conversionAmount;
    private final double tax;
    private final double pretaxBalanceBefore;
}
