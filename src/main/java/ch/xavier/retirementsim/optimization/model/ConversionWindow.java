package ch.xavier.retirementsim.optimization.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ConversionWindow {
    private final int startAge;
    private final int endAge;
    private final int years;
}
