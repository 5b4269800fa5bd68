package ch.xavier.retirementsim.optimization.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RmdYear {
    private final int age;
    private final double rmd;
    private final double tax;
}
