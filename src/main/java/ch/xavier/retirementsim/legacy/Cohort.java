package ch.xavier.retirementsim.legacy;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

/**
 * Beneficiaries born in the same year. Sizes are fractional since births are spread over the fertility window.
 */
@Getter
@Setter
@AllArgsConstructor
class Cohort {
    private double size;
    private int age;
    private boolean canReproduce;
    private double cumulativeBirths;

    static Cohort newborns(double size) {
        return new Cohort(size, 0, true, 0);
    }
}
