package ch.xavier.retirementsim.simulation;

import java.util.List;

/**
 * Child-rearing and pre-Medicare health insurance costs, in base-year dollars before the inflation factor.
 */
final class HouseholdExpenses {

    static final double CHILDCARE_ANNUAL = 15_000;
    static final double K12_ANNUAL = 3_000;
    static final double COLLEGE_ANNUAL = 25_000;
    static final double DEPENDENT_BASE_ANNUAL = 8_000;
    static final int CHILDCARE_END_AGE = 6;
    static final int K12_END_AGE = 18;
    static final int COLLEGE_END_AGE = 22;
    static final int DEPENDENT_END_AGE = 18;

    static final int MEDICARE_AGE = 65;
    static final double PER_CHILD_HEALTHCARE = 3_000;
    static final int HEALTHCARE_DEPENDENT_END_AGE = 26;

    private HouseholdExpenses() {
    }

    /**
     * @param childrenStartAges ages at year 0, negative for children not born yet
     */
    static double childExpenses(List<Integer> childrenStartAges, int simulationYear, double inflationFactor) {
        double total = 0;

        for (int startAge : childrenStartAges) {
            int age = startAge + simulationYear;
            if (age < 0 || age >= COLLEGE_END_AGE) {
                continue;
            }

            double expense;
            if (age < CHILDCARE_END_AGE) {
                expense = CHILDCARE_ANNUAL;
            } else if (age < K12_END_AGE) {
                expense = K12_ANNUAL;
            } else {
                expense = COLLEGE_ANNUAL;
            }

            if (age < DEPENDENT_END_AGE) {
                double ageFactor = age < 6 ? 1.0 : age < 13 ? 0.85 : 0.7;
                expense += DEPENDENT_BASE_ANNUAL * ageFactor;
            } else {
                expense += DEPENDENT_BASE_ANNUAL * 0.5;
            }

            total += expense;
        }

        return total * inflationFactor;
    }

    static double individualPremium(int age) {
        if (age >= MEDICARE_AGE) {
            return 0;
        }
        if (age < 30) {
            return 4_800;
        }
        if (age < 40) {
            return 6_000;
        }
        if (age < 50) {
            return 8_400;
        }
        if (age < 55) {
            return 10_800;
        }
        if (age < 60) {
            return 13_200;
        }
        return 15_600;
    }

    /**
     * @param age2 spouse age, {@code null} for single filers
     */
    static double preMedicareHealthcare(int age1, Integer age2, int dependentChildren, double medicalInflationFactor) {
        double total = individualPremium(age1);
        boolean anyoneUnder65 = age1 < MEDICARE_AGE;

        if (age2 != null) {
            total += individualPremium(age2);
            anyoneUnder65 |= age2 < MEDICARE_AGE;
        }

        if (dependentChildren > 0 && anyoneUnder65) {
            total += dependentChildren * PER_CHILD_HEALTHCARE;
        }

        return total * medicalInflationFactor;
    }
}
