package ch.xavier.retirementsim.tax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class WithdrawalTaxCalculatorTest {

    private final WithdrawalTaxCalculator calculator =
            new WithdrawalTaxCalculator(new TaxCalculator(TaxTables.federal2026()));

    @Test
    @DisplayName("Withdrawal is split pro-rata and gains follow the unrealized gain ratio")
    void compute_proRataSplit() {
        WithdrawalTaxes taxes = calculator.compute(40_000, FilingStatus.SINGLE,
                100_000, 100_000, 0, 50_000, 0, 0, 0);

        assertEquals(20_000, taxes.getTaxableDraw(), 1e-6);
        assertEquals(20_000, taxes.getPretaxDraw(), 1e-6);
        assertEquals(0, taxes.getRothDraw(), 1e-6);
        assertEquals(10_000, taxes.getRealizedGains(), 1e-6);
        assertEquals(40_000, taxes.getNewBasis(), 1e-6);
        // 20,000 ordinary income, 3,900 above the deduction at 10%; gains stay in the 0% bracket
        assertEquals(390, taxes.getOrdinaryTax(), 1e-6);
        assertEquals(0, taxes.getCapitalGainsTax(), 1e-6);
        assertEquals(390, taxes.getTotalTax(), 1e-6);
    }

    @Test
    @DisplayName("An RMD larger than the withdrawal takes everything from the pre-tax account")
    void compute_rmdCoversWithdrawal() {
        WithdrawalTaxes taxes = calculator.compute(20_000, FilingStatus.SINGLE,
                100_000, 500_000, 100_000, 100_000, 0, 30_000, 0);

        assertEquals(0, taxes.getTaxableDraw(), 1e-9);
        assertEquals(20_000, taxes.getPretaxDraw(), 1e-9);
        assertEquals(0, taxes.getRothDraw(), 1e-9);
    }

    @Test
    @DisplayName("The RMD is drawn first, the rest is shared among the accounts")
    void compute_rmdThenProRata() {
        WithdrawalTaxes taxes = calculator.compute(40_000, FilingStatus.MARRIED,
                100_000, 120_000, 100_000, 100_000, 0, 20_000, 0);

        // 20,000 remainder over 100k / 100k / 100k
        assertEquals(20_000 / 3.0, taxes.getTaxableDraw(), 1e-6);
        assertEquals(20_000 + 20_000 / 3.0, taxes.getPretaxDraw(), 1e-6);
        assertEquals(20_000 / 3.0, taxes.getRothDraw(), 1e-6);
    }

    @Test
    @DisplayName("Draws never exceed the balances when the withdrawal is larger than the portfolio")
    void compute_shortfallCascades() {
        WithdrawalTaxes taxes = calculator.compute(250_000, FilingStatus.SINGLE,
                100_000, 100_000, 0, 100_000, 0, 0, 0);

        assertThat(taxes.getTaxableDraw()).isLessThanOrEqualTo(100_000);
        assertThat(taxes.getPretaxDraw()).isLessThanOrEqualTo(100_000);
        assertEquals(200_000, taxes.getTaxableDraw() + taxes.getPretaxDraw() + taxes.getRothDraw(), 1e-6);
    }

    @Test
    @DisplayName("State tax is a flat rate on pre-tax draws and realized gains")
    void compute_stateTax() {
        WithdrawalTaxes taxes = calculator.compute(40_000, FilingStatus.SINGLE,
                0, 100_000, 0, 0, 5, 0, 0);

        assertEquals(2_000, taxes.getStateTax(), 1e-6);
    }

    @Test
    @DisplayName("Ordinary tax is charged at the margin above other income")
    void compute_marginalOverBaseIncome() {
        TaxCalculator taxCalculator = new TaxCalculator(TaxTables.federal2026());
        WithdrawalTaxes taxes = calculator.compute(30_000, FilingStatus.SINGLE,
                0, 100_000, 0, 0, 0, 0, 40_000);

        double expected = taxCalculator.ordinaryTax(70_000, FilingStatus.SINGLE)
                - taxCalculator.ordinaryTax(40_000, FilingStatus.SINGLE);
        assertEquals(expected, taxes.getOrdinaryTax(), 1e-6);
    }

    @Test
    @DisplayName("Nothing to withdraw from leaves the basis untouched")
    void compute_emptyPortfolio() {
        WithdrawalTaxes taxes = calculator.compute(10_000, FilingStatus.SINGLE, 0, 0, 0, 5_000, 5, 0, 0);

        assertEquals(0, taxes.getTotalTax());
        assertEquals(5_000, taxes.getNewBasis());
    }
}
