package dk.trustworks.payroll.aggregates.tax.model;

import java.math.BigDecimal;

public enum PeriodKind {
    MONTHLY(new BigDecimal("5000"), TaxBracketTable.MONTHLY),
    ANNUAL(new BigDecimal("60000"), TaxBracketTable.ANNUAL),
    /**
     * Monthly pay period withheld on the year-to-date accumulation: the monthly threshold is
     * taken off each month and the accumulated amount is taxed with the annual table.
     */
    CUMULATIVE(new BigDecimal("5000"), TaxBracketTable.ANNUAL);

    private final BigDecimal threshold;
    private final TaxBracketTable table;

    PeriodKind(BigDecimal threshold, TaxBracketTable table) {
        this.threshold = threshold;
        this.table = table;
    }

    /** Basic deduction subtracted before the table applies. */
    public BigDecimal threshold() {
        return threshold;
    }

    public TaxBracketTable table() {
        return table;
    }
}
