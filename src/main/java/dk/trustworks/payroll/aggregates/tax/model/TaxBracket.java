package dk.trustworks.payroll.aggregates.tax.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One band of the progressive table. Covers amounts in {@code (lowerBound, upperBound]};
 * a null upper bound means the band is open ended.
 */
public record TaxBracket(int level,
                         BigDecimal lowerBound,
                         BigDecimal upperBound,
                         BigDecimal rate,
                         BigDecimal quickDeduction) {

    public TaxBracket {
        Objects.requireNonNull(lowerBound, "lowerBound");
        Objects.requireNonNull(rate, "rate");
        Objects.requireNonNull(quickDeduction, "quickDeduction");
    }

    public boolean contains(BigDecimal amount) {
        boolean aboveLower = amount.compareTo(lowerBound) > 0 || (level == 1 && amount.signum() <= 0);
        boolean belowUpper = upperBound == null || amount.compareTo(upperBound) <= 0;
        return aboveLower && belowUpper;
    }
}
