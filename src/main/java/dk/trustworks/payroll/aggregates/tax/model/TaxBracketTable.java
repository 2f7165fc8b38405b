package dk.trustworks.payroll.aggregates.tax.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statutory comprehensive-income bracket table. The monthly table is derived from the
 * annual one by dividing bounds and quick deductions by twelve.
 */
public final class TaxBracketTable {

    private static final String[] ANNUAL_UPPER = {"36000", "144000", "300000", "420000", "660000", "960000", null};
    private static final String[] RATES = {"0.03", "0.10", "0.20", "0.25", "0.30", "0.35", "0.45"};
    private static final String[] ANNUAL_QUICK_DEDUCTIONS = {"0", "2520", "16920", "31920", "52920", "85920", "181920"};

    public static final TaxBracketTable ANNUAL = new TaxBracketTable(BigDecimal.ONE);
    public static final TaxBracketTable MONTHLY = new TaxBracketTable(BigDecimal.valueOf(12));

    private final List<TaxBracket> brackets;

    private TaxBracketTable(BigDecimal divisor) {
        List<TaxBracket> list = new ArrayList<>();
        BigDecimal lower = BigDecimal.ZERO;
        for (int i = 0; i < RATES.length; i++) {
            BigDecimal upper = ANNUAL_UPPER[i] == null ? null : scale(new BigDecimal(ANNUAL_UPPER[i]), divisor);
            BigDecimal quick = scale(new BigDecimal(ANNUAL_QUICK_DEDUCTIONS[i]), divisor);
            list.add(new TaxBracket(i + 1, lower, upper, new BigDecimal(RATES[i]), quick));
            lower = upper;
        }
        this.brackets = Collections.unmodifiableList(list);
    }

    private static BigDecimal scale(BigDecimal annual, BigDecimal divisor) {
        return annual.divide(divisor, 10, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    public List<TaxBracket> brackets() {
        return brackets;
    }

    /**
     * Band containing the amount. Zero and negative amounts fall in the first band.
     */
    public TaxBracket bracketFor(BigDecimal amount) {
        for (TaxBracket bracket : brackets) {
            if (bracket.contains(amount)) {
                return bracket;
            }
        }
        return brackets.get(brackets.size() - 1);
    }
}
