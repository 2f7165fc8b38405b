package dk.trustworks.payroll.aggregates.tax.services;

import dk.trustworks.payroll.aggregates.tax.model.PeriodKind;
import dk.trustworks.payroll.aggregates.tax.model.TaxBracket;
import dk.trustworks.payroll.aggregates.tax.model.TaxInput;
import dk.trustworks.payroll.aggregates.tax.model.TaxResult;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cumulative withholding of progressive income tax.
 *
 * <p>The tax is always computed on the accumulated taxable amount for the year; what is
 * withheld in a period is the difference to the tax already withheld. Intermediate figures
 * keep full precision; rounding happens only when the {@link TaxResult} is built.
 */
@ApplicationScoped
public class ProgressiveTaxCalculator {

    private static final int SCALE = 2;
    private static final int RATE_SCALE = 4;
    private static final RoundingMode RM = RoundingMode.HALF_UP;

    @Inject MeterRegistry registry;

    public TaxResult compute(TaxInput input) {
        Objects.requireNonNull(input, "tax input");
        PeriodKind kind = input.periodKind();

        BigDecimal taxableIncome = input.grossIncome().subtract(input.preTaxDeductions());
        BigDecimal taxableAmount = taxableIncome
                .subtract(input.specialDeductions())
                .subtract(input.additionalDeductions())
                .subtract(kind.threshold())
                .max(BigDecimal.ZERO);
        BigDecimal accumulatedTaxable = taxableAmount.add(input.accumulatedPriorTaxable());

        TaxBracket bracket = kind.table().bracketFor(accumulatedTaxable);
        BigDecimal taxDue = accumulatedTaxable.multiply(bracket.rate())
                .subtract(bracket.quickDeduction())
                .max(BigDecimal.ZERO);
        BigDecimal incrementalTax = taxDue.subtract(input.accumulatedPriorTax()).max(BigDecimal.ZERO);
        BigDecimal accumulatedTax = input.accumulatedPriorTax().add(incrementalTax);

        if (registry != null) {
            registry.counter("payroll.tax.computations", "period", kind.name().toLowerCase()).increment();
        }

        return new TaxResult(
                money(taxableIncome),
                money(taxableAmount),
                money(accumulatedTaxable),
                bracket.level(),
                bracket.rate().setScale(RATE_SCALE, RM),
                money(bracket.quickDeduction()),
                money(taxDue),
                money(incrementalTax),
                money(accumulatedTax),
                kind);
    }

    /**
     * Computes a sequence of periods in order, feeding each result's accumulated figures
     * into the next input. The prior accumulation of the first input is kept as given.
     */
    public List<TaxResult> computeYearToDate(List<TaxInput> periods) {
        Objects.requireNonNull(periods, "periods");
        List<TaxResult> results = new ArrayList<>(periods.size());
        TaxResult previous = null;
        for (TaxInput input : periods) {
            TaxInput chained = previous == null
                    ? input
                    : input.withPriorAccumulation(previous.accumulatedTaxable(), previous.accumulatedTax());
            previous = compute(chained);
            results.add(previous);
        }
        return results;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(SCALE, RM);
    }
}
