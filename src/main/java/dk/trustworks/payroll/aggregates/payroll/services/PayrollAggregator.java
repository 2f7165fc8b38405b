package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.payroll.dto.PayrollTotals;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;

/**
 * Sums payroll items into gross pay, total deductions and net pay.
 */
@ApplicationScoped
public class PayrollAggregator {

    private static final int SCALE = 2;
    private static final RoundingMode RM = RoundingMode.HALF_UP;

    /**
     * @throws IllegalArgumentException if an item refers to a component not in the map
     */
    public PayrollTotals aggregate(Collection<PayrollItem> items, Map<String, SalaryComponent> componentsById) {
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal deductions = BigDecimal.ZERO;
        for (PayrollItem item : items) {
            SalaryComponent component = componentsById.get(item.getComponentId());
            if (component == null) {
                throw new IllegalArgumentException(String.format(
                        "Payroll item %s refers to unknown salary component %s", item.getUuid(), item.getComponentId()));
            }
            BigDecimal amount = item.getAmount() == null ? BigDecimal.ZERO : item.getAmount();
            if (component.isEarning()) {
                gross = gross.add(amount);
            } else {
                deductions = deductions.add(amount);
            }
        }
        gross = gross.setScale(SCALE, RM);
        deductions = deductions.setScale(SCALE, RM);
        return new PayrollTotals(gross, deductions, gross.subtract(deductions));
    }
}
