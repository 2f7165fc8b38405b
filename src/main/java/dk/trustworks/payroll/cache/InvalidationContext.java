package dk.trustworks.payroll.cache;

import java.util.Map;

/**
 * Identifiers of the changed data. Any field may be null; cache keys that need a
 * missing field are skipped.
 */
public record InvalidationContext(String payrollId, String employeeId, String periodId) {

    public static InvalidationContext empty() {
        return new InvalidationContext(null, null, null);
    }

    public static InvalidationContext forPayroll(String payrollId, String employeeId, String periodId) {
        return new InvalidationContext(payrollId, employeeId, periodId);
    }

    public static InvalidationContext forEmployee(String employeeId, String periodId) {
        return new InvalidationContext(null, employeeId, periodId);
    }

    public static InvalidationContext forPeriod(String periodId) {
        return new InvalidationContext(null, null, periodId);
    }

    /**
     * Reads the identifiers from a change-notification filter. Both snake case column
     * names and camel case field names are accepted.
     */
    public static InvalidationContext fromFilter(Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) {
            return empty();
        }
        return new InvalidationContext(
                firstOf(filter, "payroll_id", "payrollId"),
                firstOf(filter, "employee_id", "employeeId"),
                firstOf(filter, "period_id", "periodId"));
    }

    private static String firstOf(Map<String, ?> filter, String... keys) {
        for (String key : keys) {
            Object value = filter.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }
}
