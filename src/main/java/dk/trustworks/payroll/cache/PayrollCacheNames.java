package dk.trustworks.payroll.cache;

/**
 * Names of the Quarkus caches on the payroll read side.
 */
public final class PayrollCacheNames {

    public static final String PAYROLL_DETAIL = "payroll-detail";
    public static final String PAYROLL_ITEMS = "payroll-items";
    public static final String PAYROLL_LIST = "payroll-list";
    public static final String PAYROLL_STATISTICS = "payroll-statistics";
    public static final String EMPLOYEE_PAYROLLS = "employee-payrolls";
    public static final String CONTRIBUTION_BASES = "contribution-bases";
    public static final String PERIOD_CONTRIBUTION_BASES = "period-contribution-bases";
    public static final String EMPLOYEE_ASSIGNMENTS = "employee-assignments";
    public static final String PAYROLL_PERIODS = "payroll-periods";
    public static final String SALARY_COMPONENTS = "salary-components";
    public static final String INSURANCE_RULES = "insurance-rules";

    private PayrollCacheNames() {
    }
}
