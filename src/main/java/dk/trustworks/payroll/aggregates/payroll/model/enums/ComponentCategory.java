package dk.trustworks.payroll.aggregates.payroll.model.enums;

public enum ComponentCategory {
    BASIC_SALARY,
    ALLOWANCE,
    BONUS,
    OVERTIME,
    SOCIAL_INSURANCE,
    HOUSING_FUND,
    INCOME_TAX,
    OTHER_DEDUCTION
}
