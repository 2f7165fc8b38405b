package dk.trustworks.payroll.aggregates.period.model.enums;

public enum PeriodStatus {
    DRAFT,
    OPEN,
    CLOSED
}
