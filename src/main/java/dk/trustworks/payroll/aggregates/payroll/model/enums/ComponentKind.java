package dk.trustworks.payroll.aggregates.payroll.model.enums;

public enum ComponentKind {
    EARNING,
    DEDUCTION
}
