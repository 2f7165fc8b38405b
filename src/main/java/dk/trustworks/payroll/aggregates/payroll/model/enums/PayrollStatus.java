package dk.trustworks.payroll.aggregates.payroll.model.enums;

import java.util.EnumSet;
import java.util.Set;

public enum PayrollStatus {
    DRAFT,
    CALCULATING,
    CALCULATED,
    APPROVED,
    PAID,
    CANCELLED;

    /** Statuses in which a payroll carries a completed calculation. */
    public static final Set<PayrollStatus> CALCULATED_OR_LATER = EnumSet.of(CALCULATED, APPROVED, PAID);

    public boolean isEditable() {
        return this == DRAFT || this == CALCULATING;
    }
}
