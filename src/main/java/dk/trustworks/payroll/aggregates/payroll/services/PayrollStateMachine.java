package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.exceptions.InvalidPayrollTransitionException;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDateTime;

/**
 * State machine for payroll lifecycle transitions.
 *
 * Valid state transitions:
 * DRAFT → CALCULATING → CALCULATED → APPROVED → PAID
 *
 * CALCULATING and CALCULATED may go back to DRAFT so items can be changed.
 * Every non-terminal status may be CANCELLED.
 * Terminal states (no transitions out): PAID, CANCELLED
 */
@ApplicationScoped
public class PayrollStateMachine {

    public boolean canTransition(PayrollStatus from, PayrollStatus to) {
        if (from == to) {
            return true;
        }

        return switch (from) {
            case DRAFT -> to == PayrollStatus.CALCULATING || to == PayrollStatus.CANCELLED;
            case CALCULATING -> to == PayrollStatus.CALCULATED || to == PayrollStatus.DRAFT || to == PayrollStatus.CANCELLED;
            case CALCULATED -> to == PayrollStatus.APPROVED || to == PayrollStatus.DRAFT || to == PayrollStatus.CANCELLED;
            case APPROVED -> to == PayrollStatus.PAID || to == PayrollStatus.CANCELLED;
            case PAID, CANCELLED -> false;
        };
    }

    /**
     * Moves the payroll to the new status.
     *
     * @throws InvalidPayrollTransitionException if the transition is not allowed
     */
    public void transition(Payroll payroll, PayrollStatus newStatus) {
        PayrollStatus currentStatus = payroll.getStatus();

        if (currentStatus == newStatus) {
            Log.debugf("Payroll %s already in status %s, no transition needed", payroll.getUuid(), newStatus);
            return;
        }

        if (!canTransition(currentStatus, newStatus)) {
            String msg = String.format("Invalid payroll transition %s → %s for payroll %s",
                    currentStatus, newStatus, payroll.getUuid());
            Log.error(msg);
            throw new InvalidPayrollTransitionException(msg);
        }

        payroll.setStatus(newStatus);
        payroll.setUpdatedAt(LocalDateTime.now());
        Log.infof("Payroll %s transitioned: %s → %s", payroll.getUuid(), currentStatus, newStatus);
    }
}
