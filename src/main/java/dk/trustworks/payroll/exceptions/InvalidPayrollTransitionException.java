package dk.trustworks.payroll.exceptions;

/**
 * Thrown when a payroll or period is asked to move to a status its current status does not
 * allow, or when a payroll is written to after it left the editable statuses.
 */
public class InvalidPayrollTransitionException extends RuntimeException {

    public InvalidPayrollTransitionException(String message) {
        super(message);
    }
}
