package dk.trustworks.payroll.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when input to a payroll operation breaks a business rule.
 * Carries every violation found, not just the first.
 */
@Getter
public class PayrollValidationException extends RuntimeException {

    private final List<String> errors;

    public PayrollValidationException(String message) {
        this(List.of(message));
    }

    public PayrollValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
