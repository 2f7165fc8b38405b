package dk.trustworks.payroll.aggregates.insurance.dto;

import java.util.List;

public record BaseValidationResult(boolean valid, List<String> warnings, List<String> errors) {

    public BaseValidationResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }
}
