package dk.trustworks.payroll.aggregates.tax.model;

import java.util.List;

public record TaxValidationResult(boolean valid,
                                  List<String> errors,
                                  List<String> warnings,
                                  List<String> suggestions) {

    public TaxValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
    }
}
