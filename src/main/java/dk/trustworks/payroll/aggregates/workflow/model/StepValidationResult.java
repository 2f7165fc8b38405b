package dk.trustworks.payroll.aggregates.workflow.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of validating a workflow step.
 *
 * @param valid       no errors were found
 * @param canProceed  the workflow may leave the step; false on errors and on
 *                    completeness shortfalls of required steps
 * @param missingData ids of employees (or other records) lacking data for the step
 */
public record StepValidationResult(boolean valid,
                                   boolean canProceed,
                                   List<String> errors,
                                   List<String> warnings,
                                   List<String> missingData) {

    public StepValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        missingData = List.copyOf(missingData);
    }

    public static StepValidationResult ok() {
        return new StepValidationResult(true, true, List.of(), List.of(), List.of());
    }

    public static StepValidationResult rejected(String error) {
        return new StepValidationResult(false, false, List.of(error), List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> missingData = new ArrayList<>();
        private boolean blockingShortfall;

        public Builder error(String error) {
            errors.add(error);
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder missing(List<String> ids) {
            missingData.addAll(ids);
            return this;
        }

        /**
         * Records an incomplete step. It blocks advancing unless the step is optional.
         */
        public Builder shortfall(String warning, boolean optional) {
            warnings.add(warning);
            if (!optional) {
                blockingShortfall = true;
            }
            return this;
        }

        public StepValidationResult build() {
            boolean valid = errors.isEmpty();
            return new StepValidationResult(valid, valid && !blockingShortfall, errors, warnings, missingData);
        }
    }
}
