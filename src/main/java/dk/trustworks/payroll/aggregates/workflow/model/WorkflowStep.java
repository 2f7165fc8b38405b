package dk.trustworks.payroll.aggregates.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Steps of the payroll creation workflow, in order.
 */
public enum WorkflowStep {
    PERIOD_SELECTION,
    EMPLOYEE_CATEGORY,
    EMPLOYEE_POSITION,
    CONTRIBUTION_BASE,
    EARNINGS_SETUP,
    CALCULATION,
    REVIEW,
    COMPLETION;

    private static final List<WorkflowStep> ORDER = List.of(values());

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static WorkflowStep fromWireId(String wireId) {
        return parse(wireId).orElseThrow(() -> new IllegalArgumentException("Unknown workflow step: " + wireId));
    }

    public static Optional<WorkflowStep> parse(String wireId) {
        if (wireId == null) {
            return Optional.empty();
        }
        String normalized = wireId.trim();
        return Arrays.stream(values())
                .filter(step -> step.wireId().equalsIgnoreCase(normalized) || step.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    public Optional<WorkflowStep> next() {
        return ordinal() + 1 < ORDER.size() ? Optional.of(ORDER.get(ordinal() + 1)) : Optional.empty();
    }

    public Optional<WorkflowStep> previous() {
        return ordinal() > 0 ? Optional.of(ORDER.get(ordinal() - 1)) : Optional.empty();
    }

    /**
     * All steps that come before this one.
     */
    public List<WorkflowStep> predecessors() {
        return ORDER.subList(0, ordinal());
    }
}
