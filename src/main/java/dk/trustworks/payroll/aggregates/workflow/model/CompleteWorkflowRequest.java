package dk.trustworks.payroll.aggregates.workflow.model;

import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Input for running every workflow stage in one go.
 *
 * @param positions placement per employee id
 * @param earnings  optional; when empty the run stops after payroll creation
 */
public record CompleteWorkflowRequest(@NotBlank String periodId,
                                      @NotEmpty List<String> employeeIds,
                                      @NotBlank String categoryId,
                                      Map<String, @Valid PositionPlacement> positions,
                                      List<@Valid EarningEntry> earnings) {

    public CompleteWorkflowRequest {
        employeeIds = employeeIds == null ? List.of() : List.copyOf(employeeIds);
        positions = positions == null ? Map.of() : Map.copyOf(positions);
        earnings = earnings == null ? List.of() : List.copyOf(earnings);
    }

    public boolean hasEarnings() {
        return !earnings.isEmpty();
    }
}
