package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.assignments.dto.CategoryAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.dto.JobAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.services.EmployeeAssignmentService;
import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseCommand;
import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseResolution;
import dk.trustworks.payroll.aggregates.insurance.services.ContributionBaseResolver;
import dk.trustworks.payroll.aggregates.insurance.services.ContributionBaseService;
import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.payroll.dto.EmployeeEarnings;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollCalculationService;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollService;
import dk.trustworks.payroll.aggregates.workflow.model.PositionPlacement;
import dk.trustworks.payroll.batch.BatchCancellation;
import dk.trustworks.payroll.batch.BatchOperationCoordinator;
import dk.trustworks.payroll.batch.BatchOperationResult;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The bulk mutations behind the workflow steps. Each item is written in its own
 * transaction by the called service and keyed by its natural composite key.
 */
@ApplicationScoped
public class PayrollBatchOperations {

    @Inject
    BatchOperationCoordinator coordinator;

    @Inject
    EmployeeAssignmentService assignmentService;

    @Inject
    ContributionBaseResolver baseResolver;

    @Inject
    ContributionBaseService baseService;

    @Inject
    PayrollService payrollService;

    @Inject
    PayrollCalculationService calculationService;

    public BatchOperationResult assignCategories(List<String> employeeIds, String categoryId, String periodId,
                                                 BatchCancellation cancellation) {
        return coordinator.execute("assign-categories", employeeIds, Function.identity(),
                employeeId -> assignmentService.assignCategory(
                        new CategoryAssignmentCommand(employeeId, categoryId, periodId, null)),
                cancellation);
    }

    /**
     * Employees without a placement fail their item.
     */
    public BatchOperationResult assignPositions(List<String> employeeIds, Map<String, PositionPlacement> placements,
                                                String periodId, BatchCancellation cancellation) {
        return coordinator.execute("assign-positions", employeeIds, Function.identity(), employeeId -> {
            PositionPlacement placement = placements.get(employeeId);
            if (placement == null) {
                throw new PayrollValidationException("No position given for employee " + employeeId);
            }
            assignmentService.assignPosition(new JobAssignmentCommand(employeeId, placement.positionId(),
                    placement.departmentId(), periodId));
        }, cancellation);
    }

    public BatchOperationResult setContributionBases(List<ContributionBaseCommand> commands,
                                                     BatchCancellation cancellation) {
        return coordinator.execute("set-contribution-bases", commands, ContributionBaseCommand::itemId,
                baseService::upsert, cancellation);
    }

    /**
     * Resolves every insurance type for each employee and stores the applicable bases.
     * An employee fails when any of its types could not be resolved or stored.
     */
    public BatchOperationResult resolveAndSetContributionBases(List<String> employeeIds, String periodId,
                                                               BatchCancellation cancellation) {
        return coordinator.execute("resolve-contribution-bases", employeeIds, Function.identity(), employeeId -> {
            List<ContributionBaseResolution> resolutions = baseResolver
                    .batchResolve(List.of(employeeId), periodId)
                    .getOrDefault(employeeId, List.of());
            List<String> unresolved = resolutions.stream()
                    .filter(r -> !r.resolved())
                    .map(r -> r.insuranceTypeId() + ": " + r.reason())
                    .toList();
            if (!unresolved.isEmpty()) {
                throw new PayrollValidationException(unresolved);
            }
            for (ContributionBaseResolution resolution : resolutions) {
                if (resolution.applicable()) {
                    baseService.upsert(new ContributionBaseCommand(employeeId, resolution.insuranceTypeId(),
                            periodId, resolution.baseAmount()));
                }
            }
        }, cancellation);
    }

    public BatchOperationResult createPayrolls(List<String> employeeIds, String periodId,
                                               BatchCancellation cancellation) {
        return coordinator.execute("create-payrolls", employeeIds, Function.identity(),
                employeeId -> payrollService.createPayroll(employeeId, periodId), cancellation);
    }

    /**
     * Writes earnings one employee per item, so each employee's lines share one transaction
     * and the item id in the result is the employee id.
     */
    public BatchOperationResult enterEarnings(List<EarningEntry> entries, String periodId,
                                              BatchCancellation cancellation) {
        return coordinator.execute("enter-earnings", EmployeeEarnings.group(entries), EmployeeEarnings::employeeId,
                earnings -> payrollService.upsertEarnings(periodId, earnings.employeeId(), earnings.entries()),
                cancellation);
    }

    public BatchOperationResult calculatePayrolls(List<String> employeeIds, String periodId,
                                                  BatchCancellation cancellation) {
        return coordinator.execute("calculate-payrolls", employeeIds, Function.identity(),
                employeeId -> calculationService.calculateForEmployee(employeeId, periodId), cancellation);
    }
}
