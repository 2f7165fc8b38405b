package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseCommand;
import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.workflow.model.CompleteWorkflowRequest;
import dk.trustworks.payroll.aggregates.workflow.model.PositionPlacement;
import dk.trustworks.payroll.aggregates.workflow.model.StageResult;
import dk.trustworks.payroll.aggregates.workflow.model.StepValidationResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowExecutionResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowStage;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowState;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowStep;
import dk.trustworks.payroll.batch.BatchCancellation;
import dk.trustworks.payroll.batch.BatchOperationResult;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One operator's pass through the payroll creation workflow.
 *
 * <p>Holds the current {@link WorkflowState} and replaces it on every operation. A session is
 * driven by one operator at a time, but its state may be read from any request thread.
 * Created by {@link PayrollWorkflowFactory}.
 *
 * <p>Steps are entered in order. Leaving a step requires its validation to pass; going back
 * marks the step left and the step re-entered as incomplete again.
 */
public class PayrollWorkflow {

    private final String id;
    private final WorkflowStepValidator validator;
    private final PayrollBatchOperations operations;

    private volatile WorkflowState state = WorkflowState.initial();
    private volatile BatchCancellation activeBatch;

    PayrollWorkflow(String id, WorkflowStepValidator validator, PayrollBatchOperations operations) {
        this.id = id;
        this.validator = validator;
        this.operations = operations;
    }

    public String getId() {
        return id;
    }

    public WorkflowState state() {
        return state;
    }

    /**
     * Validates the current step and moves to the next one when it may be left.
     * A rejected advance only updates errors and warnings.
     */
    public StepValidationResult advance() {
        WorkflowStep current = state.currentStep();
        if (current.next().isEmpty()) {
            StepValidationResult rejected = StepValidationResult.rejected("The workflow is already at its last step");
            state = state.withMessages(rejected.errors(), List.of());
            return rejected;
        }
        StepValidationResult validation = validator.validate(current, state);
        state = state.withMessages(validation.errors(), validation.warnings());
        if (!validation.canProceed()) {
            Log.debugf("Workflow %s stays on %s: %s", id, current.wireId(), validation.errors());
            return validation;
        }
        WorkflowStep next = current.next().get();
        state = state.atStep(next);
        Log.infof("Workflow %s advanced %s → %s", id, current.wireId(), next.wireId());
        return validation;
    }

    /**
     * Moves back one step without validation.
     */
    public WorkflowState retreat() {
        state.currentStep().previous().ifPresent(previous -> {
            Log.infof("Workflow %s went back %s → %s", id, state.currentStep().wireId(), previous.wireId());
            state = state.atStep(previous).clearMessages();
        });
        return state;
    }

    /**
     * Jumps to the current step or an already completed one.
     *
     * @return false when the step has not been reached yet
     */
    public boolean jumpTo(WorkflowStep step) {
        if (!canJumpTo(step)) {
            state = state.withMessages(List.of("Step " + step.wireId() + " has not been reached yet"), state.warnings());
            return false;
        }
        if (step != state.currentStep()) {
            Log.infof("Workflow %s jumped %s → %s", id, state.currentStep().wireId(), step.wireId());
            state = state.atStep(step).clearMessages();
        }
        return true;
    }

    public boolean canJumpTo(WorkflowStep step) {
        int highestCompleted = state.completedSteps().stream().mapToInt(Enum::ordinal).max().orElse(-1);
        return step.ordinal() <= highestCompleted + 1;
    }

    public WorkflowState reset() {
        cancel();
        state = WorkflowState.initial();
        Log.infof("Workflow %s reset", id);
        return state;
    }

    public boolean selectPeriod(String periodId) {
        if (!selectionOpen()) {
            return false;
        }
        state = state.withPeriod(periodId).clearMessages();
        return true;
    }

    public boolean selectEmployees(List<String> employeeIds) {
        if (!selectionOpen()) {
            return false;
        }
        state = state.withEmployees(new ArrayList<>(new LinkedHashSet<>(employeeIds))).clearMessages();
        return true;
    }

    private boolean selectionOpen() {
        if (state.currentStep() != WorkflowStep.PERIOD_SELECTION) {
            state = state.withMessages(List.of("Period and employees can only be changed on the period selection step"),
                    state.warnings());
            return false;
        }
        return true;
    }

    /**
     * Stops dispatching items of the batch currently running, if any.
     */
    public void cancel() {
        BatchCancellation batch = activeBatch;
        if (batch != null) {
            batch.cancel();
        }
    }

    public BatchOperationResult batchAssignCategories(String categoryId) {
        return runBatch("assign categories", cancellation ->
                operations.assignCategories(state.selectedEmployees(), categoryId, state.selectedPeriod(), cancellation));
    }

    public BatchOperationResult batchAssignPositions(Map<String, PositionPlacement> placements) {
        return runBatch("assign positions", cancellation ->
                operations.assignPositions(state.selectedEmployees(), placements, state.selectedPeriod(), cancellation));
    }

    public BatchOperationResult batchSetContributionBases(List<ContributionBaseCommand> commands) {
        return runBatch("set contribution bases", cancellation ->
                operations.setContributionBases(commands, cancellation));
    }

    public BatchOperationResult batchResolveContributionBases() {
        return runBatch("resolve contribution bases", cancellation ->
                operations.resolveAndSetContributionBases(state.selectedEmployees(), state.selectedPeriod(), cancellation));
    }

    public BatchOperationResult batchCreatePayrolls() {
        return runBatch("create payrolls", cancellation ->
                operations.createPayrolls(state.selectedEmployees(), state.selectedPeriod(), cancellation));
    }

    public BatchOperationResult batchEnterEarnings(List<EarningEntry> entries) {
        return runBatch("enter earnings", cancellation ->
                operations.enterEarnings(entries, state.selectedPeriod(), cancellation));
    }

    public BatchOperationResult batchCalculatePayrolls() {
        return runBatch("calculate payrolls", cancellation ->
                operations.calculatePayrolls(state.selectedEmployees(), state.selectedPeriod(), cancellation));
    }

    /**
     * Runs every stage for the request, each stage only for the employees the previous stage
     * succeeded for. A stage that fails for every employee, or throws, stops the run; stages
     * already done stay committed and the run can be repeated.
     *
     * <p>The selection left behind holds only the employees every completed step holds for.
     * Employees dropped by a stage are removed from it and named in a warning.
     */
    public WorkflowExecutionResult executeCompleteWorkflow(CompleteWorkflowRequest request) {
        state = WorkflowState.initial()
                .withPeriod(request.periodId())
                .withEmployees(new ArrayList<>(new LinkedHashSet<>(request.employeeIds())))
                .withProcessing(true);
        String periodId = request.periodId();
        List<StageResult> stages = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> survivors = state.selectedEmployees();
        BatchCancellation cancellation = new BatchCancellation();
        activeBatch = cancellation;
        Log.infof("Workflow %s executing all stages for %d employees in period %s", id, survivors.size(), periodId);

        try {
            List<String> current = survivors;
            StageOutcome outcome = runStage(WorkflowStage.CATEGORY_ASSIGNMENT, current, stages, warnings,
                    () -> operations.assignCategories(current, request.categoryId(), periodId, cancellation));
            if (outcome.aborted()) {
                return abort(WorkflowStage.CATEGORY_ASSIGNMENT, outcome.message(), current, stages, warnings);
            }
            survivors = outcome.survivors();

            List<String> positioned = survivors;
            outcome = runStage(WorkflowStage.POSITION_ASSIGNMENT, positioned, stages, warnings,
                    () -> operations.assignPositions(positioned, request.positions(), periodId, cancellation));
            if (outcome.aborted()) {
                return abort(WorkflowStage.POSITION_ASSIGNMENT, outcome.message(), positioned, stages, warnings);
            }
            survivors = outcome.survivors();

            List<String> based = survivors;
            outcome = runStage(WorkflowStage.CONTRIBUTION_BASES, based, stages, warnings,
                    () -> operations.resolveAndSetContributionBases(based, periodId, cancellation));
            if (outcome.aborted()) {
                return abort(WorkflowStage.CONTRIBUTION_BASES, outcome.message(), based, stages, warnings);
            }
            survivors = outcome.survivors();

            List<String> created = survivors;
            outcome = runStage(WorkflowStage.PAYROLL_CREATION, created, stages, warnings,
                    () -> operations.createPayrolls(created, periodId, cancellation));
            if (outcome.aborted()) {
                return abort(WorkflowStage.PAYROLL_CREATION, outcome.message(), created, stages, warnings);
            }
            survivors = outcome.survivors();

            if (!request.hasEarnings()) {
                return finish(WorkflowStep.EARNINGS_SETUP, survivors, stages, warnings);
            }

            List<String> payrolled = survivors;
            Set<String> earning = new LinkedHashSet<>(payrolled);
            List<EarningEntry> entries = request.earnings().stream()
                    .filter(entry -> earning.contains(entry.employeeId()))
                    .toList();
            Set<String> earners = new LinkedHashSet<>();
            entries.forEach(entry -> earners.add(entry.employeeId()));
            BatchOperationResult earningsResult;
            try {
                earningsResult = operations.enterEarnings(entries, periodId, cancellation);
            } catch (RuntimeException e) {
                Log.errorf(e, "Workflow %s stage %s failed", id, WorkflowStage.EARNINGS_ENTRY);
                return abort(WorkflowStage.EARNINGS_ENTRY, messageOf(e), payrolled, stages, warnings);
            }
            stages.add(new StageResult(WorkflowStage.EARNINGS_ENTRY, earningsResult));
            if (earningsResult.isTotalFailure()) {
                return abort(WorkflowStage.EARNINGS_ENTRY, totalFailureMessage(WorkflowStage.EARNINGS_ENTRY),
                        payrolled, stages, warnings);
            }
            noteFailures(WorkflowStage.EARNINGS_ENTRY, earningsResult, earners.size(), warnings);
            // earnings results are keyed by employee; employees without entries pass through
            List<String> calculable = payrolled.stream()
                    .filter(e -> !earners.contains(e) || earningsResult.isSucceeded(e))
                    .toList();

            outcome = runStage(WorkflowStage.CALCULATION, calculable, stages, warnings,
                    () -> operations.calculatePayrolls(calculable, periodId, cancellation));
            if (outcome.aborted()) {
                return abort(WorkflowStage.CALCULATION, outcome.message(), calculable, stages, warnings);
            }
            return finish(WorkflowStep.REVIEW, outcome.survivors(), stages, warnings);
        } finally {
            activeBatch = null;
        }
    }

    private StageOutcome runStage(WorkflowStage stage, List<String> employeeIds, List<StageResult> stages,
                                  List<String> warnings, Supplier<BatchOperationResult> batch) {
        BatchOperationResult result;
        try {
            result = batch.get();
        } catch (RuntimeException e) {
            Log.errorf(e, "Workflow %s stage %s failed", id, stage);
            return StageOutcome.abort(messageOf(e));
        }
        stages.add(new StageResult(stage, result));
        if (result.isTotalFailure()) {
            return StageOutcome.abort(totalFailureMessage(stage));
        }
        noteFailures(stage, result, employeeIds.size(), warnings);
        return StageOutcome.proceed(employeeIds.stream().filter(result::isSucceeded).toList());
    }

    private void noteFailures(WorkflowStage stage, BatchOperationResult result, int total, List<String> warnings) {
        if (result.hasFailures()) {
            warnings.add(String.format("%s: %d of %d items failed", stage, result.getFailedCount() + result.getCancelledCount(), total));
        }
    }

    private WorkflowExecutionResult abort(WorkflowStage stage, String message, List<String> reached,
                                          List<StageResult> stages, List<String> warnings) {
        Log.warnf("Workflow %s aborted at stage %s: %s", id, stage, message);
        state = narrowTo(reached, warnings)
                .atStep(stage.step())
                .withMessages(List.of(stage + ": " + message), warnings)
                .withProcessing(false);
        return new WorkflowExecutionResult(false, stages, stage, message, state);
    }

    private WorkflowExecutionResult finish(WorkflowStep landing, List<String> survivors,
                                           List<StageResult> stages, List<String> warnings) {
        state = narrowTo(survivors, warnings)
                .atStep(landing)
                .withMessages(List.of(), warnings)
                .withProcessing(false);
        Log.infof("Workflow %s executed %d stages for %d employees, now at %s",
                id, stages.size(), survivors.size(), landing.wireId());
        return new WorkflowExecutionResult(true, stages, null, null, state);
    }

    private WorkflowState narrowTo(List<String> remaining, List<String> warnings) {
        List<String> dropped = state.selectedEmployees().stream()
                .filter(e -> !remaining.contains(e))
                .toList();
        if (dropped.isEmpty()) {
            return state;
        }
        warnings.add(String.format("%d employees left the selection after a failed stage: %s",
                dropped.size(), String.join(", ", dropped)));
        return state.withEmployees(remaining);
    }

    private BatchOperationResult runBatch(String name, Function<BatchCancellation, BatchOperationResult> batch) {
        if (!state.hasSelection()) {
            state = state.withMessages(List.of("Select a period and employees before running " + name), state.warnings());
            return BatchOperationResult.empty();
        }
        BatchCancellation cancellation = new BatchCancellation();
        activeBatch = cancellation;
        state = state.withProcessing(true);
        try {
            BatchOperationResult result = batch.apply(cancellation);
            List<String> warnings = result.hasFailures()
                    ? List.of(String.format("%s: %d failed, %d cancelled", name, result.getFailedCount(), result.getCancelledCount()))
                    : List.of();
            List<String> errors = result.isTotalFailure() ? List.of(name + " failed for every item") : List.of();
            state = state.withMessages(errors, warnings);
            return result;
        } finally {
            activeBatch = null;
            state = state.withProcessing(false);
        }
    }

    private static String totalFailureMessage(WorkflowStage stage) {
        return "every item failed in stage " + stage;
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record StageOutcome(boolean aborted, String message, List<String> survivors) {
        static StageOutcome abort(String message) {
            return new StageOutcome(true, message, List.of());
        }

        static StageOutcome proceed(List<String> survivors) {
            return new StageOutcome(false, null, survivors);
        }
    }
}
