package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.payroll.dto.EmployeeEarnings;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollService;
import dk.trustworks.payroll.batch.BatchCancellation;
import dk.trustworks.payroll.batch.BatchOperationCoordinator;
import dk.trustworks.payroll.batch.BatchOperationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PayrollBatchOperations")
class PayrollBatchOperationsTest {

    private static final String PERIOD_ID = "per-2024-03";

    @InjectMocks
    private PayrollBatchOperations operations;

    @Mock
    private BatchOperationCoordinator coordinator;

    @Mock
    private PayrollService payrollService;

    @Captor
    private ArgumentCaptor<List<EmployeeEarnings>> items;

    @Captor
    private ArgumentCaptor<Function<EmployeeEarnings, String>> itemId;

    @Captor
    private ArgumentCaptor<Consumer<EmployeeEarnings>> op;

    private static EarningEntry earning(String employeeId, String componentId, String amount) {
        return new EarningEntry(employeeId, componentId, new BigDecimal(amount), null);
    }

    @Test
    @DisplayName("All earning lines of an employee are written by one item keyed by the employee")
    void groupsPerEmployee() {
        EarningEntry basic1 = earning("emp-1", "basic", "30000");
        EarningEntry basic2 = earning("emp-2", "basic", "28000");
        EarningEntry bonus1 = earning("emp-1", "bonus", "5000");
        BatchCancellation cancellation = new BatchCancellation();
        when(coordinator.execute(eq("enter-earnings"), items.capture(), itemId.capture(), op.capture(), eq(cancellation)))
                .thenReturn(BatchOperationResult.empty());

        operations.enterEarnings(List.of(basic1, basic2, bonus1), PERIOD_ID, cancellation);

        List<EmployeeEarnings> grouped = items.getValue();
        assertEquals(List.of(new EmployeeEarnings("emp-1", List.of(basic1, bonus1)),
                new EmployeeEarnings("emp-2", List.of(basic2))), grouped);
        assertEquals("emp-1", itemId.getValue().apply(grouped.get(0)));

        grouped.forEach(op.getValue());

        verify(payrollService).upsertEarnings(PERIOD_ID, "emp-1", List.of(basic1, bonus1));
        verify(payrollService).upsertEarnings(PERIOD_ID, "emp-2", List.of(basic2));
        verifyNoMoreInteractions(payrollService);
    }

    @Test
    @DisplayName("No earning lines dispatch no items")
    void empty() {
        when(coordinator.execute(eq("enter-earnings"), items.capture(), any(), any(), any()))
                .thenReturn(BatchOperationResult.empty());

        operations.enterEarnings(List.of(), PERIOD_ID, new BatchCancellation());

        assertTrue(items.getValue().isEmpty());
        verifyNoInteractions(payrollService);
    }
}
