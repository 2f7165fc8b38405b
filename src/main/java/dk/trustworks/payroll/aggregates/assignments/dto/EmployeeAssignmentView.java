package dk.trustworks.payroll.aggregates.assignments.dto;

public record EmployeeAssignmentView(String employeeId,
                                     String periodId,
                                     String categoryId,
                                     String positionId,
                                     String departmentId) {
}
