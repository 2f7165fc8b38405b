package dk.trustworks.payroll.aggregates.payroll.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All earning lines for one employee, written to that employee's payroll together.
 */
public record EmployeeEarnings(String employeeId, List<EarningEntry> entries) {

    public EmployeeEarnings {
        entries = List.copyOf(entries);
    }

    /**
     * Groups entries by employee, keeping the order in which employees first appear.
     */
    public static List<EmployeeEarnings> group(List<EarningEntry> entries) {
        Map<String, List<EarningEntry>> byEmployee = new LinkedHashMap<>();
        for (EarningEntry entry : entries) {
            byEmployee.computeIfAbsent(entry.employeeId(), id -> new ArrayList<>()).add(entry);
        }
        return byEmployee.entrySet().stream()
                .map(e -> new EmployeeEarnings(e.getKey(), e.getValue()))
                .toList();
    }
}
