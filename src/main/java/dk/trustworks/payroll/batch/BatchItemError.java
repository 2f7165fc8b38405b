package dk.trustworks.payroll.batch;

public record BatchItemError(String itemId, String message) {
}
