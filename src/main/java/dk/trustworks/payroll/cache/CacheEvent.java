package dk.trustworks.payroll.cache;

/**
 * Data changes that make cached payroll reads stale.
 */
public enum CacheEvent {
    PAYROLL_ITEM_CREATED("payroll-item-created"),
    PAYROLL_ITEM_UPDATED("payroll-item-updated"),
    PAYROLL_ITEM_DELETED("payroll-item-deleted"),
    PAYROLL_CREATED("payroll-created"),
    PAYROLL_UPDATED("payroll-updated"),
    PAYROLL_STATUS_CHANGED("payroll-status-changed"),
    CATEGORY_ASSIGNED("category-assigned"),
    POSITION_ASSIGNED("position-assigned"),
    CONTRIBUTION_BASE_UPDATED("contribution-base-updated"),
    PERIOD_UPDATED("period-updated"),
    SALARY_COMPONENT_UPDATED("salary-component-updated"),
    INSURANCE_CONFIG_UPDATED("insurance-config-updated");

    private final String wireName;

    CacheEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
