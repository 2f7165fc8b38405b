package dk.trustworks.payroll.cache;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.cache.Cache;
import io.quarkus.cache.CacheManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dk.trustworks.payroll.cache.CacheKeyTemplate.byEmployee;
import static dk.trustworks.payroll.cache.CacheKeyTemplate.byEmployeeAndPeriod;
import static dk.trustworks.payroll.cache.CacheKeyTemplate.byPayroll;
import static dk.trustworks.payroll.cache.CacheKeyTemplate.byPeriod;
import static dk.trustworks.payroll.cache.CacheKeyTemplate.wholeCache;
import static dk.trustworks.payroll.cache.PayrollCacheNames.*;

/**
 * Evicts cached payroll reads when the underlying data changes.
 *
 * <p>Each {@link CacheEvent} maps to a list of {@link CacheKeyTemplate}s. Invalidation is
 * fire and forget: failures are logged and never reach the caller, whose write has
 * already committed.
 */
@JBossLog
@ApplicationScoped
public class CacheInvalidationManager {

    private static final Map<CacheEvent, List<CacheKeyTemplate>> TEMPLATES = new EnumMap<>(CacheEvent.class);

    private static final Map<String, CacheEvent> TABLE_EVENTS = Map.of(
            "payroll_items", CacheEvent.PAYROLL_ITEM_UPDATED,
            "payrolls", CacheEvent.PAYROLL_UPDATED,
            "employee_category_assignments", CacheEvent.CATEGORY_ASSIGNED,
            "employee_job_history", CacheEvent.POSITION_ASSIGNED,
            "employee_contribution_bases", CacheEvent.CONTRIBUTION_BASE_UPDATED,
            "payroll_periods", CacheEvent.PERIOD_UPDATED,
            "salary_components", CacheEvent.SALARY_COMPONENT_UPDATED,
            "category_insurance_rules", CacheEvent.INSURANCE_CONFIG_UPDATED,
            "insurance_types", CacheEvent.INSURANCE_CONFIG_UPDATED);

    static {
        List<CacheKeyTemplate> itemChange = List.of(
                byPayroll(PAYROLL_DETAIL),
                byPayroll(PAYROLL_ITEMS),
                byPeriod(PAYROLL_LIST),
                byPeriod(PAYROLL_STATISTICS),
                byEmployee(EMPLOYEE_PAYROLLS));
        TEMPLATES.put(CacheEvent.PAYROLL_ITEM_CREATED, itemChange);
        TEMPLATES.put(CacheEvent.PAYROLL_ITEM_UPDATED, itemChange);
        TEMPLATES.put(CacheEvent.PAYROLL_ITEM_DELETED, itemChange);
        TEMPLATES.put(CacheEvent.PAYROLL_CREATED, List.of(
                byPeriod(PAYROLL_LIST),
                byPeriod(PAYROLL_STATISTICS),
                byEmployee(EMPLOYEE_PAYROLLS)));
        TEMPLATES.put(CacheEvent.PAYROLL_UPDATED, itemChange);
        TEMPLATES.put(CacheEvent.PAYROLL_STATUS_CHANGED, List.of(
                byPayroll(PAYROLL_DETAIL),
                byPeriod(PAYROLL_LIST),
                byPeriod(PAYROLL_STATISTICS),
                byEmployee(EMPLOYEE_PAYROLLS)));
        TEMPLATES.put(CacheEvent.CATEGORY_ASSIGNED, List.of(byEmployeeAndPeriod(EMPLOYEE_ASSIGNMENTS)));
        TEMPLATES.put(CacheEvent.POSITION_ASSIGNED, List.of(byEmployeeAndPeriod(EMPLOYEE_ASSIGNMENTS)));
        TEMPLATES.put(CacheEvent.CONTRIBUTION_BASE_UPDATED, List.of(
                byEmployeeAndPeriod(CONTRIBUTION_BASES),
                byPeriod(PERIOD_CONTRIBUTION_BASES)));
        TEMPLATES.put(CacheEvent.PERIOD_UPDATED, List.of(
                byPeriod(PAYROLL_PERIODS),
                byPeriod(PAYROLL_LIST)));
        TEMPLATES.put(CacheEvent.SALARY_COMPONENT_UPDATED, List.of(
                wholeCache(SALARY_COMPONENTS),
                wholeCache(PAYROLL_ITEMS)));
        TEMPLATES.put(CacheEvent.INSURANCE_CONFIG_UPDATED, List.of(
                wholeCache(INSURANCE_RULES),
                wholeCache(CONTRIBUTION_BASES),
                wholeCache(PERIOD_CONTRIBUTION_BASES)));
    }

    @Inject
    CacheManager cacheManager;

    @Inject
    MeterRegistry registry;

    public void invalidate(CacheEvent event, InvalidationContext context) {
        InvalidationContext ctx = context == null ? InvalidationContext.empty() : context;
        for (CacheKeyTemplate template : templatesFor(event)) {
            try {
                invalidate(event, template, ctx);
            } catch (RuntimeException e) {
                log.errorf(e, "Cache invalidation of %s failed for event %s", template.cacheName(), event.wireName());
            }
        }
        registry.counter("payroll.cache.invalidations", "event", event.wireName()).increment();
    }

    /**
     * Translates a change notification for a table into the matching event.
     *
     * @return false when the table is not one the payroll caches depend on
     */
    public boolean onTableChange(String table, Map<String, ?> filter) {
        CacheEvent event = table == null ? null : TABLE_EVENTS.get(table);
        if (event == null) {
            log.debugf("Ignoring change notification for table %s", table);
            return false;
        }
        invalidate(event, InvalidationContext.fromFilter(filter));
        return true;
    }

    public List<CacheKeyTemplate> templatesFor(CacheEvent event) {
        return TEMPLATES.getOrDefault(event, List.of());
    }

    /**
     * Evictions the event causes for the context, in template order.
     */
    public List<Eviction> plan(CacheEvent event, InvalidationContext context) {
        List<Eviction> plan = new ArrayList<>();
        for (CacheKeyTemplate template : templatesFor(event)) {
            if (template.isWholeCache()) {
                plan.add(new Eviction(template.cacheName(), null));
            } else {
                template.resolveKey(context).ifPresent(key -> plan.add(new Eviction(template.cacheName(), key)));
            }
        }
        return plan;
    }

    private void invalidate(CacheEvent event, CacheKeyTemplate template, InvalidationContext context) {
        Optional<Cache> cache = cacheManager.getCache(template.cacheName());
        if (cache.isEmpty()) {
            log.warnf("Unknown cache %s registered for event %s", template.cacheName(), event.wireName());
            return;
        }
        if (template.isWholeCache()) {
            cache.get().invalidateAll().subscribe().with(
                    ignored -> log.debugf("Cleared cache %s on %s", template.cacheName(), event.wireName()),
                    failure -> log.warnf(failure, "Clearing cache %s on %s failed", template.cacheName(), event.wireName()));
            return;
        }
        Optional<Object> key = template.resolveKey(context);
        if (key.isEmpty()) {
            log.debugf("Skipping %s on %s: context lacks the key fields", template.cacheName(), event.wireName());
            return;
        }
        cache.get().invalidate(key.get()).subscribe().with(
                ignored -> log.debugf("Evicted %s from %s on %s", key.get(), template.cacheName(), event.wireName()),
                failure -> log.warnf(failure, "Evicting %s from %s on %s failed", key.get(), template.cacheName(), event.wireName()));
    }

    /**
     * One planned eviction. A null key clears the whole cache.
     */
    public record Eviction(String cacheName, Object key) {
    }
}
