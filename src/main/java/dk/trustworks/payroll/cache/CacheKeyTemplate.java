package dk.trustworks.payroll.cache;

import io.quarkus.cache.CompositeCacheKey;

import java.util.Optional;
import java.util.function.Function;

/**
 * Which entry of which cache an event makes stale. A template without a key function
 * clears the whole cache.
 */
public record CacheKeyTemplate(String cacheName, Function<InvalidationContext, Object> keyFunction) {

    public static CacheKeyTemplate wholeCache(String cacheName) {
        return new CacheKeyTemplate(cacheName, null);
    }

    public static CacheKeyTemplate byPayroll(String cacheName) {
        return new CacheKeyTemplate(cacheName, InvalidationContext::payrollId);
    }

    public static CacheKeyTemplate byEmployee(String cacheName) {
        return new CacheKeyTemplate(cacheName, InvalidationContext::employeeId);
    }

    public static CacheKeyTemplate byPeriod(String cacheName) {
        return new CacheKeyTemplate(cacheName, InvalidationContext::periodId);
    }

    public static CacheKeyTemplate byEmployeeAndPeriod(String cacheName) {
        return new CacheKeyTemplate(cacheName, context ->
                context.employeeId() == null || context.periodId() == null
                        ? null
                        : new CompositeCacheKey(context.employeeId(), context.periodId()));
    }

    public boolean isWholeCache() {
        return keyFunction == null;
    }

    /**
     * The key for this context, empty when a field the key needs is missing.
     */
    public Optional<Object> resolveKey(InvalidationContext context) {
        if (keyFunction == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keyFunction.apply(context));
    }
}
