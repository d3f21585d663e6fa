package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Suppression;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * {@link SuppressionRepository} backed by {@link ConcurrentHashMap}s.
 *
 * <p>
 * Daily counters are keyed {@code day|ruleId}; counters of days before the one
 * being acquired are evicted, so only the current day is ever retained.
 * Subclasses persist state by overriding {@link #afterMutation()}, called
 * after every change.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemorySuppressionRepository implements SuppressionRepository {

    private final ConcurrentMap<String, Suppression> windows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer> dailyCounts = new ConcurrentHashMap<>();

    @Override
    public Suppression compute(String dedupKey, UnaryOperator<Suppression> remapping) {
        Objects.requireNonNull(dedupKey, "dedupKey must not be null");
        Objects.requireNonNull(remapping, "remapping must not be null");
        Suppression stored = windows.compute(dedupKey,
                (key, existing) -> remapping.apply(existing != null ? existing.copy() : null));
        afterMutation();
        return stored != null ? stored.copy() : null;
    }

    @Override
    public Optional<Suppression> find(String dedupKey) {
        Suppression s = windows.get(dedupKey);
        return s != null ? Optional.of(s.copy()) : Optional.empty();
    }

    @Override
    public List<String> findExpiredKeys(Instant now) {
        return windows.values().stream()
                .filter(s -> !s.getWindowEnd().isAfter(now))
                .map(Suppression::getDedupKey)
                .toList();
    }

    @Override
    public List<Suppression> findAll() {
        return windows.values().stream()
                .map(Suppression::copy)
                .sorted(Comparator.comparing(Suppression::getWindowStart))
                .toList();
    }

    @Override
    public boolean tryAcquireDailySlot(String ruleId, LocalDate day, int cap) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(day, "day must not be null");
        dailyCounts.keySet().removeIf(key -> dayOf(key).isBefore(day));
        boolean[] acquired = new boolean[1];
        dailyCounts.compute(day + "|" + ruleId, (key, count) -> {
            int current = count != null ? count : 0;
            if (current >= cap) {
                return current;
            }
            acquired[0] = true;
            return current + 1;
        });
        if (acquired[0]) {
            afterMutation();
        }
        return acquired[0];
    }

    /**
     * @return number of retained daily counters
     */
    public int dailyCounterCount() {
        return dailyCounts.size();
    }

    // ---------------------------------------------------------------
    // Persistence hooks
    // ---------------------------------------------------------------

    protected void afterMutation() {
        // in-memory only
    }

    protected List<Suppression> windowsSnapshot() {
        return windows.values().stream().map(Suppression::copy).toList();
    }

    protected Map<String, Integer> dailyCountsSnapshot() {
        return Map.copyOf(dailyCounts);
    }

    protected void restore(Collection<Suppression> storedWindows, Map<String, Integer> storedCounts) {
        for (Suppression s : storedWindows) {
            windows.put(s.getDedupKey(), s.copy());
        }
        dailyCounts.putAll(storedCounts);
    }

    private static LocalDate dayOf(String counterKey) {
        return LocalDate.parse(counterKey.substring(0, counterKey.indexOf('|')));
    }
}
