package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Suppression;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage of dedup windows, one per dedup key, and of per-rule daily alert
 * counters.
 *
 * @since 1.0.0
 */
public interface SuppressionRepository {

    /**
     * Atomically replace the window stored under {@code dedupKey}. The remapping
     * function may mutate the copy it receives ({@code null} if none) and
     * returns the record to keep, or {@code null} to remove it. Calls for one
     * key never interleave.
     *
     * @return the stored record, or {@code null} if none remains
     */
    Suppression compute(String dedupKey, UnaryOperator<Suppression> remapping);

    Optional<Suppression> find(String dedupKey);

    /**
     * @return dedup keys of windows whose end is at or before {@code now}
     */
    List<String> findExpiredKeys(Instant now);

    List<Suppression> findAll();

    /**
     * Take one slot of a rule's daily allowance.
     *
     * @param cap maximum slots per day
     * @return {@code true} if a slot was available and is now taken
     */
    boolean tryAcquireDailySlot(String ruleId, LocalDate day, int cap);
}
