package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage of canonical anomalies keyed by their content-hash id.
 *
 * @since 1.0.0
 */
public interface AnomalyRepository {

    /**
     * Atomically replace the anomaly stored under {@code id}.
     *
     * <p>
     * The remapping function receives a copy of the stored anomaly, or
     * {@code null} if none exists, and returns the value to store. Calls for
     * the same id never interleave.
     * </p>
     *
     * @return a copy of the stored result
     */
    Anomaly compute(String id, UnaryOperator<Anomaly> remapping);

    Optional<Anomaly> findById(String id);

    List<Anomaly> findByEntity(String entityId);

    /** Anomalies dated in {@code [from, to]}. */
    List<Anomaly> findByDateRange(LocalDate from, LocalDate to);

    List<Anomaly> findByStatus(AnomalyStatus status);

    List<Anomaly> findAll();
}
