package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage of alerts keyed by their deterministic id.
 *
 * @since 1.0.0
 */
public interface AlertRepository {

    /**
     * @return {@code true} if stored, {@code false} if an alert with the same id
     *         already exists
     */
    boolean saveIfAbsent(Alert alert);

    /**
     * @return the updated alert, or empty if no alert has this id
     */
    Optional<Alert> updateStatus(String id, AlertStatus status);

    Optional<Alert> findById(String id);

    List<Alert> findByEntity(String entityId);

    /** Alerts whose trigger date lies in {@code [from, to]}. */
    List<Alert> findByDateRange(LocalDate from, LocalDate to);

    List<Alert> findByStatus(AlertStatus status);
}
