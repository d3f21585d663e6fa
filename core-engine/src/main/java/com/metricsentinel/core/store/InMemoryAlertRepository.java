package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * {@link AlertRepository} backed by a {@link ConcurrentHashMap}.
 *
 * @since 1.0.0
 */
public class InMemoryAlertRepository implements AlertRepository {

    private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        return alerts.putIfAbsent(alert.getId(), alert.copy()) == null;
    }

    @Override
    public Optional<Alert> updateStatus(String id, AlertStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Alert updated = alerts.computeIfPresent(id, (key, existing) -> {
            Alert next = existing.copy();
            next.setStatus(status);
            return next;
        });
        return updated != null ? Optional.of(updated.copy()) : Optional.empty();
    }

    @Override
    public Optional<Alert> findById(String id) {
        Alert a = alerts.get(id);
        return a != null ? Optional.of(a.copy()) : Optional.empty();
    }

    @Override
    public List<Alert> findByEntity(String entityId) {
        return select(a -> entityId.equals(a.getEntityId()));
    }

    @Override
    public List<Alert> findByDateRange(LocalDate from, LocalDate to) {
        return select(a -> a.getDate() != null && !a.getDate().isBefore(from) && !a.getDate().isAfter(to));
    }

    @Override
    public List<Alert> findByStatus(AlertStatus status) {
        return select(a -> a.getStatus() == status);
    }

    private List<Alert> select(Predicate<Alert> filter) {
        return alerts.values().stream()
                .filter(filter)
                .map(Alert::copy)
                .sorted(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getId))
                .toList();
    }
}
