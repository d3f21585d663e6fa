package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyStatus;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link AnomalyRepository} backed by a {@link ConcurrentHashMap}; per-id
 * atomicity comes from {@link ConcurrentHashMap#compute}.
 *
 * @since 1.0.0
 */
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private static final Comparator<Anomaly> ORDER = Comparator.comparing(Anomaly::getDate)
            .thenComparing(Anomaly::getEntityId)
            .thenComparing(Anomaly::getMetric)
            .thenComparing(Anomaly::getDirection);

    private final ConcurrentMap<String, Anomaly> anomalies = new ConcurrentHashMap<>();

    @Override
    public Anomaly compute(String id, UnaryOperator<Anomaly> remapping) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(remapping, "remapping must not be null");
        Anomaly stored = anomalies.compute(id, (key, existing) -> {
            Anomaly next = remapping.apply(existing != null ? existing.copy() : null);
            if (next != null && !key.equals(next.getId())) {
                throw new IllegalArgumentException("Anomaly id changed from " + key + " to " + next.getId());
            }
            return next;
        });
        return stored != null ? stored.copy() : null;
    }

    @Override
    public Optional<Anomaly> findById(String id) {
        Anomaly a = anomalies.get(id);
        return a != null ? Optional.of(a.copy()) : Optional.empty();
    }

    @Override
    public List<Anomaly> findByEntity(String entityId) {
        return select(a -> a.getEntityId().equals(entityId));
    }

    @Override
    public List<Anomaly> findByDateRange(LocalDate from, LocalDate to) {
        return select(a -> !a.getDate().isBefore(from) && !a.getDate().isAfter(to));
    }

    @Override
    public List<Anomaly> findByStatus(AnomalyStatus status) {
        return select(a -> a.getStatus() == status);
    }

    @Override
    public List<Anomaly> findAll() {
        return select(a -> true);
    }

    private List<Anomaly> select(Predicate<Anomaly> filter) {
        return anomalies.values().stream()
                .filter(filter)
                .map(Anomaly::copy)
                .sorted(ORDER)
                .toList();
    }
}
