package com.metricsentinel.core.fusion;

import com.metricsentinel.core.config.FusionSettings;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Fingerprints;
import com.metricsentinel.core.store.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fuses detector candidates into canonical {@link Anomaly} records.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Group candidates by (entity, metric, date, direction); the group key
 * hashes to the anomaly id.</li>
 * <li>Keep the best confidence per {@link DetectorKind} within the group.</li>
 * <li>Combine: {@code 1 - Π(1 - w_k · c_k)} over the contributing kinds.</li>
 * <li>Map the combined confidence to a severity through
 * {@link SeverityBands}.</li>
 * <li>Upsert atomically: per-kind confidences of the stored and the new
 * finding are merged by maximum and the combination recomputed, so a
 * stored anomaly's confidence never decreases.</li>
 * </ol>
 *
 * <p>
 * Fusing the same candidates again leaves every stored confidence and
 * severity unchanged. Resolved anomalies are never reopened.
 * </p>
 *
 * @since 1.0.0
 */
public class FusionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FusionEngine.class);

    private final Map<DetectorKind, Double> weights;
    private final SeverityBands bands;
    private final AnomalyRepository repository;
    private final Clock clock;

    public FusionEngine(FusionSettings settings, AnomalyRepository repository, Clock clock) {
        this(Objects.requireNonNull(settings, "FusionSettings must not be null").detectorWeights(),
                SeverityBands.from(settings), repository, clock);
    }

    public FusionEngine(Map<DetectorKind, Double> weights, SeverityBands bands, AnomalyRepository repository,
            Clock clock) {
        Objects.requireNonNull(weights, "weights must not be null");
        this.weights = new EnumMap<>(DetectorKind.class);
        for (DetectorKind kind : DetectorKind.values()) {
            double w = weights.getOrDefault(kind, 0.0);
            if (w < 0.0 || w > 1.0) {
                throw new IllegalArgumentException("Weight for " + kind.key() + " must be in [0, 1], got " + w);
            }
            this.weights.put(kind, w);
        }
        this.bands = Objects.requireNonNull(bands, "bands must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Fuse and upsert a batch of candidates.
     *
     * @param candidates output of any subset of detectors
     * @return the stored anomaly for every group, after merging
     */
    public List<Anomaly> fuse(Collection<AnomalyCandidate> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Map<String, List<AnomalyCandidate>> groups = new LinkedHashMap<>();
        for (AnomalyCandidate c : candidates) {
            String id = Fingerprints.anomalyId(c.getEntityId(), c.getMetric(), c.getDate(), c.getDirection());
            groups.computeIfAbsent(id, k -> new ArrayList<>()).add(c);
        }

        Instant now = clock.instant();
        List<Anomaly> fused = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<AnomalyCandidate>> group : groups.entrySet()) {
            Anomaly incoming = toAnomaly(group.getKey(), group.getValue(), now);
            Anomaly stored = repository.compute(group.getKey(), existing -> merge(existing, incoming, now));
            LOG.debug("Fused {} candidate(s) into anomaly {} ({} {}, confidence={})",
                    group.getValue().size(), stored.getId(), stored.getSeverity().key(),
                    stored.getDirection().key(), stored.getConfidence());
            fused.add(stored);
        }
        return fused;
    }

    /**
     * {@code 1 - Π(1 - w_k · c_k)}.
     */
    public double combine(Map<DetectorKind, Double> confidences) {
        double product = 1.0;
        for (Map.Entry<DetectorKind, Double> e : confidences.entrySet()) {
            product *= 1.0 - weights.getOrDefault(e.getKey(), 0.0) * e.getValue();
        }
        return Math.min(Math.max(1.0 - product, 0.0), 1.0);
    }

    private Anomaly toAnomaly(String id, List<AnomalyCandidate> group, Instant now) {
        Map<DetectorKind, Double> best = new EnumMap<>(DetectorKind.class);
        for (AnomalyCandidate c : group) {
            best.merge(c.getDetector(), c.getConfidence(), Math::max);
        }
        AnomalyCandidate reference = group.stream()
                .filter(c -> c.getExpectedValue() != null)
                .max(Comparator.comparingDouble(AnomalyCandidate::getConfidence))
                .orElse(group.get(0));
        Double magnitude = reference.relativeDeviationPct();
        double confidence = combine(best);
        return Anomaly.builder()
                .id(id)
                .entityId(reference.getEntityId())
                .metric(reference.getMetric())
                .date(reference.getDate())
                .direction(reference.getDirection())
                .confidence(confidence)
                .severity(bands.of(confidence))
                .detectorConfidences(best)
                .magnitudePct(magnitude != null ? magnitude : 0.0)
                .actualValue(reference.getActualValue())
                .expectedValue(reference.getExpectedValue())
                .status(AnomalyStatus.NEW)
                .detectedAt(now)
                .build();
    }

    private Anomaly merge(Anomaly existing, Anomaly incoming, Instant now) {
        if (existing == null) {
            return incoming;
        }
        if (existing.getStatus() == AnomalyStatus.RESOLVED) {
            LOG.trace("Anomaly {} is resolved - not reopening", existing.getId());
            return existing;
        }
        Map<DetectorKind, Double> merged = new EnumMap<>(DetectorKind.class);
        merged.putAll(existing.getDetectorConfidences());
        incoming.getDetectorConfidences().forEach((kind, c) -> merged.merge(kind, c, Math::max));

        double confidence = Math.max(combine(merged), existing.getConfidence());
        existing.setDetectorConfidences(merged);
        existing.setConfidence(confidence);
        existing.setSeverity(bands.of(confidence));
        if (existing.getExpectedValue() == null && incoming.getExpectedValue() != null) {
            existing.setExpectedValue(incoming.getExpectedValue());
            existing.setMagnitudePct(incoming.getMagnitudePct());
        }
        existing.setUpdatedAt(now);
        return existing;
    }

    public SeverityBands getBands() {
        return bands;
    }
}
