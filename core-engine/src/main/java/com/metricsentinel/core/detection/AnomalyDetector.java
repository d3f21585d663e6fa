package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.MetricPoint;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 *
 * <p>
 * A detector receives the full series of a single entity/metric, ordered or
 * not, and tests each point dated inside the {@link DetectionWindow}; earlier
 * points serve as history. Missing days are absent from the series, never
 * zero-filled.
 * </p>
 *
 * <p>
 * Implementations are stateless and thread-safe: one instance serves every
 * series. A detector that lacks enough history returns an empty list instead
 * of throwing.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * @param series points of one entity/metric
     * @param window dates to test
     * @return candidates for the tested points, possibly empty
     */
    List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window);

    DetectorKind kind();
}
