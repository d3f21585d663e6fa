package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates the {@link AnomalyDetector} for each
 * {@link DetectorKind} from {@link DetectionSettings}.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * add the kind and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // not instantiable
    }

    /**
     * @param kind     detection method; must not be {@code null}
     * @param settings detector tuning; must not be {@code null}
     * @return the detector for {@code kind}
     */
    public static AnomalyDetector create(DetectorKind kind, DetectionSettings settings) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        return switch (kind) {
            case STATISTICAL -> new StatisticalBaselineDetector(settings);
            case OUTLIER -> new OutlierClassifierDetector(settings, new MahalanobisOutlierScorer());
            case FORECAST -> new ForecastDeviationDetector(new HoltWintersForecaster(settings));
        };
    }

    /**
     * Create one detector per {@link DetectorKind}.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param settings detector tuning; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        List<AnomalyDetector> detectors = Arrays.stream(DetectorKind.values())
                .map(kind -> create(kind, settings))
                .toList();
        LOG.info("Created {} detector(s): {}", detectors.size(),
                detectors.stream().map(d -> d.kind().key()).toList());
        return detectors;
    }
}
