package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for {@code pipeline.yml}.
 *
 * <pre>
 * detection:
 *   defaultZThreshold: 2.5
 *   metricThresholds: { clicks: 3.0 }
 * fusion:
 *   weights: { statistical: 0.4, outlier: 0.3, forecast: 0.3 }
 *   mediumCutoff: 0.5
 *   highCutoff: 0.8
 * delivery:
 *   maxAttempts: 5
 * </pre>
 *
 * <p>
 * Unlike rules, settings are all-or-nothing: {@link #validate()} rejects the
 * whole document when any value is out of range.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectionSettings detection = new DetectionSettings();
    private FusionSettings fusion = new FusionSettings();
    private DeliverySettings delivery = new DeliverySettings();

    /**
     * @return settings with every default in place
     */
    public static PipelineSettings defaults() {
        return new PipelineSettings();
    }

    /**
     * @throws IllegalStateException listing every invalid value
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detection.collectErrors(errors);
        fusion.collectErrors(errors);
        delivery.collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public FusionSettings getFusion() {
        return fusion;
    }

    public void setFusion(FusionSettings fusion) {
        this.fusion = fusion != null ? fusion : new FusionSettings();
    }

    public DeliverySettings getDelivery() {
        return delivery;
    }

    public void setDelivery(DeliverySettings delivery) {
        this.delivery = delivery != null ? delivery : new DeliverySettings();
    }
}
