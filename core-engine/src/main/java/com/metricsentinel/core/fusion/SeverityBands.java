package com.metricsentinel.core.fusion;

import com.metricsentinel.core.config.FusionSettings;
import com.metricsentinel.core.model.Severity;

import java.io.Serializable;

/**
 * Maps a combined confidence to a {@link Severity}.
 *
 * <p>
 * {@code [0, medium)} is LOW, {@code [medium, high)} MEDIUM and
 * {@code [high, 1]} HIGH. The bands cover {@code [0, 1]} without overlap,
 * which the constructor enforces, and the mapping is monotonic.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityBands implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mediumCutoff;
    private final double highCutoff;

    public SeverityBands(double mediumCutoff, double highCutoff) {
        if (!(mediumCutoff > 0.0 && mediumCutoff < highCutoff && highCutoff <= 1.0)) {
            throw new IllegalArgumentException(
                    "Severity cutoffs must satisfy 0 < medium < high <= 1, got medium=" + mediumCutoff
                            + ", high=" + highCutoff);
        }
        this.mediumCutoff = mediumCutoff;
        this.highCutoff = highCutoff;
    }

    public static SeverityBands defaults() {
        return new SeverityBands(0.5, 0.8);
    }

    public static SeverityBands from(FusionSettings settings) {
        return new SeverityBands(settings.getMediumCutoff(), settings.getHighCutoff());
    }

    public Severity of(double confidence) {
        if (confidence >= highCutoff) {
            return Severity.HIGH;
        }
        if (confidence >= mediumCutoff) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public double getMediumCutoff() {
        return mediumCutoff;
    }

    public double getHighCutoff() {
        return highCutoff;
    }

    @Override
    public String toString() {
        return "SeverityBands{medium>=" + mediumCutoff + ", high>=" + highCutoff + '}';
    }
}
