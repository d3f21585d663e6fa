package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multivariate outlier detector.
 *
 * <p>
 * Each point is described by three features: its value, the least-squares
 * slope over the trailing {@code trendWindow} days, and its deviation from
 * the mean of earlier values on the same weekday. An {@link OutlierScorer} is
 * fitted on the features of the history (points before the window) and every
 * tested point whose score exceeds both the configured percentile of the
 * history's own scores and {@code outlierMinScore} becomes a candidate with
 * confidence equal to its score.
 * </p>
 *
 * <p>
 * Requires at least {@code minOutlierHistory} history points.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierClassifierDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierClassifierDetector.class);

    private final DetectionSettings settings;
    private final OutlierScorer scorer;

    public OutlierClassifierDetector(DetectionSettings settings, OutlierScorer scorer) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.scorer = Objects.requireNonNull(scorer, "OutlierScorer must not be null");
    }

    @Override
    public List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(window, "window must not be null");

        List<MetricPoint> points = SeriesMath.normalise(series);
        int historySize = 0;
        while (historySize < points.size() && points.get(historySize).getDate().isBefore(window.getFrom())) {
            historySize++;
        }
        if (historySize < settings.getMinOutlierHistory()) {
            LOG.trace("Outlier detection skipped: {} history point(s) < {}", historySize,
                    settings.getMinOutlierHistory());
            return List.of();
        }

        double[][] historyFeatures = new double[historySize][];
        double[] historyValues = new double[historySize];
        for (int i = 0; i < historySize; i++) {
            historyFeatures[i] = features(points, i);
            historyValues[i] = points.get(i).getValue();
        }

        OutlierScorer.Model model;
        try {
            model = scorer.fit(historyFeatures);
        } catch (RuntimeException e) {
            LOG.warn("Outlier model could not be fitted on {} point(s): {}", historySize, e.getMessage());
            return List.of();
        }

        double[] historyScores = new double[historySize];
        for (int i = 0; i < historySize; i++) {
            historyScores[i] = model.score(historyFeatures[i]);
        }
        double cutoff = Math.max(new Percentile().evaluate(historyScores, settings.getOutlierPercentile()),
                settings.getOutlierMinScore());
        double expected = SeriesMath.mean(historyValues);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = historySize; i < points.size(); i++) {
            MetricPoint point = points.get(i);
            if (!window.contains(point.getDate())) {
                continue;
            }
            double score = model.score(features(points, i));
            if (score <= cutoff) {
                continue;
            }
            LOG.debug("Outlier candidate {}/{} {}: score={} cutoff={}",
                    point.getEntityId(), point.getMetric(), point.getDate(), score, cutoff);
            candidates.add(AnomalyCandidate.builder()
                    .point(point)
                    .detector(DetectorKind.OUTLIER)
                    .direction(Direction.of(point.getValue(), expected))
                    .rawScore(score)
                    .confidence(score)
                    .expectedValue(expected)
                    .build());
        }
        return candidates;
    }

    /**
     * Feature vector of the point at {@code index}, using only that point and
     * earlier ones.
     */
    double[] features(List<MetricPoint> points, int index) {
        MetricPoint point = points.get(index);
        LocalDate date = point.getDate();
        LocalDate trendStart = date.minusDays(settings.getTrendWindow() - 1L);

        List<MetricPoint> trailing = new ArrayList<>();
        double weekdaySum = 0;
        int weekdayCount = 0;
        for (int j = 0; j <= index; j++) {
            MetricPoint p = points.get(j);
            if (!p.getDate().isBefore(trendStart)) {
                trailing.add(p);
            }
            if (j < index && p.getDate().getDayOfWeek() == date.getDayOfWeek()) {
                weekdaySum += p.getValue();
                weekdayCount++;
            }
        }
        double weekdayDeviation = weekdayCount == 0 ? 0.0 : point.getValue() - weekdaySum / weekdayCount;
        return new double[] { point.getValue(), SeriesMath.slope(trailing), weekdayDeviation };
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.OUTLIER;
    }
}
