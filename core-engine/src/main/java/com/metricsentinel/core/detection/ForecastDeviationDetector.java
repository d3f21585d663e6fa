package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags points that fall outside the prediction interval of a
 * {@link Forecaster} fitted on the points before them.
 *
 * <p>
 * The history is laid out as one value per day so the seasonal phase stays
 * aligned with the calendar. Missing days are never read as zero and are
 * never scored: a gap of up to {@value #MAX_BRIDGED_GAP_DAYS} days is bridged
 * with the last observed value, and a longer gap discards everything before
 * it so the forecast is fitted only on the contiguous run that follows. A
 * point directly after such a gap is not scored.
 * Confidence is {@code min((|actual - predicted| / width) / 3, 1)}; a
 * zero-width interval gives confidence 1.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastDeviationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastDeviationDetector.class);

    /** Longest run of missing days bridged inside one history. */
    static final int MAX_BRIDGED_GAP_DAYS = 7;

    private final Forecaster forecaster;

    public ForecastDeviationDetector(Forecaster forecaster) {
        this.forecaster = Objects.requireNonNull(forecaster, "Forecaster must not be null");
    }

    @Override
    public List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(window, "window must not be null");

        List<MetricPoint> points = SeriesMath.normalise(series);
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 1; i < points.size(); i++) {
            MetricPoint point = points.get(i);
            if (!window.contains(point.getDate())) {
                continue;
            }
            LocalDate lastHistoryDate = points.get(i - 1).getDate();
            int horizon = (int) ChronoUnit.DAYS.between(lastHistoryDate, point.getDate());
            if (horizon - 1 > MAX_BRIDGED_GAP_DAYS) {
                LOG.trace("{}/{} {}: {} day(s) missing before the point, not forecasting",
                        point.getEntityId(), point.getMetric(), point.getDate(), horizon - 1);
                continue;
            }
            double[] history = dailyHistory(points, i);
            Optional<Forecast> forecast = forecaster.forecast(history, horizon);
            if (forecast.isEmpty()) {
                LOG.trace("{}/{} {}: history of {} day(s) too short to forecast",
                        point.getEntityId(), point.getMetric(), point.getDate(), history.length);
                continue;
            }
            Forecast f = forecast.get();
            double actual = point.getValue();
            if (f.contains(actual)) {
                continue;
            }
            double deviation = Math.abs(actual - f.getPredicted());
            double ratio = f.width() > 0 ? deviation / f.width() : Double.POSITIVE_INFINITY;
            double confidence = Math.min(ratio / 3.0, 1.0);
            LOG.debug("Forecast candidate {}/{} {}: actual={} forecast={}",
                    point.getEntityId(), point.getMetric(), point.getDate(), actual, f);
            candidates.add(AnomalyCandidate.builder()
                    .point(point)
                    .detector(DetectorKind.FORECAST)
                    .direction(Direction.of(actual, f.getPredicted()))
                    .rawScore(f.width() > 0 ? deviation / f.width() : deviation)
                    .confidence(confidence)
                    .expectedValue(f.getPredicted())
                    .build());
        }
        return candidates;
    }

    /**
     * Daily values through the point before {@code index}, starting after the
     * last gap longer than {@link #MAX_BRIDGED_GAP_DAYS}; shorter gaps repeat
     * the previous value.
     */
    static double[] dailyHistory(List<MetricPoint> points, int index) {
        int start = 0;
        for (int i = 1; i < index; i++) {
            long missing = ChronoUnit.DAYS.between(points.get(i - 1).getDate(), points.get(i).getDate()) - 1;
            if (missing > MAX_BRIDGED_GAP_DAYS) {
                start = i;
            }
        }
        LocalDate first = points.get(start).getDate();
        LocalDate last = points.get(index - 1).getDate();
        int days = (int) ChronoUnit.DAYS.between(first, last) + 1;
        double[] values = new double[days];
        int cursor = start;
        double carry = points.get(start).getValue();
        for (int d = 0; d < days; d++) {
            LocalDate date = first.plusDays(d);
            if (cursor < index && points.get(cursor).getDate().equals(date)) {
                carry = points.get(cursor).getValue();
                cursor++;
            }
            values[d] = carry;
        }
        return values;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.FORECAST;
    }
}
