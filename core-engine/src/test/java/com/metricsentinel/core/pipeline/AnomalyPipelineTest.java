package com.metricsentinel.core.pipeline;

import com.metricsentinel.core.MutableClock;
import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.ChannelTarget;
import com.metricsentinel.core.config.ConditionSpec;
import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.config.FusionSettings;
import com.metricsentinel.core.config.RuleSet;
import com.metricsentinel.core.delivery.MessageRenderer;
import com.metricsentinel.core.delivery.NotificationQueue;
import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.detection.DetectionWindow;
import com.metricsentinel.core.fusion.AnomalyResolver;
import com.metricsentinel.core.fusion.FusionEngine;
import com.metricsentinel.core.model.Admission;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.Suppression;
import com.metricsentinel.core.rules.RuleEngine;
import com.metricsentinel.core.store.InMemoryAlertRepository;
import com.metricsentinel.core.store.InMemoryAnomalyRepository;
import com.metricsentinel.core.store.InMemoryMetricSeriesReader;
import com.metricsentinel.core.store.InMemoryNotificationJobRepository;
import com.metricsentinel.core.store.InMemorySuppressionRepository;
import com.metricsentinel.core.store.SuppressionRepository;
import com.metricsentinel.core.suppression.SuppressionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnomalyPipeline} wired against in-memory stores.
 */
class AnomalyPipelineTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 9);
    private static final DetectionWindow WINDOW = DetectionWindow.single(DAY);

    private MutableClock clock;
    private InMemoryMetricSeriesReader reader;
    private InMemoryAnomalyRepository anomalies;
    private InMemoryAlertRepository alerts;
    private NotificationQueue queue;
    private SuppressionRepository suppressions;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-10T06:00:00Z"));
        reader = new InMemoryMetricSeriesReader();
        anomalies = new InMemoryAnomalyRepository();
        alerts = new InMemoryAlertRepository();
        queue = new NotificationQueue(new InMemoryNotificationJobRepository(), clock);
        suppressions = new InMemorySuppressionRepository();
        executor = Executors.newFixedThreadPool(2);

        for (int i = 30; i >= 1; i--) {
            reader.add(MetricPoint.of("/pricing", "clicks", DAY.minusDays(i), 100.0));
            reader.add(MetricPoint.of("/home", "clicks", DAY.minusDays(i), 100.0));
        }
        reader.add(MetricPoint.of("/pricing", "clicks", DAY, 20.0));
        reader.add(MetricPoint.of("/home", "clicks", DAY, 101.0));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should detect, fuse, alert and enqueue one notification for a drop")
    void shouldRunEndToEnd() {
        AnomalyPipeline pipeline = pipeline(List.of(new DropDetector()), reader);

        RunReport report = pipeline.run(WINDOW);

        assertThat(report.isCancelled()).isFalse();
        assertThat(report.getSeriesScanned()).isEqualTo(2);
        assertThat(report.getCandidates()).isEqualTo(1);
        assertThat(report.getAnomalies()).isEqualTo(1);
        assertThat(report.getAlertsRaised()).isEqualTo(1);
        assertThat(report.admitted(Admission.NEW)).isEqualTo(1);
        assertThat(report.getJobsEnqueued()).isEqualTo(1);

        Anomaly anomaly = anomalies.findAll().get(0);
        assertThat(anomaly.getEntityId()).isEqualTo("/pricing");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getStatus()).isEqualTo(AnomalyStatus.ALERTED);

        List<Alert> raised = alerts.findByStatus(AlertStatus.NOTIFIED);
        assertThat(raised).singleElement().satisfies(a -> assertThat(a.getAnomalyId()).isEqualTo(anomaly.getId()));
        assertThat(queue.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not raise or enqueue anything new when the same window is rerun")
    void shouldBeIdempotentOnRerun() {
        AnomalyPipeline pipeline = pipeline(List.of(new DropDetector()), reader);
        pipeline.run(WINDOW);

        RunReport second = pipeline.run(WINDOW);

        assertThat(second.getAnomalies()).isEqualTo(1);
        assertThat(second.getAlertsRaised()).isZero();
        assertThat(second.getJobsEnqueued()).isZero();
        assertThat(anomalies.findAll()).hasSize(1);
        assertThat(queue.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep going when a detector throws")
    void shouldSurviveFailingDetector() {
        AnomalyDetector broken = new AnomalyDetector() {
            @Override
            public List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window) {
                throw new IllegalStateException("model not loaded");
            }

            @Override
            public DetectorKind kind() {
                return DetectorKind.OUTLIER;
            }
        };
        AnomalyPipeline pipeline = pipeline(List.of(broken, new DropDetector()), reader);

        RunReport report = pipeline.run(WINDOW);

        assertThat(report.getSeriesFailed()).isZero();
        assertThat(report.getAnomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count series whose data cannot be read as failed")
    void shouldCountUnreadableSeries() {
        InMemoryMetricSeriesReader flaky = new InMemoryMetricSeriesReader() {
            @Override
            public List<MetricPoint> readSeries(SeriesKey key, LocalDate from, LocalDate to) {
                if (key.getEntityId().equals("/home")) {
                    throw new IllegalStateException("storage unavailable");
                }
                return reader.readSeries(key, from, to);
            }

            @Override
            public List<SeriesKey> listSeries() {
                return reader.listSeries();
            }
        };
        AnomalyPipeline pipeline = pipeline(List.of(new DropDetector()), flaky);

        RunReport report = pipeline.run(WINDOW);

        assertThat(report.getSeriesScanned()).isEqualTo(2);
        assertThat(report.getSeriesFailed()).isEqualTo(1);
        assertThat(report.getAnomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop at the next stage boundary once cancelled")
    void shouldHonourCancellation() {
        AnomalyPipeline pipeline = pipeline(List.of(new DropDetector()), reader);
        CancellationToken token = new CancellationToken();
        token.cancel();

        RunReport report = pipeline.run(WINDOW, token);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getCancelledAt()).contains("detect");
        assertThat(anomalies.findAll()).isEmpty();
        assertThat(queue.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Should notify again when an anomaly escalates to a higher severity")
    void shouldNotifyOnEscalation() {
        RunReport first = pipeline(List.of(new DropDetector(0.3)), reader).run(WINDOW);
        assertThat(anomalies.findAll()).singleElement()
                .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.LOW));
        assertThat(first.getJobsEnqueued()).isEqualTo(1);

        RunReport second = pipeline(List.of(new DropDetector(0.9)), reader).run(WINDOW);

        assertThat(anomalies.findAll()).singleElement()
                .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.HIGH));
        assertThat(second.getAlertsRaised()).isEqualTo(1);
        assertThat(second.admitted(Admission.NEW)).isEqualTo(1);
        assertThat(second.getJobsEnqueued()).isEqualTo(1);
        assertThat(alerts.findByStatus(AlertStatus.NOTIFIED)).extracting(Alert::getSeverity)
                .containsExactlyInAnyOrder(Severity.LOW, Severity.HIGH);
        assertThat(queue.pendingCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should admit an alert on the next run when its admission failed")
    void shouldRetryFailedAdmission() {
        AtomicInteger failures = new AtomicInteger(1);
        suppressions = new InMemorySuppressionRepository() {
            @Override
            public Suppression compute(String dedupKey, UnaryOperator<Suppression> remapping) {
                if (failures.getAndDecrement() > 0) {
                    throw new IllegalStateException("suppression store unavailable");
                }
                return super.compute(dedupKey, remapping);
            }
        };
        AnomalyPipeline pipeline = pipeline(List.of(new DropDetector()), reader);

        RunReport first = pipeline.run(WINDOW);
        assertThat(first.getAlertsRaised()).isEqualTo(1);
        assertThat(first.getJobsEnqueued()).isZero();
        assertThat(alerts.findByStatus(AlertStatus.OPEN)).hasSize(1);

        RunReport second = pipeline.run(WINDOW);

        assertThat(second.admitted(Admission.NEW)).isEqualTo(1);
        assertThat(second.getJobsEnqueued()).isEqualTo(1);
        assertThat(alerts.findByStatus(AlertStatus.OPEN)).isEmpty();
        assertThat(alerts.findByStatus(AlertStatus.NOTIFIED)).hasSize(1);
        assertThat(anomalies.findAll()).singleElement()
                .satisfies(a -> assertThat(a.getStatus()).isEqualTo(AnomalyStatus.ALERTED));
        assertThat(queue.pendingCount()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private AnomalyPipeline pipeline(List<AnomalyDetector> detectors, InMemoryMetricSeriesReader source) {
        FusionSettings fusionSettings = new FusionSettings();
        fusionSettings.setWeights(Map.of("statistical", 1.0));
        AlertRule rule = new AlertRule();
        rule.setId("drops");
        rule.setName("Drops");
        rule.setType("anomaly");
        rule.setCondition(new ConditionSpec());
        rule.setChannels(List.of(new ChannelTarget("webhook", "http://localhost/hook")));
        RuleEngine ruleEngine = new RuleEngine(RuleSet.of(List.of(rule)), clock);

        return AnomalyPipeline.builder()
                .reader(source)
                .detectors(detectors)
                .fusion(new FusionEngine(fusionSettings, anomalies, clock))
                .resolver(new AnomalyResolver(anomalies, source, new DetectionSettings(), 7, clock))
                .ruleEngine(ruleEngine)
                .suppression(new SuppressionManager(suppressions, queue,
                        new MessageRenderer(), ruleEngine::rule, List.of(), clock))
                .anomalies(anomalies)
                .alerts(alerts)
                .executor(executor)
                .lookbackDays(30)
                .clock(clock)
                .build();
    }

    /** Flags any in-window point below half of the series' first value. */
    private static final class DropDetector implements AnomalyDetector {

        private final double confidence;

        DropDetector() {
            this(0.9);
        }

        DropDetector(double confidence) {
            this.confidence = confidence;
        }

        @Override
        public List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window) {
            List<AnomalyCandidate> found = new ArrayList<>();
            double reference = series.get(0).getValue();
            for (MetricPoint p : series) {
                if (window.contains(p.getDate()) && p.getValue() < reference / 2) {
                    found.add(AnomalyCandidate.builder()
                            .point(p)
                            .detector(DetectorKind.STATISTICAL)
                            .direction(Direction.BELOW)
                            .rawScore(-8.0)
                            .confidence(confidence)
                            .expectedValue(reference)
                            .build());
                }
            }
            return found;
        }

        @Override
        public DetectorKind kind() {
            return DetectorKind.STATISTICAL;
        }
    }
}
