package com.metricsentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.channel.ChannelRegistry;
import com.metricsentinel.core.channel.EmailChannel;
import com.metricsentinel.core.channel.NotificationChannel;
import com.metricsentinel.core.channel.SlackChannel;
import com.metricsentinel.core.channel.WebhookChannel;
import com.metricsentinel.core.config.PipelineSettings;
import com.metricsentinel.core.config.RuleSet;
import com.metricsentinel.core.config.RulesLoader;
import com.metricsentinel.core.config.SettingsLoader;
import com.metricsentinel.core.delivery.Dispatcher;
import com.metricsentinel.core.delivery.ExponentialBackoff;
import com.metricsentinel.core.delivery.MessageRenderer;
import com.metricsentinel.core.delivery.NotificationQueue;
import com.metricsentinel.core.detection.DetectionWindow;
import com.metricsentinel.core.detection.DetectorFactory;
import com.metricsentinel.core.fusion.AnomalyResolver;
import com.metricsentinel.core.fusion.FusionEngine;
import com.metricsentinel.core.model.JsonMapping;
import com.metricsentinel.core.pipeline.AnomalyPipeline;
import com.metricsentinel.core.pipeline.CancellationToken;
import com.metricsentinel.core.pipeline.RunReport;
import com.metricsentinel.core.rules.RuleEngine;
import com.metricsentinel.core.store.FileNotificationJobRepository;
import com.metricsentinel.core.store.FileSuppressionRepository;
import com.metricsentinel.core.store.InMemoryAlertRepository;
import com.metricsentinel.core.store.InMemoryAnomalyRepository;
import com.metricsentinel.core.store.JsonLinesDeliveryLog;
import com.metricsentinel.core.suppression.SuppressionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point of the Metric Sentinel pipeline job.
 *
 * <h3>Process</h3>
 * 
 * <pre>
 *   every RUN_INTERVAL_MINUTES:
 *     metrics.jsonl → detectors → fusion → rules → suppression → queue
 *   continuously:
 *     queue → dispatcher → channel adapters → delivery log
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process wiring comes from environment variables via {@link JobConfig};
 * rules from {@code rules.yml} and tunables from {@code pipeline.yml}.
 * </p>
 *
 * <h3>Recovery</h3>
 * <p>
 * Notification jobs are journaled to {@code JOB_JOURNAL_PATH}; jobs left in
 * flight by a crash are requeued when the dispatcher starts.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(MetricSentinelJob.class);

    private MetricSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Metric Sentinel with config: {}", config);

        RuleSet ruleSet = loadRules(config);
        PipelineSettings settings = loadSettings(config);
        if (ruleSet.getRules().isEmpty()) {
            throw new IllegalStateException(
                    "No alert rules defined. Provide rules via "
                            + RulesLoader.ENV_RULES_PATH
                            + " or a classpath rules.yml file.");
        }
        Clock clock = Clock.systemUTC();

        // 2. Storage
        InMemoryAnomalyRepository anomalies = new InMemoryAnomalyRepository();
        InMemoryAlertRepository alerts = new InMemoryAlertRepository();
        NotificationQueue queue = new NotificationQueue(
                new FileNotificationJobRepository(Path.of(config.getJobJournalPath())), clock);
        JsonMetricSeriesReader reader = new JsonMetricSeriesReader(Path.of(config.getMetricsInputPath()));

        // 3. Pipeline
        RuleEngine ruleEngine = new RuleEngine(ruleSet, clock);
        MessageRenderer renderer = new MessageRenderer();
        SuppressionManager suppression = new SuppressionManager(
                new FileSuppressionRepository(Path.of(config.getSuppressionStatePath())), queue,
                renderer, ruleEngine::rule, ruleSet.getMaintenanceWindows(), clock);
        AnomalyResolver resolver = new AnomalyResolver(anomalies, reader, settings.getDetection(),
                settings.getFusion().getRetentionDays(), clock);
        ExecutorService detectionPool = Executors.newFixedThreadPool(config.getDetectionParallelism());
        AnomalyPipeline pipeline = AnomalyPipeline.builder()
                .reader(reader)
                .detectors(DetectorFactory.createAll(settings.getDetection()))
                .fusion(new FusionEngine(settings.getFusion(), anomalies, clock))
                .resolver(resolver)
                .ruleEngine(ruleEngine)
                .suppression(suppression)
                .anomalies(anomalies)
                .alerts(alerts)
                .executor(detectionPool)
                .lookbackDays(config.getLookbackDays())
                .clock(clock)
                .build();

        // 4. Delivery
        PipelineMetrics metrics = new PipelineMetrics();
        metrics.bindPendingJobs(queue::pendingCount);
        Dispatcher dispatcher = new Dispatcher(queue, channels(config, settings),
                new JsonLinesDeliveryLog(Path.of(config.getDeliveryLogPath())),
                ExponentialBackoff.from(settings.getDelivery()), settings.getDelivery(), clock);
        dispatcher.addListener(metrics);
        dispatcher.start();

        // 5. Operations server
        AtomicBoolean ready = new AtomicBoolean(false);
        OperationsServer operations = new OperationsServer(queue, resolver, alerts, ruleEngine, metrics, ready::get);
        operations.start(config.getOperationsPort());

        // 6. Schedule runs
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                reader.refresh();
                LocalDate today = LocalDate.now(clock);
                RunReport report = pipeline.run(DetectionWindow.of(today.minusDays(1), today), token);
                metrics.recordRun(report);
                ready.set(true);
            } catch (RuntimeException e) {
                LOG.error("Pipeline run failed: {}", e.getMessage(), e);
            }
        }, 0, config.getRunIntervalMinutes(), TimeUnit.MINUTES);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Metric Sentinel");
            token.cancel();
            scheduler.shutdownNow();
            detectionPool.shutdownNow();
            dispatcher.stop();
            operations.stop();
            stopped.countDown();
        }, "sentinel-shutdown"));

        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static ChannelRegistry channels(JobConfig config, PipelineSettings settings) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.getDelivery().sendTimeout())
                .build();
        ObjectMapper mapper = JsonMapping.newMapper();
        List<NotificationChannel> channels = new ArrayList<>();
        channels.add(new WebhookChannel(httpClient, mapper, settings.getDelivery().sendTimeout()));
        channels.add(new SlackChannel(httpClient, mapper, settings.getDelivery().sendTimeout()));
        if (config.isEmailEnabled()) {
            channels.add(EmailChannel.smtp(config.getSmtpHost(), config.getSmtpPort(), config.getMailFrom()));
        } else {
            LOG.info("SMTP_HOST not set - email channel disabled");
        }
        return ChannelRegistry.of(channels.toArray(new NotificationChannel[0]));
    }

    private static RuleSet loadRules(JobConfig config) {
        String rulesPath = config.getRulesConfigPath();
        if (rulesPath != null && !rulesPath.isBlank()) {
            return RulesLoader.fromFile(rulesPath);
        }
        return RulesLoader.load();
    }

    private static PipelineSettings loadSettings(JobConfig config) {
        String path = config.getPipelineConfigPath();
        if (path != null && !path.isBlank()) {
            return SettingsLoader.fromFile(path);
        }
        return SettingsLoader.load();
    }
}
