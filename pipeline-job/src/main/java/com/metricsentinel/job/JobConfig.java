package com.metricsentinel.job;

import java.util.Objects;

/**
 * Typed, immutable process configuration of the pipeline job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job is
 * configured through container env vars or a shell environment. Tunables of
 * the pipeline itself (thresholds, weights, retry policy) live in
 * {@code pipeline.yml}; this object only carries process wiring.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * in tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Configuration files
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final String pipelineConfigPath;

    // ---------------------------------------------------------------
    // Data and state
    // ---------------------------------------------------------------
    private final String metricsInputPath;
    private final String jobJournalPath;
    private final String deliveryLogPath;
    private final String suppressionStatePath;

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final int detectionParallelism;
    private final int runIntervalMinutes;
    private final int lookbackDays;

    // ---------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------
    private final int operationsPort;

    // ---------------------------------------------------------------
    // Email channel (enabled when smtpHost is set)
    // ---------------------------------------------------------------
    private final String smtpHost;
    private final int smtpPort;
    private final String mailFrom;

    private JobConfig(Builder b) {
        this.rulesConfigPath = b.rulesConfigPath;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.metricsInputPath = b.metricsInputPath;
        this.jobJournalPath = b.jobJournalPath;
        this.deliveryLogPath = b.deliveryLogPath;
        this.suppressionStatePath = b.suppressionStatePath;
        this.detectionParallelism = b.detectionParallelism;
        this.runIntervalMinutes = b.runIntervalMinutes;
        this.lookbackDays = b.lookbackDays;
        this.operationsPort = b.operationsPort;
        this.smtpHost = b.smtpHost;
        this.smtpPort = b.smtpPort;
        this.mailFrom = b.mailFrom;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                    .metricsInputPath(env("METRICS_INPUT_PATH", "metrics.jsonl"))
                    .jobJournalPath(env("JOB_JOURNAL_PATH", "notification-jobs.json"))
                    .deliveryLogPath(env("DELIVERY_LOG_PATH", "delivery-attempts.jsonl"))
                    .suppressionStatePath(env("SUPPRESSION_STATE_PATH", "suppression-state.json"))
                    .detectionParallelism(parseIntEnv("DETECTION_PARALLELISM", "4"))
                    .runIntervalMinutes(parseIntEnv("RUN_INTERVAL_MINUTES", "60"))
                    .lookbackDays(parseIntEnv("LOOKBACK_DAYS", "90"))
                    .operationsPort(parseIntEnv("OPERATIONS_PORT", "8080"))
                    .smtpHost(env("SMTP_HOST", ""))
                    .smtpPort(parseIntEnv("SMTP_PORT", "25"))
                    .mailFrom(env("MAIL_FROM", "metric-sentinel@localhost"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public String getMetricsInputPath() {
        return metricsInputPath;
    }

    public String getJobJournalPath() {
        return jobJournalPath;
    }

    public String getDeliveryLogPath() {
        return deliveryLogPath;
    }

    public String getSuppressionStatePath() {
        return suppressionStatePath;
    }

    public int getDetectionParallelism() {
        return detectionParallelism;
    }

    public int getRunIntervalMinutes() {
        return runIntervalMinutes;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public int getOperationsPort() {
        return operationsPort;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public boolean isEmailEnabled() {
        return smtpHost != null && !smtpHost.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks that counts are positive, ports lie in
     * [1, 65535] and the input and journal paths are not blank.
     * </p>
     */
    public static class Builder {
        private String rulesConfigPath = "";
        private String pipelineConfigPath = "";
        private String metricsInputPath = "metrics.jsonl";
        private String jobJournalPath = "notification-jobs.json";
        private String deliveryLogPath = "delivery-attempts.jsonl";
        private String suppressionStatePath = "suppression-state.json";
        private int detectionParallelism = 4;
        private int runIntervalMinutes = 60;
        private int lookbackDays = 90;
        private int operationsPort = 8080;
        private String smtpHost = "";
        private int smtpPort = 25;
        private String mailFrom = "metric-sentinel@localhost";

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder metricsInputPath(String v) {
            this.metricsInputPath = v;
            return this;
        }

        public Builder jobJournalPath(String v) {
            this.jobJournalPath = v;
            return this;
        }

        public Builder deliveryLogPath(String v) {
            this.deliveryLogPath = v;
            return this;
        }

        public Builder suppressionStatePath(String v) {
            this.suppressionStatePath = v;
            return this;
        }

        public Builder detectionParallelism(int v) {
            this.detectionParallelism = v;
            return this;
        }

        public Builder runIntervalMinutes(int v) {
            this.runIntervalMinutes = v;
            return this;
        }

        public Builder lookbackDays(int v) {
            this.lookbackDays = v;
            return this;
        }

        public Builder operationsPort(int v) {
            this.operationsPort = v;
            return this;
        }

        public Builder smtpHost(String v) {
            this.smtpHost = v;
            return this;
        }

        public Builder smtpPort(int v) {
            this.smtpPort = v;
            return this;
        }

        public Builder mailFrom(String v) {
            this.mailFrom = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath required");
            requireNonBlank(metricsInputPath, "metricsInputPath");
            requireNonBlank(jobJournalPath, "jobJournalPath");
            requireNonBlank(deliveryLogPath, "deliveryLogPath");
            requireNonBlank(suppressionStatePath, "suppressionStatePath");

            if (detectionParallelism < 1) {
                throw new IllegalArgumentException(
                        "detectionParallelism must be >= 1, got: " + detectionParallelism);
            }
            if (runIntervalMinutes < 1) {
                throw new IllegalArgumentException("runIntervalMinutes must be >= 1, got: " + runIntervalMinutes);
            }
            if (lookbackDays < 1) {
                throw new IllegalArgumentException("lookbackDays must be >= 1, got: " + lookbackDays);
            }
            requirePort(operationsPort, "operationsPort");
            requirePort(smtpPort, "smtpPort");
            if (smtpHost != null && !smtpHost.isBlank()) {
                requireNonBlank(mailFrom, "mailFrom");
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePort(int port, String name) {
            if (port < 1 || port > 65_535) {
                throw new IllegalArgumentException(name + " must be in [1, 65535], got: " + port);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "rulesConfigPath='" + rulesConfigPath + '\'' +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", metricsInputPath='" + metricsInputPath + '\'' +
                ", jobJournalPath='" + jobJournalPath + '\'' +
                ", deliveryLogPath='" + deliveryLogPath + '\'' +
                ", suppressionStatePath='" + suppressionStatePath + '\'' +
                ", detectionParallelism=" + detectionParallelism +
                ", runIntervalMinutes=" + runIntervalMinutes +
                ", lookbackDays=" + lookbackDays +
                ", operationsPort=" + operationsPort +
                ", emailEnabled=" + isEmailEnabled() +
                '}';
    }
}
