package com.metricsentinel.core.suppression;

import com.metricsentinel.core.config.AggregationMode;
import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.MaintenanceWindow;
import com.metricsentinel.core.delivery.MessageRenderer;
import com.metricsentinel.core.delivery.NotificationQueue;
import com.metricsentinel.core.model.Admission;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.model.NotificationPayload;
import com.metricsentinel.core.model.Suppression;
import com.metricsentinel.core.model.Suppression.DigestEntry;
import com.metricsentinel.core.store.SuppressionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Decides whether an alert is delivered, collapsed into an open dedup window,
 * or held for a digest.
 *
 * <h3>Admission order</h3>
 * <ol>
 * <li>An open {@link MaintenanceWindow} covering the alert mutes it
 * (SUPPRESSED, no window is opened).</li>
 * <li>An active window for the alert's dedup key absorbs it: the suppressed
 * count goes up and, for digest rules, the alert joins the pending batch
 * (AGGREGATED). Reaching the rule's burst threshold flushes the batch at
 * once.</li>
 * <li>Otherwise the rule's daily cap is checked and a new window
 * {@code [now, now + suppressionWindow)} is opened. Without aggregation the
 * alert is delivered (NEW); digest rules start a new batch
 * (AGGREGATED).</li>
 * </ol>
 *
 * <p>
 * All decisions for one dedup key run inside the repository's atomic
 * {@code compute}, so concurrent admissions never open overlapping windows.
 * Jobs are enqueued after the record is stored.
 * </p>
 *
 * @since 1.0.0
 */
public class SuppressionManager {

    private static final Logger LOG = LoggerFactory.getLogger(SuppressionManager.class);

    private final SuppressionRepository repository;
    private final NotificationQueue queue;
    private final MessageRenderer renderer;
    private final Function<String, Optional<AlertRule>> ruleLookup;
    private final List<MaintenanceWindow> maintenanceWindows;
    private final Clock clock;

    /**
     * @param ruleLookup resolves the rule of an expired window when its digest
     *                   is flushed
     */
    public SuppressionManager(SuppressionRepository repository, NotificationQueue queue, MessageRenderer renderer,
            Function<String, Optional<AlertRule>> ruleLookup, List<MaintenanceWindow> maintenanceWindows,
            Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.ruleLookup = Objects.requireNonNull(ruleLookup, "ruleLookup must not be null");
        this.maintenanceWindows = new CopyOnWriteArrayList<>(
                maintenanceWindows != null ? maintenanceWindows : List.of());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Admission
    // ---------------------------------------------------------------

    public AdmissionResult admit(Alert alert, AlertRule rule) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        if (!rule.getId().equals(alert.getRuleId())) {
            throw new IllegalArgumentException("Alert " + alert.getId() + " belongs to rule '"
                    + alert.getRuleId() + "', not '" + rule.getId() + "'");
        }
        Instant now = clock.instant();

        Optional<MaintenanceWindow> muted = maintenanceWindows.stream()
                .filter(w -> w.covers(rule.getId(), alert.getEntityId(), now))
                .findFirst();
        if (muted.isPresent()) {
            LOG.debug("Alert {} muted by maintenance window '{}'", alert.getId(), muted.get().getName());
            return new AdmissionResult(Admission.SUPPRESSED, null, List.of(),
                    "maintenance window '" + muted.get().getName() + "'");
        }

        Decision decision = new Decision();
        Suppression stored = repository.compute(alert.getDedupKey(),
                existing -> decide(existing, alert, rule, now, decision));

        List<NotificationJob> enqueued = new ArrayList<>();
        if (!decision.expiredBatch.isEmpty()) {
            enqueued.addAll(enqueueDigest(rule, decision.expiredBatch, now));
        }
        if (decision.admission == Admission.NEW) {
            NotificationPayload payload = renderer.render(alert);
            enqueued.addAll(enqueueAll(renderer.jobsFor(rule, alert.getId(), payload, now)));
        }
        if (!decision.burstBatch.isEmpty()) {
            LOG.info("Burst threshold {} reached for rule '{}' - flushing digest of {} alert(s)",
                    rule.getBurstThreshold(), rule.getId(), decision.burstBatch.size());
            enqueued.addAll(enqueueDigest(rule, decision.burstBatch, now));
        }

        LOG.debug("Alert {} admitted as {} ({})", alert.getId(), decision.admission, decision.reason);
        return new AdmissionResult(decision.admission, stored, enqueued, decision.reason);
    }

    private Suppression decide(Suppression existing, Alert alert, AlertRule rule, Instant now, Decision decision) {
        boolean digest = rule.aggregationMode() == AggregationMode.DIGEST;

        if (existing != null && existing.isActiveAt(now)) {
            existing.incrementSuppressed();
            if (digest) {
                existing.addPending(DigestEntry.of(alert));
                decision.admission = Admission.AGGREGATED;
                decision.reason = "held for digest";
                if (existing.getPendingDigest().size() >= rule.getBurstThreshold()) {
                    decision.burstBatch = existing.drainPending();
                }
            } else {
                decision.admission = Admission.SUPPRESSED;
                decision.reason = "duplicate within window ending " + existing.getWindowEnd();
            }
            return existing;
        }

        if (rule.getMaxAlertsPerDay() > 0) {
            LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
            if (!repository.tryAcquireDailySlot(rule.getId(), day, rule.getMaxAlertsPerDay())) {
                decision.admission = Admission.SUPPRESSED;
                decision.reason = "daily cap of " + rule.getMaxAlertsPerDay() + " reached";
                return existing;
            }
        }

        if (existing != null) {
            // window ended before flushExpired ran
            decision.expiredBatch = existing.drainPending();
        }
        Suppression opened = new Suppression(alert.getDedupKey(), rule.getId(), now,
                now.plus(rule.suppressionWindow()));
        if (digest) {
            opened.addPending(DigestEntry.of(alert));
            decision.admission = Admission.AGGREGATED;
            decision.reason = "opened digest window";
            if (opened.getPendingDigest().size() >= rule.getBurstThreshold()) {
                decision.burstBatch = opened.drainPending();
            }
        } else {
            decision.admission = Admission.NEW;
            decision.reason = "opened window";
        }
        return opened;
    }

    // ---------------------------------------------------------------
    // Window expiry
    // ---------------------------------------------------------------

    /**
     * Close every window that ended at or before {@code now}, enqueuing the
     * digest of any alerts still pending.
     *
     * @return the digest jobs enqueued
     */
    public List<NotificationJob> flushExpired(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<NotificationJob> enqueued = new ArrayList<>();
        for (String key : repository.findExpiredKeys(now)) {
            Suppression[] closed = new Suppression[1];
            repository.compute(key, existing -> {
                if (existing == null || existing.getWindowEnd().isAfter(now)) {
                    return existing;
                }
                closed[0] = existing;
                return null;
            });
            if (closed[0] == null) {
                continue;
            }
            Suppression window = closed[0];
            List<DigestEntry> pending = window.drainPending();
            LOG.debug("Closed window {} for rule '{}' ({} suppressed)", key, window.getRuleId(),
                    window.getSuppressedCount());
            if (pending.isEmpty()) {
                continue;
            }
            Optional<AlertRule> rule = ruleLookup.apply(window.getRuleId());
            if (rule.isEmpty()) {
                LOG.error("Rule '{}' no longer exists - digest of {} alert(s) for window {} not sent",
                        window.getRuleId(), pending.size(), key);
                continue;
            }
            enqueued.addAll(enqueueDigest(rule.get(), pending, now));
        }
        if (!enqueued.isEmpty()) {
            LOG.info("Flushed expired windows: {} digest job(s) enqueued", enqueued.size());
        }
        return enqueued;
    }

    public List<NotificationJob> flushExpired() {
        return flushExpired(clock.instant());
    }

    // ---------------------------------------------------------------
    // Maintenance windows
    // ---------------------------------------------------------------

    public void addMaintenanceWindow(MaintenanceWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        window.validate();
        maintenanceWindows.add(window);
        LOG.info("Maintenance window added: {}", window);
    }

    public List<MaintenanceWindow> maintenanceWindows() {
        return List.copyOf(maintenanceWindows);
    }

    public List<Suppression> activeWindows() {
        Instant now = clock.instant();
        return repository.findAll().stream().filter(s -> s.isActiveAt(now)).toList();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private List<NotificationJob> enqueueDigest(AlertRule rule, List<DigestEntry> entries, Instant now) {
        NotificationPayload payload = renderer.renderDigest(rule, entries, now);
        return enqueueAll(renderer.jobsFor(rule, entries.get(0).getAlertId(), payload, now));
    }

    private List<NotificationJob> enqueueAll(List<NotificationJob> jobs) {
        List<NotificationJob> enqueued = new ArrayList<>(jobs.size());
        for (NotificationJob job : jobs) {
            if (queue.enqueue(job)) {
                enqueued.add(job);
            }
        }
        return enqueued;
    }

    /** Mutable result of one atomic decision. */
    private static final class Decision {
        Admission admission = Admission.SUPPRESSED;
        String reason;
        List<DigestEntry> burstBatch = List.of();
        List<DigestEntry> expiredBatch = List.of();
    }
}
