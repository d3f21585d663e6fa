package com.metricsentinel.core.delivery;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.ChannelTarget;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.Fingerprints;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.model.NotificationPayload;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.Suppression.DigestEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns alerts and digest batches into channel-neutral payloads and
 * {@link NotificationJob}s, one per channel target of the rule.
 *
 * @since 1.0.0
 */
public class MessageRenderer {

    /** Entries listed in a digest message before it is abbreviated. */
    static final int MAX_DIGEST_LINES = 20;

    public NotificationPayload render(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        NotificationPayload payload = new NotificationPayload();
        payload.setTitle(alert.getTitle());
        payload.setMessage(alert.getMessage());
        payload.setSeverity(alert.getSeverity());
        payload.setRuleId(alert.getRuleId());
        payload.setRuleName(alert.getRuleName());
        payload.setEntityId(alert.getEntityId());
        payload.setMetric(alert.getMetric());
        payload.setAlertIds(List.of(alert.getId()));
        payload.setAlertCount(1);
        payload.setDigest(false);
        payload.setMetrics(alert.getMetricsSnapshot() != null
                ? new LinkedHashMap<>(alert.getMetricsSnapshot())
                : new LinkedHashMap<>());
        payload.setCreatedAt(alert.getCreatedAt());
        return payload;
    }

    /**
     * @param rule    the rule the batch belongs to
     * @param entries alerts held for the digest, in arrival order; not empty
     * @param now     flush time
     */
    public NotificationPayload renderDigest(AlertRule rule, List<DigestEntry> entries, Instant now) {
        Objects.requireNonNull(rule, "rule must not be null");
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Digest for rule '" + rule.getId() + "' has no entries");
        }
        Severity highest = entries.stream()
                .map(DigestEntry::getSeverity)
                .max(Comparator.naturalOrder())
                .orElse(Severity.LOW);

        StringBuilder message = new StringBuilder();
        message.append(entries.size()).append(" alert(s) between ")
                .append(entries.get(0).getCreatedAt()).append(" and ")
                .append(entries.get(entries.size() - 1).getCreatedAt()).append(':');
        int listed = Math.min(entries.size(), MAX_DIGEST_LINES);
        for (int i = 0; i < listed; i++) {
            DigestEntry e = entries.get(i);
            message.append("\n- ").append(e.getTitle() != null ? e.getTitle() : e.getAlertId());
        }
        if (entries.size() > listed) {
            message.append("\n... and ").append(entries.size() - listed).append(" more");
        }

        List<String> alertIds = new ArrayList<>(entries.size());
        entries.forEach(e -> alertIds.add(e.getAlertId()));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("alertCount", entries.size());

        NotificationPayload payload = new NotificationPayload();
        payload.setTitle("[" + highest.name() + "] Digest: " + entries.size() + " alert(s) for " + rule.getName());
        payload.setMessage(message.toString());
        payload.setSeverity(highest);
        payload.setRuleId(rule.getId());
        payload.setRuleName(rule.getName());
        payload.setAlertIds(alertIds);
        payload.setAlertCount(entries.size());
        payload.setDigest(true);
        payload.setMetrics(metrics);
        payload.setCreatedAt(now);
        return payload;
    }

    /**
     * One job per channel target. The job id is derived from the alert id and
     * channel, so rendering the same alert twice yields the same jobs.
     *
     * @param alertId alert the jobs deliver; the first alert for a digest
     */
    public List<NotificationJob> jobsFor(AlertRule rule, String alertId, NotificationPayload payload, Instant now) {
        List<NotificationJob> jobs = new ArrayList<>(rule.getChannels().size());
        for (ChannelTarget target : rule.getChannels()) {
            jobs.add(new NotificationJob(
                    Fingerprints.sha256("job", alertId, target.getChannel()),
                    alertId,
                    rule.getId(),
                    target.getChannel(),
                    target.getDestination(),
                    payload.getSeverity(),
                    payload,
                    now));
        }
        return jobs;
    }
}
