package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Channel-neutral content of a notification: either a single alert or a
 * digest summarising several alerts of one suppression window.
 *
 * <p>
 * Channel adapters turn this into their own wire format. The payload is
 * stored with its {@link NotificationJob} and therefore Jackson friendly.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationPayload implements Serializable {

    private static final long serialVersionUID = 1L;

    private String title;
    private String message;
    private Severity severity;
    private String ruleId;
    private String ruleName;
    private String entityId;
    private String metric;

    /** Alerts covered by this notification; one entry unless it is a digest. */
    private List<String> alertIds = new ArrayList<>();

    /** Number of alerts summarised; 1 for a single-alert notification. */
    private int alertCount = 1;

    private boolean digest;
    private Map<String, Object> metrics = new LinkedHashMap<>();
    private Instant createdAt;

    public NotificationPayload() {
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public List<String> getAlertIds() {
        return Collections.unmodifiableList(alertIds);
    }

    public void setAlertIds(List<String> alertIds) {
        this.alertIds = alertIds != null ? new ArrayList<>(alertIds) : new ArrayList<>();
    }

    public int getAlertCount() {
        return alertCount;
    }

    public void setAlertCount(int alertCount) {
        this.alertCount = alertCount;
    }

    public boolean isDigest() {
        return digest;
    }

    public void setDigest(boolean digest) {
        this.digest = digest;
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public void setMetrics(Map<String, Object> metrics) {
        this.metrics = metrics != null ? new LinkedHashMap<>(metrics) : new LinkedHashMap<>();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "NotificationPayload{" +
                "title='" + title + '\'' +
                ", severity=" + severity +
                ", alertCount=" + alertCount +
                ", digest=" + digest +
                '}';
    }
}
