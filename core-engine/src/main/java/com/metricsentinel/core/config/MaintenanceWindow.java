package com.metricsentinel.core.config;

import com.metricsentinel.core.rules.ScopeFilter;

import java.io.Serializable;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operator-defined mute window, e.g. for a planned migration.
 *
 * <p>
 * While the window is open, alerts of the matching rule (or of every rule
 * when {@code ruleId} is unset) for matching entities (or every entity when
 * {@code entity} is unset) are suppressed without opening a dedup window.
 * {@code start} and {@code end} are ISO-8601 instants.
 * </p>
 *
 * @since 1.0.0
 */
public class MaintenanceWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String ruleId;

    /** Entity glob pattern; {@code null} matches every entity. */
    private String entity;

    private String start;
    private String end;
    private String reason;

    public MaintenanceWindow() {
    }

    public MaintenanceWindow(String name, String ruleId, String entity, Instant start, Instant end, String reason) {
        this.name = name;
        this.ruleId = ruleId;
        this.entity = entity;
        this.start = start != null ? start.toString() : null;
        this.end = end != null ? end.toString() : null;
        this.reason = reason;
    }

    /**
     * @throws IllegalStateException if the window is malformed
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Maintenance window 'name' is required");
        }
        Instant s = parse("start", start, errors);
        Instant e = parse("end", end, errors);
        if (s != null && e != null && !e.isAfter(s)) {
            errors.add("Maintenance window '" + name + "' requires 'end' after 'start'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid MaintenanceWindow: " + String.join("; ", errors));
        }
    }

    /**
     * @param alertRuleId rule of the alert being admitted
     * @param entityId    entity of the alert being admitted
     * @param now         admission time
     * @return {@code true} if the alert falls under this window
     */
    public boolean covers(String alertRuleId, String entityId, Instant now) {
        if (!isOpenAt(now)) {
            return false;
        }
        if (ruleId != null && !ruleId.equals(alertRuleId)) {
            return false;
        }
        return entity == null || ScopeFilter.globMatches(entity, entityId);
    }

    public boolean isOpenAt(Instant now) {
        return !now.isBefore(startInstant()) && now.isBefore(endInstant());
    }

    public Instant startInstant() {
        return Instant.parse(Objects.requireNonNull(start, "start must not be null"));
    }

    public Instant endInstant() {
        return Instant.parse(Objects.requireNonNull(end, "end must not be null"));
    }

    private Instant parse(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add("Maintenance window '" + name + "' requires '" + field + "'");
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            errors.add("Maintenance window '" + name + "' has an invalid '" + field + "': " + value);
            return null;
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getEntity() {
        return entity;
    }

    public void setEntity(String entity) {
        this.entity = entity;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public String toString() {
        return "MaintenanceWindow{" +
                "name='" + name + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", entity='" + entity + '\'' +
                ", start='" + start + '\'' +
                ", end='" + end + '\'' +
                '}';
    }
}
