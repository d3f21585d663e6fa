package com.metricsentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content-addressed identifiers.
 *
 * <p>
 * Every id derived here is the lowercase hex SHA-256 of its parts joined with
 * {@code '|'}, so the same inputs always produce the same id across runs and
 * processes.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fingerprints {

    private Fingerprints() {
        // not instantiable
    }

    /**
     * @return id of the canonical anomaly for one (entity, metric, date, direction)
     */
    public static String anomalyId(String entityId, String metric, LocalDate date, Direction direction) {
        return sha256(entityId, metric, date.toString(), direction.key());
    }

    /**
     * The severity bucket is part of the id, matching {@link #dedupKey}: an
     * escalated anomaly yields a new alert rather than colliding with the
     * one raised at its earlier severity.
     *
     * @return id of the alert a rule raises for one trigger at one severity
     */
    public static String alertId(String ruleId, String triggerKey, Severity severity) {
        return sha256(ruleId, triggerKey, severity.key());
    }

    /**
     * @return key grouping alerts that must share one suppression window
     */
    public static String dedupKey(String ruleId, String entityId, String metric, Severity severity) {
        return sha256(ruleId, entityId, metric, severity.key());
    }

    public static String sha256(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append('|');
            }
            joined.append(Objects.requireNonNull(parts[i], "id part must not be null"));
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(joined.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
