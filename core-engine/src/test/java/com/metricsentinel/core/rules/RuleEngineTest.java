package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.ChannelTarget;
import com.metricsentinel.core.config.ConditionSpec;
import com.metricsentinel.core.config.RuleRejection;
import com.metricsentinel.core.config.RuleSet;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.Fingerprints;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RuleEngine}.
 */
class RuleEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-10T06:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final LocalDate DAY = LocalDate.of(2024, 3, 9);

    @Test
    @DisplayName("Should raise an alert with deterministic id and dedup key for a matching anomaly")
    void shouldRaiseAlertForAnomaly() {
        AlertRule rule = anomalyRule("drops", "medium");
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(rule)), CLOCK);
        Anomaly anomaly = anomaly("/pricing", Severity.MEDIUM, 0.6);

        List<Alert> alerts = engine.evaluate(new AnomalyTrigger(anomaly));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getId())
                    .isEqualTo(Fingerprints.alertId("drops", "anomaly:" + anomaly.getId(), Severity.MEDIUM));
            assertThat(alert.getDedupKey())
                    .isEqualTo(Fingerprints.dedupKey("drops", "/pricing", "clicks", Severity.MEDIUM));
            assertThat(alert.getAnomalyId()).isEqualTo(anomaly.getId());
            assertThat(alert.getTitle()).isEqualTo("[MEDIUM] Rule drops: /pricing / clicks");
            assertThat(alert.getCreatedAt()).isEqualTo(NOW);
            assertThat(alert.getMetricsSnapshot()).containsEntry("direction", "below");
        });
    }

    @Test
    @DisplayName("Should produce the same alert id when the same trigger is evaluated twice")
    void shouldBeDeterministic() {
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(anomalyRule("drops", "low"))), CLOCK);
        Anomaly anomaly = anomaly("/pricing", Severity.LOW, 0.3);

        String first = engine.evaluate(new AnomalyTrigger(anomaly)).get(0).getId();
        String second = engine.evaluate(new AnomalyTrigger(anomaly.copy())).get(0).getId();

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should raise a distinct alert when the same anomaly escalates")
    void shouldRaiseNewAlertOnEscalation() {
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(anomalyRule("drops", "low"))), CLOCK);
        Anomaly low = anomaly("/pricing", Severity.LOW, 0.3);
        Anomaly high = low.copy();
        high.setSeverity(Severity.HIGH);
        high.setConfidence(0.9);

        Alert first = engine.evaluate(new AnomalyTrigger(low)).get(0);
        Alert escalated = engine.evaluate(new AnomalyTrigger(high)).get(0);

        assertThat(escalated.getAnomalyId()).isEqualTo(first.getAnomalyId());
        assertThat(escalated.getId()).isNotEqualTo(first.getId());
        assertThat(escalated.getDedupKey()).isNotEqualTo(first.getDedupKey());
    }

    @Test
    @DisplayName("Should not fire when anomaly is below the rule's minimum severity")
    void shouldRespectMinSeverity() {
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(anomalyRule("drops", "high"))), CLOCK);

        assertThat(engine.evaluate(new AnomalyTrigger(anomaly("/pricing", Severity.MEDIUM, 0.6)))).isEmpty();
    }

    @Test
    @DisplayName("Should not fire for a resolved anomaly")
    void shouldIgnoreResolvedAnomaly() {
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(anomalyRule("drops", "low"))), CLOCK);
        Anomaly anomaly = anomaly("/pricing", Severity.MEDIUM, 0.6);
        anomaly.setStatus(AnomalyStatus.RESOLVED);

        assertThat(engine.evaluate(new AnomalyTrigger(anomaly))).isEmpty();
    }

    @Test
    @DisplayName("Should apply severity mapping before a fixed severity")
    void shouldMapSeverity() {
        AlertRule rule = anomalyRule("drops", "low");
        rule.setSeverity("low");
        rule.setSeverityMapping(Map.of("medium", "high"));
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(rule)), CLOCK);

        Alert mapped = engine.evaluate(new AnomalyTrigger(anomaly("/a", Severity.MEDIUM, 0.6))).get(0);
        Alert fixed = engine.evaluate(new AnomalyTrigger(anomaly("/a", Severity.LOW, 0.3))).get(0);

        assertThat(mapped.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(fixed.getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Should evaluate threshold rules only within their entity scope")
    void shouldHonourScope() {
        AlertRule rule = new AlertRule();
        rule.setId("position");
        rule.setName("Position");
        rule.setType("threshold");
        rule.setEntities(List.of("/blog/*"));
        rule.setMetrics(List.of("position"));
        ConditionSpec condition = new ConditionSpec();
        condition.setOperator(">");
        condition.setThreshold(10.0);
        rule.setCondition(condition);
        rule.setChannels(List.of(new ChannelTarget("webhook", "http://localhost/hook")));
        RuleEngine engine = new RuleEngine(RuleSet.of(List.of(rule)), CLOCK);

        List<Alert> inScope = engine.evaluate(metric("/blog/post", "position", 12.5));
        List<Alert> outOfScope = engine.evaluate(metric("/pricing", "position", 12.5));
        List<Alert> otherMetric = engine.evaluate(metric("/blog/post", "clicks", 12.5));

        assertThat(inScope).singleElement().satisfies(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(alert.getAnomalyId()).isNull();
            assertThat(alert.getMessage()).contains("position = 12.50");
        });
        assertThat(outOfScope).isEmpty();
        assertThat(otherMetric).isEmpty();
    }

    @Test
    @DisplayName("Should expose rules from the rule set and carry its rejections")
    void shouldExposeRulesAndRejections() {
        RuleSet ruleSet = new RuleSet(List.of(anomalyRule("drops", "low")),
                List.of(new RuleRejection("bad", "Invalid AlertRule: missing name")), List.of());
        RuleEngine engine = new RuleEngine(ruleSet, CLOCK);

        assertThat(engine.rules()).extracting(AlertRule::getId).containsExactly("drops");
        assertThat(engine.rule("drops")).isPresent();
        assertThat(engine.rule("missing")).isEmpty();
        assertThat(engine.rejectedRules()).extracting(RuleRejection::getRuleId).containsExactly("bad");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertRule anomalyRule(String id, String minSeverity) {
        AlertRule rule = new AlertRule();
        rule.setId(id);
        rule.setName("Rule " + id);
        rule.setType("anomaly");
        ConditionSpec condition = new ConditionSpec();
        condition.setMinSeverity(minSeverity);
        rule.setCondition(condition);
        rule.setChannels(List.of(new ChannelTarget("webhook", "http://localhost/hook")));
        return rule;
    }

    private static Anomaly anomaly(String entity, Severity severity, double confidence) {
        return Anomaly.builder()
                .id(Fingerprints.anomalyId(entity, "clicks", DAY, Direction.BELOW))
                .entityId(entity)
                .metric("clicks")
                .date(DAY)
                .direction(Direction.BELOW)
                .severity(severity)
                .confidence(confidence)
                .detectorConfidences(Map.of(DetectorKind.STATISTICAL, confidence))
                .magnitudePct(-40.0)
                .actualValue(60.0)
                .expectedValue(100.0)
                .detectedAt(NOW)
                .build();
    }

    private static MetricTrigger metric(String entity, String metric, double latest) {
        return new MetricTrigger(entity, metric, List.of(
                MetricPoint.of(entity, metric, DAY.minusDays(1), 8.0),
                MetricPoint.of(entity, metric, DAY, latest)));
    }
}
