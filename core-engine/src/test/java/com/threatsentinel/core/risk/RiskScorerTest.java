package com.threatsentinel.core.risk;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.RiskScore;
import com.threatsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskScorer}.
 */
class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer(0.95);

    @Test
    @DisplayName("A single detection scores its own weight")
    void singleDetection() {
        RiskScore risk = scorer.score(List.of(detection("XSS", Severity.MEDIUM)));

        assertThat(risk.getScore()).isEqualTo(0.5);
        assertThat(risk.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(risk.getFactors()).containsExactly("XSS (MEDIUM)");
    }

    @Test
    @DisplayName("Secondary detections add a tenth of their weight")
    void secondaryDetectionsContribute() {
        RiskScore risk = scorer.score(List.of(
                detection("PAYMENT_ANOMALY", Severity.MEDIUM),
                detection("SQL_INJECTION", Severity.HIGH),
                detection("XSS", Severity.HIGH)));

        assertThat(risk.getScore()).isCloseTo(0.875, within(1e-9));
        assertThat(risk.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(risk.getFactors()).containsExactly(
                "PAYMENT_ANOMALY (MEDIUM)", "SQL_INJECTION (HIGH)", "XSS (HIGH)", "multiple detections (3)");
    }

    @Test
    @DisplayName("Should escalate to CRITICAL at the upgrade threshold")
    void shouldEscalate() {
        RiskScore risk = scorer.score(List.of(
                detection("A", Severity.HIGH),
                detection("B", Severity.HIGH),
                detection("C", Severity.HIGH),
                detection("D", Severity.HIGH)));

        assertThat(risk.getScore()).isCloseTo(0.975, within(1e-9));
        assertThat(risk.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(risk.getFactors()).last().asString().startsWith("escalated: combined score 0.9");
    }

    @Test
    @DisplayName("Score is capped at 1 and CRITICAL is not re-escalated")
    void shouldCapScore() {
        RiskScore risk = scorer.score(List.of(
                detection("CARD_TESTING", Severity.CRITICAL),
                detection("XSS", Severity.HIGH)));

        assertThat(risk.getScore()).isEqualTo(1.0);
        assertThat(risk.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(risk.getFactors()).noneMatch(f -> f.startsWith("escalated"));
    }

    @Test
    @DisplayName("Score grows with the maximum severity")
    void shouldBeMonotoneInMaximum() {
        double previous = 0;
        for (Severity severity : Severity.values()) {
            double score = scorer.score(List.of(detection("X", Severity.LOW), detection("Y", severity))).getScore();
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    @DisplayName("Primary is the first detection with the highest weight")
    void primaryIsFirstMaximum() {
        Detection first = detection("FIRST", Severity.HIGH);
        Detection second = detection("SECOND", Severity.HIGH);

        assertThat(RiskScorer.primary(List.of(detection("LOW_ONE", Severity.LOW), first, second))).isSameAs(first);
    }

    @Test
    @DisplayName("Should reject an empty detection list")
    void shouldRejectEmpty() {
        assertThatThrownBy(() -> scorer.score(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Detection detection(String type, Severity severity) {
        return Detection.builder()
                .attackType(type)
                .severity(severity)
                .description(type)
                .detectorName(type)
                .build();
    }
}
