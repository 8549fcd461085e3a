package com.threatsentinel.core.detection;

import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignatureDetector}.
 */
class SignatureDetectorTest {

    @Test
    @DisplayName("Should match case-insensitively and report the field path")
    void shouldMatchCaseInsensitively() {
        SignatureDetector detector = new SignatureDetector(rule(List.of("<script\\b")));

        Optional<Detection> detection = detector.evaluate(event(Map.of("comment", "hi <SCRIPT>alert(1)</SCRIPT>")));

        assertThat(detection).isPresent();
        assertThat(detection.get().getAttackType()).isEqualTo("XSS");
        assertThat(detection.get().getEvidence()).containsEntry("field", "data.comment");
    }

    @Test
    @DisplayName("Should scan values nested in maps and lists")
    void shouldScanNestedValues() {
        SignatureDetector detector = new SignatureDetector(rule(List.of("javascript:")));
        Map<String, Object> payload = Map.of("profile", Map.of("links", List.of("https://ok.example", "javascript:alert(1)")));

        Optional<Detection> detection = detector.evaluate(event(payload));

        assertThat(detection).isPresent();
        assertThat(detection.get().getEvidence()).containsEntry("field", "data.profile.links[1]");
    }

    @Test
    @DisplayName("Should ignore clean payloads and non-string values")
    void shouldIgnoreCleanPayload() {
        SignatureDetector detector = new SignatureDetector(rule(List.of("<script\\b")));

        assertThat(detector.evaluate(event(Map.of("comment", "nice post", "likes", 3)))).isEmpty();
    }

    @Test
    @DisplayName("Should skip events outside the rule's event types")
    void shouldRespectEventTypeFilter() {
        DetectionRule rule = rule(List.of("<script\\b"));
        rule.setEventTypes(List.of("comment_posted"));
        SignatureDetector detector = new SignatureDetector(rule);

        assertThat(detector.evaluate(event(Map.of("comment", "<script>")))).isEmpty();
    }

    @Test
    @DisplayName("Should require at least one pattern")
    void shouldRequirePattern() {
        assertThatThrownBy(() -> new SignatureDetector(rule(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "' OR 1=1--",
            "admin' OR '1'='1--",
            "1 UNION SELECT null, version(), null--",
            "'; SELECT pg_sleep(2); --"
    })
    @DisplayName("Bundled SQL injection rule should flag classic payloads")
    void bundledSqlInjectionRuleShouldFlagPayloads(String payload) {
        SignatureDetector detector = new SignatureDetector(bundledRule("sql_injection"));

        assertThat(detector.evaluate(event(Map.of("username", payload)))).isPresent();
    }

    @ParameterizedTest
    @ValueSource(strings = {"alice", "O'Brien", "order by price"})
    @DisplayName("Bundled SQL injection rule should pass ordinary input")
    void bundledSqlInjectionRuleShouldPassOrdinaryInput(String payload) {
        SignatureDetector detector = new SignatureDetector(bundledRule("sql_injection"));

        assertThat(detector.evaluate(event(Map.of("username", payload)))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectionRule bundledRule(String name) {
        RulesConfig config = RulesLoader.fromClasspath("rules.yml");
        return config.getRules().stream()
                .filter(r -> r.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static DetectionRule rule(List<String> patterns) {
        DetectionRule rule = new DetectionRule();
        rule.setName("xss");
        rule.setType("signature");
        rule.setAttackType("XSS");
        rule.setSeverity("HIGH");
        rule.setPatterns(patterns);
        return rule;
    }

    private static SecurityEvent event(Map<String, Object> payload) {
        return SecurityEvent.builder()
                .eventType("form_submit")
                .payload(payload)
                .sourceIp("10.0.0.1")
                .build();
    }
}
