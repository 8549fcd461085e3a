package com.threatsentinel.core.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threatsentinel.core.json.JsonSupport;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Expensive detector that asks a language model for a verdict.
 *
 * <p>
 * Posts the event to an Ollama-compatible {@code /api/generate} endpoint with
 * {@code "format": "json"} and expects the generated text to be a JSON object
 * such as:
 * </p>
 *
 * <pre>
 * {"is_threat": true, "attack_type": "SQL_INJECTION", "severity": "HIGH", "reason": "..."}
 * </pre>
 *
 * <p>
 * A missing {@code attack_type} or {@code severity} falls back to the rule's
 * values. Every transport failure, non-2xx status, timeout or unparseable
 * verdict raises {@link DetectorException}, which the circuit breaker counts
 * as a failure.
 * </p>
 *
 * @since 1.0.0
 */
public class LanguageModelDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LanguageModelDetector.class);

    static final String GENERATE_PATH = "/api/generate";

    private final DetectionRule rule;
    private final Severity severity;
    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    /**
     * @param rule the detection rule configuration
     */
    public LanguageModelDetector(DetectionRule rule) {
        this(rule, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, rule.getTimeoutSeconds())))
                .build());
    }

    /**
     * @param rule   the detection rule configuration
     * @param client HTTP client used for the model calls
     * @throws IllegalArgumentException if the endpoint is not a valid URI
     */
    public LanguageModelDetector(DetectionRule rule, HttpClient client) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        Objects.requireNonNull(rule.getModel(), "model must not be null for rule '" + rule.getName() + "'");
        String base = Objects.requireNonNull(rule.getEndpoint(),
                "endpoint must not be null for rule '" + rule.getName() + "'");
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        this.severity = rule.severityLevel();
        this.endpoint = URI.create(stripTrailingSlash(base) + GENERATE_PATH);
        this.timeout = Duration.ofSeconds(rule.getTimeoutSeconds());
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!rule.appliesTo(event.getEventType())) {
            return Optional.empty();
        }

        String body = requestBody(event);
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DetectorException("Language model call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectorException("Interrupted while waiting for language model", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new DetectorException("Language model returned HTTP " + response.statusCode());
        }
        return parseVerdict(response.body());
    }

    private String requestBody(SecurityEvent event) {
        try {
            String eventJson = mapper.writeValueAsString(event);
            ObjectNode node = mapper.createObjectNode();
            node.put("model", rule.getModel());
            node.put("prompt", prompt(eventJson));
            node.put("format", "json");
            node.put("stream", false);
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DetectorException("Cannot serialize event for language model", e);
        }
    }

    private static String prompt(String eventJson) {
        return "You are a security analyst. Classify the following application event. "
                + "Answer with a JSON object with the keys is_threat (boolean), attack_type (string), "
                + "severity (LOW, MEDIUM, HIGH or CRITICAL) and reason (string).\n"
                + "Event: " + eventJson;
    }

    Optional<Detection> parseVerdict(String responseBody) {
        JsonNode verdict;
        try {
            JsonNode envelope = mapper.readTree(responseBody);
            JsonNode generated = envelope.path("response");
            if (!generated.isTextual()) {
                throw new DetectorException("Language model response has no 'response' text");
            }
            verdict = mapper.readTree(generated.asText());
        } catch (JsonProcessingException e) {
            throw new DetectorException("Unparseable language model verdict", e);
        }
        if (verdict == null || !verdict.isObject()) {
            throw new DetectorException("Language model verdict is not a JSON object");
        }

        if (!verdict.path("is_threat").asBoolean(false)) {
            return Optional.empty();
        }

        Severity level = severity;
        String reported = verdict.path("severity").asText(null);
        if (reported != null) {
            try {
                level = Severity.parse(reported);
            } catch (IllegalArgumentException e) {
                LOG.debug("Rule [{}]: ignoring unknown severity '{}' in verdict", rule.getName(), reported);
            }
        }
        String attackType = verdict.path("attack_type").asText("");
        String reason = verdict.path("reason").asText("");

        LOG.debug("Rule [{}] fired: model verdict {} {}", rule.getName(), attackType, level);
        return Optional.of(Detection.builder()
                .attackType(attackType.isBlank() ? rule.getAttackType() : attackType)
                .severity(level)
                .detectorName(rule.getName())
                .description(reason.isBlank() ? "Language model flagged the event" : reason)
                .evidence("model", rule.getModel())
                .build());
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }
}
