package com.threatsentinel.core.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatsentinel.core.support.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BroadcastHub}.
 */
class BroadcastHubTest {

    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        hub = new BroadcastHub();
    }

    @Test
    @DisplayName("Should merge the body fields into a typed envelope")
    void shouldWrapBodyInEnvelope() {
        RecordingObserver observer = new RecordingObserver("a");
        hub.register(observer);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "running");
        body.put("type", "ignored");
        int delivered = hub.broadcast(MessageType.SIMULATION_STATUS, body);

        assertThat(delivered).isEqualTo(1);
        List<JsonNode> received = observer.messagesOfType("simulation_status");
        assertThat(received).hasSize(1);
        assertThat(received.get(0).path("status").asText()).isEqualTo("running");
    }

    @Test
    @DisplayName("A non-object body is placed under data")
    void shouldNestScalarBody() {
        RecordingObserver observer = new RecordingObserver("a");
        hub.register(observer);

        hub.broadcast(MessageType.WEBSITE_HEALTH, List.of("x", "y"));

        JsonNode message = observer.messagesOfType("website_health").get(0);
        assertThat(message.path("data").isArray()).isTrue();
        assertThat(message.path("data")).hasSize(2);
    }

    @Test
    @DisplayName("A failing observer is dropped and the others still receive the message")
    void shouldDropBrokenObserver() {
        RecordingObserver healthy = new RecordingObserver("healthy");
        RecordingObserver broken = new RecordingObserver("broken");
        broken.breakConnection();
        hub.register(healthy);
        hub.register(broken);

        int delivered = hub.broadcast(MessageType.METRICS_UPDATE, Map.of("requests_per_window", 3));

        assertThat(delivered).isEqualTo(1);
        assertThat(healthy.messages()).hasSize(1);
        assertThat(hub.observerCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Registering the same id replaces the observer; unregister removes it")
    void shouldReplaceAndUnregister() {
        RecordingObserver first = new RecordingObserver("same");
        RecordingObserver second = new RecordingObserver("same");
        hub.register(first);
        hub.register(second);

        hub.broadcast(MessageType.METRICS_UPDATE, Map.of());
        assertThat(first.messages()).isEmpty();
        assertThat(second.messages()).hasSize(1);

        hub.unregister("same");
        hub.unregister("unknown");
        hub.unregister(null);
        assertThat(hub.observerCount()).isZero();
        assertThat(hub.broadcast(MessageType.METRICS_UPDATE, Map.of())).isZero();
    }

    @Test
    @DisplayName("An unserializable body is not broadcast")
    void shouldSkipUnserializableBody() {
        RecordingObserver observer = new RecordingObserver("a");
        hub.register(observer);

        assertThat(hub.broadcast(MessageType.ATTACK_DETECTED, new Object())).isZero();
        assertThat(observer.messages()).isEmpty();
    }
}
