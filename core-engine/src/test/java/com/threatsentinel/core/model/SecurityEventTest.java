package com.threatsentinel.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatsentinel.core.json.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SecurityEvent}.
 */
class SecurityEventTest {

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    @Test
    @DisplayName("Should read the wire format and ignore unknown properties")
    void shouldDeserialize() throws Exception {
        SecurityEvent event = mapper.readValue("""
                {"event_type": "payment", "user_id": "alice", "source_ip": "10.0.0.5",
                 "data": {"amount": 12.5, "currency": "EUR"}, "extra": true}
                """, SecurityEvent.class);

        assertThat(event.getEventType()).isEqualTo("payment");
        assertThat(event.getUserId()).isEqualTo("alice");
        assertThat(event.getNumericField("amount")).contains(12.5);
        assertThat(event.getStringField("currency")).contains("EUR");
    }

    @Test
    @DisplayName("Should accept 'payload' as an alias of 'data'")
    void shouldAcceptPayloadAlias() throws Exception {
        SecurityEvent event = mapper.readValue(
                "{\"event_type\": \"login\", \"payload\": {\"username\": \"bob\"}}", SecurityEvent.class);

        assertThat(event.getStringField("username")).contains("bob");
    }

    @Test
    @DisplayName("Should resolve top-level attributes before payload keys")
    void shouldResolveAttributes() {
        SecurityEvent event = SecurityEvent.builder()
                .eventType("login")
                .sourceIp("10.0.0.1")
                .sessionId("s-1")
                .field("source_ip", "spoofed")
                .field("card_bin", "411111")
                .build();

        assertThat(event.resolve("source_ip")).contains("10.0.0.1");
        assertThat(event.resolve("session_id")).contains("s-1");
        assertThat(event.resolve("card_bin")).contains("411111");
        assertThat(event.resolve("user_id")).isEmpty();
    }

    @Test
    @DisplayName("Should not coerce non-numeric strings")
    void shouldRejectNonNumeric() {
        SecurityEvent event = SecurityEvent.builder().eventType("payment").field("amount", "lots").build();

        assertThat(event.getNumericField("amount")).isEmpty();
    }
}
