package com.threatsentinel.core.simulation;

import com.threatsentinel.core.broadcast.BroadcastHub;
import com.threatsentinel.core.broadcast.MessageType;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.runtime.TaskSupervisor;
import com.threatsentinel.core.service.SubmissionResult;
import com.threatsentinel.core.service.ThreatSentinelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Replays harmless attack samples through {@link ThreatSentinelService} so the
 * whole detection path can be exercised from a dashboard.
 *
 * <p>
 * Progress is broadcast as {@code simulation_status} with status
 * {@code running}, then {@code completed} or {@code failed}. Only one run can
 * be active at a time.
 * </p>
 *
 * @since 1.0.0
 */
public class AttackSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(AttackSimulator.class);

    /** One family of sample attacks. */
    public static final class Template {
        private final String name;
        private final String displayName;
        private final String eventType;
        private final List<Map<String, Object>> payloads;

        Template(String name, String displayName, String eventType, List<Map<String, Object>> payloads) {
            this.name = name;
            this.displayName = displayName;
            this.eventType = eventType;
            this.payloads = payloads;
        }

        public String getName() {
            return name;
        }

        public String getDisplayName() {
            return displayName;
        }

        public String getEventType() {
            return eventType;
        }

        public List<Map<String, Object>> getPayloads() {
            return payloads;
        }
    }

    private final ThreatSentinelService service;
    private final BroadcastHub hub;
    private final TaskSupervisor supervisor;
    private final Random random;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AttackSimulator(ThreatSentinelService service, BroadcastHub hub, TaskSupervisor supervisor) {
        this(service, hub, supervisor, new Random());
    }

    AttackSimulator(ThreatSentinelService service, BroadcastHub hub, TaskSupervisor supervisor, Random random) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.hub = Objects.requireNonNull(hub, "hub must not be null");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Schedule a run in the background.
     *
     * @return {@code false} if a run is already in progress
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            LOG.info("Attack simulation already running");
            return false;
        }
        try {
            supervisor.submit("attack-simulation", () -> {
                try {
                    run();
                } finally {
                    running.set(false);
                }
            });
        } catch (IllegalStateException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    /**
     * Submit every sample and broadcast the outcome.
     *
     * @return count of submissions per result status
     */
    public Map<SubmissionResult.Status, Integer> run() {
        status("running", "Attack simulation initiated...");
        Map<SubmissionResult.Status, Integer> outcomes = new EnumMap<>(SubmissionResult.Status.class);
        try {
            for (Template template : templates()) {
                // One source per family so rate rules see a burst.
                String sourceIp = "192.168.1." + (50 + random.nextInt(101));
                for (Map<String, Object> payload : template.getPayloads()) {
                    SecurityEvent event = SecurityEvent.builder()
                            .eventType(template.getEventType())
                            .payload(payload)
                            .sourceIp(sourceIp)
                            .userAgent("EthicalSim/1." + random.nextInt(3))
                            .build();
                    SubmissionResult result = service.submitEvent(event);
                    outcomes.merge(result.getStatus(), 1, Integer::sum);
                    LOG.debug("Simulated {} -> {}", template.getName(), result.getStatus());
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Attack simulation failed: {}", e.getMessage(), e);
            status("failed", "Simulation failed: " + e.getMessage());
            return outcomes;
        }
        LOG.info("Attack simulation completed: {}", outcomes);
        status("completed", "Simulation finished successfully: " + outcomes);
        return outcomes;
    }

    private void status(String status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("message", message);
        hub.broadcast(MessageType.SIMULATION_STATUS, body);
    }

    /**
     * @return the sample attacks, in submission order
     */
    public List<Template> templates() {
        return List.of(
                new Template("sqli", "SQL Injection", "simulated_sql_injection", List.of(
                        Map.of("username", "admin' OR '1'='1--", "password", "pw"),
                        Map.of("query", "'; SELECT pg_sleep(2); --"),
                        Map.of("id", "1 UNION SELECT null, version(), null--"))),
                new Template("xss", "XSS", "simulated_xss", List.of(
                        Map.of("comment", "<script>console.log('SimulatedXSS')</script>"),
                        Map.of("search", "\"><img src=x onerror=console.error('SimulatedXSS')>"),
                        Map.of("profile", "javascript:console.warn('SimulatedXSS')"))),
                new Template("payment", "Payment Anomaly", "simulated_payment_anomaly", List.of(
                        Map.of("card_number", "4242-4242-4242-" + (1000 + random.nextInt(9000)),
                                "expiry_date", "12/28",
                                "amount", String.format(Locale.ROOT, "%.2f", 500 + random.nextDouble() * 1500),
                                "currency", "USD"),
                        Map.of("payment_token", "tok_" + Long.toHexString(random.nextLong()),
                                "amount", "1.00", "currency", "EUR"))),
                new Template("card_testing", "Card Testing", "payment_failure", List.of(
                        Map.of("card_bin", "411111", "reason", "Insufficient Funds"),
                        Map.of("card_bin", "510510", "reason", "Invalid CVV"),
                        Map.of("card_bin", "400000", "reason", "Do Not Honor"),
                        Map.of("card_bin", "411111", "reason", "Expired Card"),
                        Map.of("card_bin", "555555", "reason", "Generic Decline"))));
    }

    public boolean isRunning() {
        return running.get();
    }
}
