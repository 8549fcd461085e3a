package com.threatsentinel.core.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threatsentinel.core.json.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans typed messages out to every registered {@link Observer}.
 *
 * <p>
 * A message is serialized once as {@code {"type": ..., <body fields>}}. If
 * serialization fails nothing is sent. Delivery iterates a snapshot of the
 * observers; an observer whose {@code send} throws is removed. A broadcast
 * never throws.
 * </p>
 *
 * @since 1.0.0
 */
public class BroadcastHub {

    private static final Logger LOG = LoggerFactory.getLogger(BroadcastHub.class);

    private final Map<String, Observer> observers = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    public BroadcastHub() {
        this(JsonSupport.newObjectMapper());
    }

    public BroadcastHub(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    /**
     * @param observer observer to add; replaces one with the same id
     */
    public void register(Observer observer) {
        Objects.requireNonNull(observer, "Observer must not be null");
        observers.put(observer.id(), observer);
        LOG.info("Observer {} connected ({} active)", observer.id(), observers.size());
    }

    /**
     * @param observerId id of the observer to remove
     */
    public void unregister(String observerId) {
        if (observerId != null && observers.remove(observerId) != null) {
            LOG.info("Observer {} disconnected ({} active)", observerId, observers.size());
        }
    }

    public int observerCount() {
        return observers.size();
    }

    /**
     * Serialize and deliver one message.
     *
     * @param type message type
     * @param body bean or map whose fields are merged into the envelope; a
     *             non-object body is placed under {@code data}
     * @return number of observers that received the message
     */
    public int broadcast(MessageType type, Object body) {
        Objects.requireNonNull(type, "MessageType must not be null");
        String message;
        try {
            message = serialize(type, body);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.error("Failed to serialize {} message, not broadcasting: {}", type.wireName(), e.getMessage(), e);
            return 0;
        }

        List<Observer> snapshot = new ArrayList<>(observers.values());
        int delivered = 0;
        for (Observer observer : snapshot) {
            try {
                observer.send(message);
                delivered++;
            } catch (Exception e) {
                LOG.warn("Delivery to observer {} failed, removing it: {}", observer.id(), e.getMessage());
                observers.remove(observer.id(), observer);
            }
        }
        LOG.trace("Broadcast {} to {}/{} observer(s)", type.wireName(), delivered, snapshot.size());
        return delivered;
    }

    String serialize(MessageType type, Object body) throws JsonProcessingException {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", type.wireName());
        if (body != null) {
            JsonNode tree = mapper.valueToTree(body);
            if (tree.isObject()) {
                tree.fields().forEachRemaining(e -> {
                    if (!"type".equals(e.getKey())) {
                        envelope.set(e.getKey(), e.getValue());
                    }
                });
            } else {
                envelope.set("data", tree);
            }
        }
        return mapper.writeValueAsString(envelope);
    }
}
