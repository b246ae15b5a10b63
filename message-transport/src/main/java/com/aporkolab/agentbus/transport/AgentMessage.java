package com.aporkolab.agentbus.transport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unit of agent communication: an envelope, an opaque payload and a mutable metadata map.
 * 
 * The metadata map is shared state between the transport and the retry machinery
 * ({@link MessageMetadata} lists the keys in use). Everything else is treated as read-only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentMessage {

    @JsonProperty("envelope")
    private MessageEnvelope envelope;
    @JsonProperty("payload")
    private Map<String, Object> payload;
    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    private AgentMessage() {
        this.payload = new LinkedHashMap<>();
        this.metadata = new LinkedHashMap<>();
    }

    public AgentMessage(MessageEnvelope envelope, Map<String, Object> payload, Map<String, Object> metadata) {
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public MessageEnvelope getEnvelope() {
        return envelope;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public String getId() {
        return envelope != null ? envelope.getId() : null;
    }

    /**
     * Deep copy of payload and metadata. Nested maps and lists are copied,
     * leaf values are shared.
     */
    public AgentMessage copy() {
        AgentMessage copy = new AgentMessage();
        copy.envelope = envelope != null ? envelope.toBuilder().build() : null;
        copy.payload = deepCopyMap(payload);
        copy.metadata = deepCopyMap(metadata);
        return copy;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Copies any map into a string-keyed one; keys are converted with {@link String#valueOf(Object)}.
     */
    static Map<String, Object> deepCopyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(String.valueOf(key), deepCopy(value)));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "AgentMessage{envelope=" + envelope + ", metadata=" + metadata + "}";
    }
}
