package com.aporkolab.agentbus.errors;

import java.time.Instant;
import java.util.Map;

import com.aporkolab.agentbus.transport.AgentMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Dead-lettered message with the failure that put it there.
 * 
 * Travels as the payload of a {@code dlq_entry} message:
 * <pre>
 * {
 *   "original_message": { "envelope": {...}, "payload": {...}, "metadata": {...} },
 *   "error_info": { "error_type": "network", "error_message": "...", "retry_count": 3, ... },
 *   "dlq_timestamp": "2024-01-01T00:00:00Z"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DlqEntry(
        @JsonProperty("original_message") AgentMessage originalMessage,
        @JsonProperty("error_info") ErrorSnapshot errorInfo,
        @JsonProperty("dlq_timestamp") Instant dlqTimestamp
) {

    public static final String MESSAGE_TYPE = "dlq_entry";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    public static DlqEntry of(ErrorRecord record, Instant dlqTimestamp) {
        return new DlqEntry(record.getOriginalMessage(), ErrorSnapshot.of(record), dlqTimestamp);
    }

    public Map<String, Object> toPayload(ObjectMapper objectMapper) {
        return objectMapper.convertValue(this, PAYLOAD_TYPE);
    }

    /**
     * @throws IllegalArgumentException if the payload does not describe a DLQ entry
     */
    public static DlqEntry fromPayload(Map<String, Object> payload, ObjectMapper objectMapper) {
        return objectMapper.convertValue(payload, DlqEntry.class);
    }
}
