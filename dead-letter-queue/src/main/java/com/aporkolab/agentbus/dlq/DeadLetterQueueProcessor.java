package com.aporkolab.agentbus.dlq;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.agentbus.errors.DlqEntry;
import com.aporkolab.agentbus.errors.ErrorHandler;
import com.aporkolab.agentbus.errors.ErrorKind;
import com.aporkolab.agentbus.errors.ErrorSnapshot;
import com.aporkolab.agentbus.exception.ValidationException;
import com.aporkolab.agentbus.logging.MessageContext;
import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.MessageEnvelope;
import com.aporkolab.agentbus.transport.MessageMetadata;
import com.aporkolab.agentbus.transport.MessageTransport;
import com.aporkolab.agentbus.transport.PublishRequest;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-memory dead-letter store with statistics, manual replay and age-based pruning.
 * 
 * Design decisions:
 * - Entries are kept in arrival order; nothing is evicted except by {@link #prune(int)}
 * - Ingestion is at-least-once: a redelivered entry is stored and counted again
 * - State is guarded by this instance's monitor; replay publishes outside it
 */
public class DeadLetterQueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueProcessor.class);

    public static final String DEFAULT_AGENT_ID = "dlq_processor";
    public static final String DEFAULT_QUEUE_NAME = "dlq.processor";
    public static final List<String> ROUTING_KEYS = List.of("failed.*", "dlx.*");
    public static final String MANUAL_RETRY_ROUTING_KEY = "retry.manual";
    private static final int TOP_ERRORS_LIMIT = 5;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final MessageTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final List<DlqEntry> entries = new ArrayList<>();
    private final Map<String, Long> errorTypes = new LinkedHashMap<>();
    private long totalProcessed;
    private long retryAttempts;
    private long permanentFailures;

    public DeadLetterQueueProcessor(MessageTransport transport) {
        this(transport, ErrorHandler.defaultObjectMapper(), Clock.systemUTC());
    }

    public DeadLetterQueueProcessor(MessageTransport transport, ObjectMapper objectMapper, Clock clock) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== MONITORING ====================

    public CompletableFuture<Void> startMonitoring() {
        return startMonitoring(DEFAULT_AGENT_ID, DEFAULT_QUEUE_NAME);
    }

    public CompletableFuture<Void> startMonitoring(String agentId) {
        return startMonitoring(agentId, DEFAULT_QUEUE_NAME);
    }

    /**
     * Subscribe to {@code failed.*} and {@code dlx.*} through the transport.
     */
    public CompletableFuture<Void> startMonitoring(String agentId, String queueName) {
        log.info("Starting DLQ monitoring as {} on queue {}", agentId, queueName);
        return transport.registerHandler(agentId, new DlqMessageHandler(this), ROUTING_KEYS, queueName);
    }

    // ==================== INGESTION ====================

    /**
     * Decode a {@code dlq_entry} payload and store it.
     *
     * @throws ValidationException if the payload does not describe a DLQ entry
     */
    public void ingest(Map<String, Object> payload) {
        DlqEntry entry;
        try {
            entry = DlqEntry.fromPayload(payload, objectMapper);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("payload", "not a DLQ entry: " + e.getMessage(), e);
        }
        if (entry.originalMessage() == null) {
            throw new ValidationException("original_message", "missing from DLQ entry");
        }
        ingest(entry);
    }

    public void ingest(DlqEntry entry) {
        DlqEntry stored = entry.dlqTimestamp() != null
                ? entry
                : new DlqEntry(entry.originalMessage(), entry.errorInfo(), clock.instant());
        ErrorSnapshot errorInfo = stored.errorInfo();
        String errorType = errorInfo != null ? errorInfo.errorTypeOrUnknown() : ErrorKind.UNKNOWN.value();

        try (MessageContext ctx = MessageContext.open(stored.originalMessage() != null ? stored.originalMessage().getId() : null)
                .withOrigin(errorInfo != null ? errorInfo.agentId() : null)
                .withErrorKind(errorType)) {
            synchronized (this) {
                entries.add(stored);
                totalProcessed++;
                errorTypes.merge(errorType, 1L, Long::sum);
                if (errorInfo != null && errorInfo.isPermanentFailure()) {
                    permanentFailures++;
                }
            }
            log.info("Processed DLQ message with error type: {}", errorType);
        }
    }

    // ==================== REPLAY ====================

    /**
     * Re-publish the entry at {@code index} with a fresh retry budget.
     *
     * @return false if the index is out of range or the message cannot be rebuilt or published
     */
    public boolean retry(int index) {
        DlqEntry entry;
        synchronized (this) {
            if (index < 0 || index >= entries.size()) {
                log.error("Invalid message index: {}", index);
                return false;
            }
            entry = entries.get(index);
        }

        try {
            if (entry.originalMessage() == null || entry.originalMessage().getEnvelope() == null) {
                throw new ValidationException("original_message", "missing from DLQ entry " + index);
            }
            AgentMessage message = entry.originalMessage().copy();
            message.getMetadata().put(MessageMetadata.RETRY_COUNT, 0);
            message.getMetadata().remove(MessageMetadata.ERROR_HISTORY);

            String routingKey = MessageMetadata.routingKey(message);
            if (routingKey == null || routingKey.isBlank()) {
                routingKey = MANUAL_RETRY_ROUTING_KEY;
            }

            transport.publish(replayRequest(message, routingKey)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to retry DLQ message {}: {}", index, cause.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to retry DLQ message {}: {}", index, e.getMessage());
            return false;
        }

        synchronized (this) {
            retryAttempts++;
        }
        log.info("Successfully retried DLQ message {}", index);
        return true;
    }

    private static PublishRequest replayRequest(AgentMessage message, String routingKey) {
        MessageEnvelope envelope = message.getEnvelope();
        return PublishRequest.builder()
                .routingKey(routingKey)
                .payload(message.getPayload())
                .senderId(envelope.getSenderIdOrDefault(DEFAULT_AGENT_ID))
                .recipientId(envelope.getRecipientIdOrDefault(PublishRequest.DEFAULT_RECIPIENT))
                .messageType(envelope.getMessageTypeOrDefault(ErrorHandler.RETRY_MESSAGE_TYPE))
                .priority(envelope.getPriorityOrDefault(PublishRequest.DEFAULT_PRIORITY))
                .correlationId(envelope.getCorrelationId())
                .replyTo(envelope.getReplyTo())
                .metadata(message.getMetadata())
                .build();
    }

    // ==================== REPORTING ====================

    public synchronized DlqReport report() {
        Instant now = clock.instant();
        Instant recentCutoff = now.minus(RECENT_WINDOW);
        int recent = 0;
        for (DlqEntry entry : entries) {
            if (entry.dlqTimestamp().isAfter(recentCutoff)) {
                recent++;
            }
        }

        List<DlqReport.ErrorTypeCount> topErrors = errorTypes.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_ERRORS_LIMIT)
                .map(e -> new DlqReport.ErrorTypeCount(e.getKey(), e.getValue()))
                .toList();

        return new DlqReport(entries.size(), recent, getStats(), topErrors, now);
    }

    public synchronized DlqStats getStats() {
        return new DlqStats(totalProcessed, retryAttempts, permanentFailures, Collections.unmodifiableMap(new LinkedHashMap<>(errorTypes)));
    }

    // ==================== PRUNING ====================

    /**
     * Remove entries dead-lettered more than {@code olderThanDays} days ago. Counters are kept.
     *
     * @return number of entries removed
     */
    public synchronized int prune(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must not be negative");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        int removed = 0;
        Iterator<DlqEntry> it = entries.iterator();
        while (it.hasNext()) {
            if (!it.next().dlqTimestamp().isAfter(cutoff)) {
                it.remove();
                removed++;
            }
        }
        log.info("Cleared {} old DLQ messages", removed);
        return removed;
    }

    // ==================== ACCESS ====================

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<DlqEntry> getEntries() {
        return List.copyOf(entries);
    }
}
