package com.aporkolab.agentbus.errors;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.agentbus.exception.PublishFailedException;
import com.aporkolab.agentbus.logging.MessageContext;
import com.aporkolab.agentbus.routing.RoutingKeys;
import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.MessageEnvelope;
import com.aporkolab.agentbus.transport.MessageMetadata;
import com.aporkolab.agentbus.transport.MessageTransport;
import com.aporkolab.agentbus.transport.PublishRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Decides between retry and dead-lettering for a failed message.
 * 
 * Design decisions:
 * - Retries are re-published after a delay on a scheduler thread; {@link #handle} never blocks on them
 * - The retried copy carries retry_count + 1 and the failure appended to error_history
 * - Validation and authentication failures are dead-lettered whatever the policy allows
 * - A failed DLQ publish propagates to the caller as {@link PublishFailedException}
 * - No cap on outstanding retries; {@link #outstandingRetries()} exposes the count
 * 
 * Usage:
 * <pre>
 * ErrorHandler handler = ErrorHandler.builder()
 *     .transport(transport)
 *     .defaultPolicy(RetryPolicy.builder().maxRetries(5).build())
 *     .build();
 *
 * try {
 *     process(message);
 * } catch (Exception e) {
 *     handler.handle(e, message, "backend_1");
 * }
 * </pre>
 */
public class ErrorHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    public static final String SENDER_ID = "error_handler";
    public static final String DLQ_RECIPIENT = "dlq_processor";
    public static final String DLQ_ROUTING_PATTERN = "failed.{origin_id}";
    public static final String DEFAULT_RETRY_ROUTING_KEY = "retry.default";
    public static final String RETRY_MESSAGE_TYPE = "retry";
    public static final int DLQ_PRIORITY = 1;

    private static final int MAX_STACK_TRACE_LENGTH = 2000;

    private final MessageTransport transport;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final RetryPolicy defaultPolicy;
    private final ErrorClassifier classifier;
    private final RetryDelayCalculator delayCalculator;
    private final Clock clock;

    private final Map<ErrorKind, List<ErrorCallback>> callbacks = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<String>> pendingRetries = ConcurrentHashMap.newKeySet();
    private final AtomicLong retriesScheduled = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    private ErrorHandler(Builder builder) {
        this.transport = builder.transport;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper();
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : defaultScheduler();
        this.defaultPolicy = builder.defaultPolicy;
        this.classifier = builder.classifier;
        this.delayCalculator = builder.delayCalculator != null
                ? builder.delayCalculator
                : new RetryDelayCalculator(builder.random != null ? builder.random : new Random());
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mapper for DLQ payloads: JSR-310 types written as ISO-8601 strings.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private static ScheduledExecutorService defaultScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "agentbus-retry-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== HANDLING ====================

    /**
     * Handle a processing failure with the default policy.
     *
     * @return true if a retry was scheduled, false if the message was dead-lettered
     */
    public boolean handle(Throwable error, AgentMessage message, String originId) {
        return process(error, message, originId, null).isRetryScheduled();
    }

    public boolean handle(Throwable error, AgentMessage message, String originId, RetryPolicy policy) {
        return process(error, message, originId, policy).isRetryScheduled();
    }

    /**
     * Same decision as {@link #handle}, returning the scheduled retry or the DLQ publish result.
     *
     * @throws PublishFailedException if the DLQ publish fails or the retry cannot be scheduled
     */
    public HandlingOutcome process(Throwable error, AgentMessage message, String originId, RetryPolicy policy) {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(originId, "originId");
        RetryPolicy effective = policy != null ? policy : defaultPolicy;

        try (MessageContext ctx = MessageContext.open(message.getId())
                .withOrigin(originId)
                .withRoutingKey(MessageMetadata.routingKey(message))) {

            ErrorKind kind = classifier.classify(error);
            ctx.withErrorKind(kind.value());

            ErrorRecord record = ErrorRecord.builder()
                    .kind(kind)
                    .messageText(describe(error))
                    .occurredAt(clock.instant())
                    .originId(originId)
                    .originalMessage(message)
                    .retryCount(MessageMetadata.retryCount(message))
                    .maxRetries(effective.getMaxRetries())
                    .strategy(effective.getStrategy())
                    .trace(stackTrace(error))
                    .build();

            log.error("Error processing message {}: {} - {}", idOf(message), kind.value(), record.getMessageText());
            notifyCallbacks(record);

            if (effective.allowsRetry(kind, record.getRetryCount())) {
                ScheduledRetry retry = scheduleRetry(record, effective);
                return HandlingOutcome.retryScheduled(record, retry);
            }
            String dlqMessageId = sendToDlq(record);
            return HandlingOutcome.deadLettered(record, dlqMessageId);
        }
    }

    // ==================== RETRY ====================

    private ScheduledRetry scheduleRetry(ErrorRecord record, RetryPolicy policy) {
        Duration delay = delayCalculator.calculate(record, policy);
        AgentMessage original = record.getOriginalMessage();
        int nextRetryCount = record.getRetryCount() + 1;

        AgentMessage retryMessage = original.copy();
        retryMessage.getMetadata().put(MessageMetadata.RETRY_COUNT, nextRetryCount);
        retryMessage.getMetadata().put(MessageMetadata.RETRY_DELAY, RetryDelayCalculator.toSeconds(delay));
        MessageMetadata.errorHistory(retryMessage).add(record.toHistoryEntry());

        String routingKey = MessageMetadata.routingKey(retryMessage);
        if (routingKey == null || routingKey.isBlank()) {
            routingKey = DEFAULT_RETRY_ROUTING_KEY;
        }
        PublishRequest request = retryRequest(retryMessage, routingKey);

        log.info("Scheduling retry {}/{} for message {} in {} seconds",
                nextRetryCount, policy.getMaxRetries(), idOf(original),
                String.format("%.2f", RetryDelayCalculator.toSeconds(delay)));

        CompletableFuture<String> result = new CompletableFuture<>();
        pendingRetries.add(result);
        result.whenComplete((id, ex) -> pendingRetries.remove(result));

        ScheduledFuture<?> task;
        try {
            String key = routingKey;
            task = scheduler.schedule(
                    MessageContext.wrap(() -> publishRetry(request, key, result)),
                    delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            PublishFailedException failure = new PublishFailedException(routingKey, e);
            result.completeExceptionally(failure);
            throw failure;
        }

        retriesScheduled.incrementAndGet();
        return new ScheduledRetry(result, task, delay, nextRetryCount, routingKey);
    }

    private PublishRequest retryRequest(AgentMessage message, String routingKey) {
        MessageEnvelope envelope = message.getEnvelope();
        return PublishRequest.builder()
                .routingKey(routingKey)
                .payload(message.getPayload())
                .senderId(envelope.getSenderIdOrDefault(SENDER_ID))
                .recipientId(envelope.getRecipientIdOrDefault(PublishRequest.DEFAULT_RECIPIENT))
                .messageType(envelope.getMessageTypeOrDefault(RETRY_MESSAGE_TYPE))
                .priority(envelope.getPriorityOrDefault(PublishRequest.DEFAULT_PRIORITY))
                .correlationId(envelope.getCorrelationId())
                .replyTo(envelope.getReplyTo())
                .metadata(message.getMetadata())
                .build();
    }

    private void publishRetry(PublishRequest request, String routingKey, CompletableFuture<String> result) {
        if (result.isDone()) {
            return;
        }
        try {
            transport.publish(request).whenComplete((messageId, ex) -> {
                if (ex != null) {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    log.error("Retry publish to {} failed: {}", routingKey, cause.getMessage());
                    result.completeExceptionally(new PublishFailedException(routingKey, cause));
                } else {
                    log.debug("Retry published to {} as {}", routingKey, messageId);
                    result.complete(messageId);
                }
            });
        } catch (RuntimeException e) {
            log.error("Retry publish to {} failed: {}", routingKey, e.getMessage());
            result.completeExceptionally(new PublishFailedException(routingKey, e));
        }
    }

    // ==================== DEAD LETTER ====================

    private String sendToDlq(ErrorRecord record) {
        String routingKey = RoutingKeys.format(DLQ_ROUTING_PATTERN, Map.of("origin_id", record.getOriginId()));
        DlqEntry entry = DlqEntry.of(record, clock.instant());

        PublishRequest request = PublishRequest.builder()
                .routingKey(routingKey)
                .payload(entry.toPayload(objectMapper))
                .senderId(SENDER_ID)
                .recipientId(DLQ_RECIPIENT)
                .messageType(DlqEntry.MESSAGE_TYPE)
                .priority(DLQ_PRIORITY)
                .build();

        String dlqMessageId;
        try {
            dlqMessageId = transport.publish(request).join();
        } catch (CompletionException e) {
            throw new PublishFailedException(routingKey, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            throw new PublishFailedException(routingKey, e);
        }

        deadLettered.incrementAndGet();
        log.warn("Sent message {} to DLQ after {} retries", idOf(record.getOriginalMessage()), record.getRetryCount());
        return dlqMessageId;
    }

    // ==================== REGISTRATION ====================

    public void registerCustomRetryHandler(String name, CustomRetryHandler handler) {
        delayCalculator.registerCustomHandler(name, handler);
    }

    public void registerErrorCallback(ErrorKind kind, ErrorCallback callback) {
        callbacks.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>()).add(callback);
    }

    private void notifyCallbacks(ErrorRecord record) {
        for (ErrorCallback callback : callbacks.getOrDefault(record.getKind(), List.of())) {
            try {
                callback.onError(record);
            } catch (RuntimeException e) {
                log.warn("Error callback for {} failed: {}", record.getKind().value(), e.getMessage(), e);
            }
        }
    }

    // ==================== STATE ====================

    /**
     * Retries scheduled but not yet published, failed or cancelled.
     */
    public int outstandingRetries() {
        return pendingRetries.size();
    }

    public long getRetriesScheduled() {
        return retriesScheduled.get();
    }

    public long getDeadLettered() {
        return deadLettered.get();
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Abandons pending retries and stops the scheduler if this handler created it.
     * Every outstanding {@link ScheduledRetry#result()} completes with a {@link CancellationException}.
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        int abandoned = 0;
        for (CompletableFuture<String> pending : List.copyOf(pendingRetries)) {
            if (pending.completeExceptionally(new CancellationException("Error handler closed"))) {
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.warn("Abandoned {} pending retries on close", abandoned);
        }
    }

    // ==================== HELPERS ====================

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String idOf(AgentMessage message) {
        return message.getId() != null ? message.getId() : "unknown";
    }

    private static String stackTrace(Throwable error) {
        StringBuilder sb = new StringBuilder(error.toString()).append("\n");
        for (StackTraceElement element : error.getStackTrace()) {
            if (sb.length() > MAX_STACK_TRACE_LENGTH) {
                sb.append("...(truncated)");
                break;
            }
            sb.append("\tat ").append(element).append("\n");
        }
        return sb.toString();
    }

    public static class Builder {
        private MessageTransport transport;
        private ObjectMapper objectMapper;
        private ScheduledExecutorService scheduler;
        private RetryPolicy defaultPolicy = RetryPolicy.defaults();
        private ErrorClassifier classifier = new ErrorClassifier();
        private RetryDelayCalculator delayCalculator;
        private Random random;
        private Clock clock = Clock.systemUTC();

        public Builder transport(MessageTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Executor for delayed re-publishes. When omitted the handler creates and owns a single daemon thread.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder defaultPolicy(RetryPolicy defaultPolicy) {
            this.defaultPolicy = defaultPolicy;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder delayCalculator(RetryDelayCalculator delayCalculator) {
            this.delayCalculator = delayCalculator;
            return this;
        }

        /**
         * Jitter source; ignored when a delay calculator is supplied.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ErrorHandler build() {
            if (transport == null) {
                throw new IllegalArgumentException("transport is required");
            }
            if (defaultPolicy == null || classifier == null || clock == null) {
                throw new IllegalArgumentException("defaultPolicy, classifier and clock must not be null");
            }
            return new ErrorHandler(this);
        }
    }
}
