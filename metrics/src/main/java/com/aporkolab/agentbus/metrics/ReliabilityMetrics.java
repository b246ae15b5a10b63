package com.aporkolab.agentbus.metrics;

import java.util.EnumMap;
import java.util.Map;

import com.aporkolab.agentbus.dlq.DeadLetterQueueProcessor;
import com.aporkolab.agentbus.errors.ErrorHandler;
import com.aporkolab.agentbus.errors.ErrorKind;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Micrometer metrics for message delivery reliability.
 * 
 * Provides the following metrics:
 * - agentbus_errors_total: Handled failures by error_kind
 * - agentbus_retries_scheduled_total: Retries scheduled by the error handler
 * - agentbus_dead_lettered_total: Messages published to the DLQ
 * - agentbus_retries_outstanding: Retries waiting to be re-published
 * - agentbus_dlq_ingested_total: Entries ingested by the DLQ processor
 * - agentbus_dlq_permanent_failures_total: Entries dead-lettered with retry budget left
 * - agentbus_dlq_replays_total: Successful manual replays
 * - agentbus_dlq_depth: Entries currently held by the DLQ processor
 */
public class ReliabilityMetrics {

    private static final String METRIC_PREFIX = "agentbus";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final Map<ErrorKind, Counter> errorCounters = new EnumMap<>(ErrorKind.class);

    public ReliabilityMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public ReliabilityMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        for (ErrorKind kind : ErrorKind.values()) {
            errorCounters.put(kind, Counter.builder(METRIC_PREFIX + "_errors_total")
                    .description("Message processing failures handled, by error kind")
                    .tags(baseTags.and("error_kind", kind.value()))
                    .register(registry));
        }
    }

    /**
     * Count every failure the handler classifies and expose its retry counters.
     */
    public ReliabilityMetrics bindTo(ErrorHandler handler) {
        for (ErrorKind kind : ErrorKind.values()) {
            Counter counter = errorCounters.get(kind);
            handler.registerErrorCallback(kind, record -> counter.increment());
        }

        FunctionCounter.builder(METRIC_PREFIX + "_retries_scheduled_total", handler, ErrorHandler::getRetriesScheduled)
                .description("Retries scheduled by the error handler")
                .tags(baseTags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + "_dead_lettered_total", handler, ErrorHandler::getDeadLettered)
                .description("Messages published to the dead letter queue")
                .tags(baseTags)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_retries_outstanding", handler, ErrorHandler::outstandingRetries)
                .description("Retries scheduled but not yet re-published")
                .tags(baseTags)
                .register(registry);
        return this;
    }

    public ReliabilityMetrics bindTo(DeadLetterQueueProcessor processor) {
        FunctionCounter.builder(METRIC_PREFIX + "_dlq_ingested_total", processor,
                        p -> p.getStats().totalProcessed())
                .description("Entries ingested by the DLQ processor")
                .tags(baseTags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + "_dlq_permanent_failures_total", processor,
                        p -> p.getStats().permanentFailures())
                .description("DLQ entries dead-lettered before exhausting their retries")
                .tags(baseTags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + "_dlq_replays_total", processor,
                        p -> p.getStats().retryAttempts())
                .description("DLQ entries manually re-published")
                .tags(baseTags)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_dlq_depth", processor, DeadLetterQueueProcessor::size)
                .description("Current number of entries held by the DLQ processor")
                .tags(baseTags)
                .register(registry);
        return this;
    }

    public double getErrorCount(ErrorKind kind) {
        return errorCounters.get(kind).count();
    }
}
