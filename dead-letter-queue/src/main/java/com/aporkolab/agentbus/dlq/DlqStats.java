package com.aporkolab.agentbus.dlq;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running counters of a {@link DeadLetterQueueProcessor}.
 *
 * @param errorTypes ingested entries per error kind, in first-seen order
 */
public record DlqStats(
        @JsonProperty("total_processed") long totalProcessed,
        @JsonProperty("retry_attempts") long retryAttempts,
        @JsonProperty("permanent_failures") long permanentFailures,
        @JsonProperty("error_types") Map<String, Long> errorTypes
) {}
