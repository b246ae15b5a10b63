package com.aporkolab.agentbus.dlq;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time summary of the dead-letter store.
 */
public record DlqReport(
        @JsonProperty("total_dlq_messages") int totalDlqMessages,
        @JsonProperty("recent_24h") int recent24h,
        @JsonProperty("processing_stats") DlqStats processingStats,
        @JsonProperty("top_errors") List<ErrorTypeCount> topErrors,
        @JsonProperty("report_timestamp") Instant reportTimestamp
) {

    public record ErrorTypeCount(
            @JsonProperty("error_type") String errorType,
            @JsonProperty("count") long count
    ) {}
}
