package com.aporkolab.agentbus.errors;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized {@link ErrorRecord} carried inside a {@link DlqEntry}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorSnapshot(
        @JsonProperty("error_type") String errorType,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("stack_trace") String stackTrace
) {

    public static ErrorSnapshot of(ErrorRecord record) {
        return new ErrorSnapshot(
                record.getKind().value(),
                record.getMessageText(),
                record.getOccurredAt(),
                record.getOriginId(),
                record.getRetryCount(),
                record.getMaxRetries(),
                record.getTrace().orElse(null));
    }

    /**
     * Kind of the failure, {@link ErrorKind#UNKNOWN} when the producer did not record one
     * or recorded a type this layer does not know.
     */
    public ErrorKind kind() {
        return ErrorKind.fromValue(errorType);
    }

    /**
     * The {@code error_type} text exactly as the producer wrote it, {@code unknown} when absent.
     */
    @JsonIgnore
    public String errorTypeOrUnknown() {
        return errorType != null && !errorType.isBlank() ? errorType : ErrorKind.UNKNOWN.value();
    }

    /**
     * Whether the message was dead-lettered before its retry budget ran out.
     */
    @JsonIgnore
    public boolean isPermanentFailure() {
        return retryCount < maxRetries;
    }
}
