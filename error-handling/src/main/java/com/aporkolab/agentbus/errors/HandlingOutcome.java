package com.aporkolab.agentbus.errors;

import java.util.Optional;

/**
 * What {@link ErrorHandler#process} did with a failure: scheduled a retry or dead-lettered the message.
 */
public class HandlingOutcome {

    private final ErrorRecord record;
    private final ScheduledRetry retry;
    private final String dlqMessageId;

    private HandlingOutcome(ErrorRecord record, ScheduledRetry retry, String dlqMessageId) {
        this.record = record;
        this.retry = retry;
        this.dlqMessageId = dlqMessageId;
    }

    static HandlingOutcome retryScheduled(ErrorRecord record, ScheduledRetry retry) {
        return new HandlingOutcome(record, retry, null);
    }

    static HandlingOutcome deadLettered(ErrorRecord record, String dlqMessageId) {
        return new HandlingOutcome(record, null, dlqMessageId);
    }

    public ErrorRecord getRecord() {
        return record;
    }

    public ErrorKind getKind() {
        return record.getKind();
    }

    public boolean isRetryScheduled() {
        return retry != null;
    }

    public Optional<ScheduledRetry> getRetry() {
        return Optional.ofNullable(retry);
    }

    /**
     * Id of the published {@code dlq_entry} message; empty when a retry was scheduled.
     */
    public Optional<String> getDlqMessageId() {
        return Optional.ofNullable(dlqMessageId);
    }
}
