package com.aporkolab.agentbus.errors;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Handle on a delayed re-publish.
 * 
 * {@link #result()} completes with the id of the re-published message, exceptionally with a
 * {@link com.aporkolab.agentbus.exception.PublishFailedException} if the transport rejected it,
 * or with a {@link CancellationException} after {@link #cancel()}.
 */
public class ScheduledRetry {

    private final CompletableFuture<String> result;
    private final ScheduledFuture<?> task;
    private final Duration delay;
    private final int retryCount;
    private final String routingKey;

    ScheduledRetry(CompletableFuture<String> result, ScheduledFuture<?> task, Duration delay,
                   int retryCount, String routingKey) {
        this.result = result;
        this.task = task;
        this.delay = delay;
        this.retryCount = retryCount;
        this.routingKey = routingKey;
    }

    public CompletableFuture<String> result() {
        return result;
    }

    public Duration getDelay() {
        return delay;
    }

    /**
     * Retry count carried by the re-published message.
     */
    public int getRetryCount() {
        return retryCount;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    /**
     * Abandon the retry if it has not started publishing yet.
     *
     * @return true if the retry will not be published
     */
    public boolean cancel() {
        if (task.cancel(false)) {
            result.completeExceptionally(new CancellationException("Retry to " + routingKey + " cancelled"));
            return true;
        }
        return false;
    }

    public boolean isDone() {
        return result.isDone();
    }

    @Override
    public String toString() {
        return String.format("ScheduledRetry{routingKey=%s, retryCount=%d, delay=%s, done=%s}",
                routingKey, retryCount, delay, result.isDone());
    }
}
