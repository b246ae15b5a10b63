package com.aporkolab.agentbus.errors;

import java.time.Duration;

/**
 * Delay calculation for {@link RetryStrategy#CUSTOM} policies, registered per origin and error kind.
 */
@FunctionalInterface
public interface CustomRetryHandler {

    Duration computeDelay(ErrorRecord record, RetryPolicy policy);
}
