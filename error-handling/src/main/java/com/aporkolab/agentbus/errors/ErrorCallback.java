package com.aporkolab.agentbus.errors;

/**
 * Observer notified for every handled failure of a registered kind.
 * Exceptions thrown by a callback are logged and do not affect handling.
 */
@FunctionalInterface
public interface ErrorCallback {

    void onError(ErrorRecord record);
}
