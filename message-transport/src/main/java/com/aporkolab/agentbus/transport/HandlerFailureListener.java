package com.aporkolab.agentbus.transport;

/**
 * Receives failures raised by a registered {@link MessageHandler}.
 * This is where a consumer hands a failed message to the error handling layer.
 */
@FunctionalInterface
public interface HandlerFailureListener {

    void onFailure(String agentId, AgentMessage message, Exception error);
}
