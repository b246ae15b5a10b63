package com.aporkolab.agentbus.transport;

import java.util.Optional;

/**
 * Consumer-side capability registered with a {@link MessageTransport}.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handle an inbound message and optionally produce a response,
     * which the transport sends to the inbound envelope's reply-to address.
     */
    Optional<AgentMessage> handleMessage(AgentMessage message);
}
