package com.aporkolab.agentbus.transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Broker-facing collaborator of the reliability layer.
 * 
 * Implementations must tolerate repeated, concurrent {@code publish} calls;
 * nothing else is assumed about their internal concurrency.
 */
public interface MessageTransport {

    /**
     * Publish a message. Completes with the id assigned to the published message.
     */
    CompletableFuture<String> publish(PublishRequest request);

    /**
     * Bind {@code handler} to every routing key pattern in {@code routingKeys}
     * through a queue named {@code queueName}.
     */
    CompletableFuture<Void> registerHandler(String agentId, MessageHandler handler,
                                            List<String> routingKeys, String queueName);
}
