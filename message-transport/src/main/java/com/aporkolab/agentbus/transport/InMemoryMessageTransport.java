package com.aporkolab.agentbus.transport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.agentbus.logging.MessageContext;

/**
 * In-process {@link MessageTransport} with topic-exchange routing.
 * 
 * Design decisions:
 * - Delivery is synchronous on the publishing thread, so a publish completes after every
 *   matching handler has run
 * - Every handler receives its own copy of the message
 * - Every published message is recorded for inspection
 * - Handler failures are routed to a {@link HandlerFailureListener}, typically the error handler
 */
public class InMemoryMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageTransport.class);

    private final List<Binding> bindings = new CopyOnWriteArrayList<>();
    private final List<AgentMessage> published = new CopyOnWriteArrayList<>();
    private volatile HandlerFailureListener failureListener;

    @Override
    public CompletableFuture<String> publish(PublishRequest request) {
        String messageId = UUID.randomUUID().toString();
        Instant now = Instant.now();

        MessageEnvelope envelope = MessageEnvelope.builder()
                .id(messageId)
                .senderId(request.getSenderId())
                .recipientId(request.getRecipientId())
                .messageType(request.getMessageType())
                .priority(request.getPriority())
                .createdAt(now)
                .correlationId(request.getCorrelationId())
                .replyTo(request.getReplyTo())
                .build();

        Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
        metadata.put(MessageMetadata.ROUTING_KEY, request.getRoutingKey());
        metadata.put(MessageMetadata.PUBLISHED_AT, now.toString());

        AgentMessage message = new AgentMessage(envelope, request.getPayload(), metadata);
        published.add(message);
        log.debug("Published message {} to {}", messageId, request.getRoutingKey());

        dispatch(request.getRoutingKey(), message);
        return CompletableFuture.completedFuture(messageId);
    }

    @Override
    public CompletableFuture<Void> registerHandler(String agentId, MessageHandler handler,
                                                   List<String> routingKeys, String queueName) {
        bindings.add(new Binding(agentId, queueName, handler, List.copyOf(routingKeys)));
        log.info("Registered handler for {} on queue {} with bindings {}", agentId, queueName, routingKeys);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Route handler failures to {@code listener} instead of only logging them.
     */
    public void onHandlerFailure(HandlerFailureListener listener) {
        this.failureListener = listener;
    }

    public List<AgentMessage> getPublishedMessages() {
        return List.copyOf(published);
    }

    public List<AgentMessage> getPublishedMessages(String routingKey) {
        return published.stream()
                .filter(m -> routingKey.equals(MessageMetadata.routingKey(m)))
                .collect(Collectors.toList());
    }

    public List<String> getQueueNames() {
        List<String> names = new ArrayList<>();
        for (Binding binding : bindings) {
            names.add(binding.queueName());
        }
        return names;
    }

    public void clearPublishedMessages() {
        published.clear();
    }

    private void dispatch(String routingKey, AgentMessage message) {
        for (Binding binding : bindings) {
            if (binding.accepts(routingKey)) {
                deliver(binding, message.copy());
            }
        }
    }

    private void deliver(Binding binding, AgentMessage message) {
        try (MessageContext ctx = MessageContext.open(message.getId())
                .withOrigin(binding.agentId())
                .withRoutingKey(MessageMetadata.routingKey(message))) {

            Optional<AgentMessage> response;
            try {
                response = binding.handler().handleMessage(message);
            } catch (Exception e) {
                HandlerFailureListener listener = failureListener;
                if (listener == null) {
                    log.error("Handler {} failed on message {}: {}", binding.agentId(), message.getId(), e.getMessage(), e);
                    return;
                }
                listener.onFailure(binding.agentId(), message, e);
                return;
            }

            response.ifPresent(reply -> sendReply(binding.agentId(), message, reply));
        }
    }

    private void sendReply(String agentId, AgentMessage request, AgentMessage reply) {
        String replyTo = request.getEnvelope().getReplyTo();
        if (replyTo == null) {
            return;
        }
        publish(PublishRequest.builder()
                .routingKey(replyTo)
                .payload(reply.getPayload())
                .senderId(agentId)
                .recipientId(request.getEnvelope().getSenderIdOrDefault(PublishRequest.DEFAULT_RECIPIENT))
                .messageType("response")
                .correlationId(request.getEnvelope().getCorrelationId())
                .build());
    }

    private record Binding(String agentId, String queueName, MessageHandler handler, List<String> patterns) {

        boolean accepts(String routingKey) {
            for (String pattern : patterns) {
                if (TopicPattern.matches(pattern, routingKey)) {
                    return true;
                }
            }
            return false;
        }
    }
}
