package com.aporkolab.agentbus.dlq;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.agentbus.errors.DlqEntry;
import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.MessageHandler;

/**
 * Feeds {@code dlq_entry} messages into a {@link DeadLetterQueueProcessor}. Never replies.
 */
public class DlqMessageHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(DlqMessageHandler.class);

    private final DeadLetterQueueProcessor processor;

    public DlqMessageHandler(DeadLetterQueueProcessor processor) {
        this.processor = processor;
    }

    /**
     * @throws com.aporkolab.agentbus.exception.ValidationException if a dlq_entry payload is malformed
     */
    @Override
    public Optional<AgentMessage> handleMessage(AgentMessage message) {
        String type = message.getEnvelope().getMessageType();
        if (DlqEntry.MESSAGE_TYPE.equals(type)) {
            processor.ingest(message.getPayload());
        } else {
            log.debug("Ignoring message {} of type {} on DLQ", message.getId(), type);
        }
        return Optional.empty();
    }
}
