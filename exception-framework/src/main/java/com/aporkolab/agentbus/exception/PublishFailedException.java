package com.aporkolab.agentbus.exception;

/**
 * The message transport did not accept a publish.
 */
public class PublishFailedException extends MessagingException {

    private final String routingKey;

    public PublishFailedException(String routingKey, Throwable cause) {
        super("PUBLISH_FAILED",
                String.format("Publish to '%s' failed: %s", routingKey, cause != null ? cause.getMessage() : "unknown"),
                cause);
        this.routingKey = routingKey;
        with("routingKey", routingKey);
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
