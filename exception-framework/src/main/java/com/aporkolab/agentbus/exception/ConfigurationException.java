package com.aporkolab.agentbus.exception;

/**
 * Routing topology could not be read, resolved or written.
 */
public class ConfigurationException extends MessagingException {

    public ConfigurationException(String message) {
        super("ROUTING_CONFIG_ERROR", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("ROUTING_CONFIG_ERROR", message, cause);
    }

    public static ConfigurationException unreadable(String location, Throwable cause) {
        return (ConfigurationException) new ConfigurationException(
                "Failed to read routing configuration from " + location, cause)
                .with("location", location);
    }

    public static ConfigurationException unwritable(String location, Throwable cause) {
        return (ConfigurationException) new ConfigurationException(
                "Failed to write routing configuration to " + location, cause)
                .with("location", location);
    }

    public static ConfigurationException unknownReference(String kind, String name, String referencedBy) {
        return (ConfigurationException) new ConfigurationException(
                String.format("Unknown %s '%s' referenced by '%s'", kind, name, referencedBy))
                .with("kind", kind)
                .with("name", name)
                .with("referencedBy", referencedBy);
    }
}
