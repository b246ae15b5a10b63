package com.aporkolab.agentbus.exception;

import java.util.List;

/**
 * A message was rejected because its content is invalid.
 * Never worth retrying: the same payload fails the same way.
 */
public class ValidationException extends MessagingException {

    public ValidationException(String field, String message) {
        super("VALIDATION_ERROR", String.format("Validation failed for '%s': %s", field, message));
        with("field", field);
    }

    public ValidationException(String field, String message, Throwable cause) {
        super("VALIDATION_ERROR", String.format("Validation failed for '%s': %s", field, message), cause);
        with("field", field);
    }

    public ValidationException(List<FieldError> errors) {
        super("VALIDATION_ERROR", "Validation failed for multiple fields");
        with("errors", errors);
    }

    public record FieldError(String field, String message) {}
}
