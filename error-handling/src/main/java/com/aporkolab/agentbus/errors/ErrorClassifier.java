package com.aporkolab.agentbus.errors;

import java.io.InterruptedIOException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.aporkolab.agentbus.exception.ValidationException;

/**
 * Maps a failure to an {@link ErrorKind}.
 * 
 * Type checks come first (timeouts, argument/validation failures), then case-insensitive
 * substring matching on the message text. Text matching is a heuristic: a validation failure
 * whose text mentions "network" is still classified as validation only because the type check wins.
 * Stateless and thread-safe.
 */
public class ErrorClassifier {

    public ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return ErrorKind.UNKNOWN;
        }

        if (cause instanceof TimeoutException || cause instanceof InterruptedIOException) {
            return ErrorKind.TIMEOUT;
        }

        String text = cause.getMessage() == null ? "" : cause.getMessage().toLowerCase(Locale.ROOT);

        if (cause instanceof IllegalArgumentException
                || cause instanceof ValidationException
                || text.contains("validation")) {
            return ErrorKind.VALIDATION;
        }
        if (text.contains("network") || text.contains("connection")) {
            return ErrorKind.NETWORK;
        }
        if (text.contains("auth") || text.contains("permission")) {
            return ErrorKind.AUTHENTICATION;
        }
        if (text.contains("rate limit") || text.contains("throttl")) {
            return ErrorKind.RATE_LIMIT;
        }
        if (text.contains("memory") || text.contains("resource")) {
            return ErrorKind.RESOURCE;
        }
        return ErrorKind.UNKNOWN;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
