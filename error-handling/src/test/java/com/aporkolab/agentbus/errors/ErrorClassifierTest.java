package com.aporkolab.agentbus.errors;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.aporkolab.agentbus.exception.ValidationException;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Nested
    @DisplayName("By type")
    class ByType {

        @Test
        @DisplayName("should classify timeouts before looking at text")
        void shouldClassifyTimeouts() {
            assertThat(classifier.classify(new TimeoutException("connection refused"))).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(classifier.classify(new SocketTimeoutException("read timed out"))).isEqualTo(ErrorKind.TIMEOUT);
        }

        @Test
        @DisplayName("should classify argument failures as validation")
        void shouldClassifyArgumentFailures() {
            assertThat(classifier.classify(new IllegalArgumentException("network is fine"))).isEqualTo(ErrorKind.VALIDATION);
            assertThat(classifier.classify(new NumberFormatException("bad number"))).isEqualTo(ErrorKind.VALIDATION);
            assertThat(classifier.classify(new ValidationException("amount", "must be positive")))
                    .isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("should unwrap async wrappers")
        void shouldUnwrapAsyncWrappers() {
            Throwable wrapped = new CompletionException(new ExecutionException(new TimeoutException("late")));

            assertThat(classifier.classify(wrapped)).isEqualTo(ErrorKind.TIMEOUT);
        }

        @Test
        @DisplayName("should treat a missing message as unknown")
        void shouldHandleNullMessage() {
            assertThat(classifier.classify(new RuntimeException())).isEqualTo(ErrorKind.UNKNOWN);
            assertThat(classifier.classify(null)).isEqualTo(ErrorKind.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("By text")
    class ByText {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
                "Schema Validation failed,      VALIDATION",
                "Network unreachable,           NETWORK",
                "Connection reset by peer,      NETWORK",
                "Auth token expired,            AUTHENTICATION",
                "Permission denied,             AUTHENTICATION",
                "Rate limit exceeded,           RATE_LIMIT",
                "Request throttled,             RATE_LIMIT",
                "Out of memory,                 RESOURCE",
                "Resource exhausted,            RESOURCE",
                "Something odd happened,        UNKNOWN"
        })
        void shouldClassifyByText(String text, ErrorKind expected) {
            assertThat(classifier.classify(new RuntimeException(text))).isEqualTo(expected);
        }

        @Test
        @DisplayName("should apply the first matching rule")
        void shouldApplyOrder() {
            assertThat(classifier.classify(new RuntimeException("connection auth failure")))
                    .isEqualTo(ErrorKind.NETWORK);
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            RuntimeException error = new RuntimeException("throttled");

            assertThat(classifier.classify(error)).isEqualTo(classifier.classify(error));
        }
    }
}
