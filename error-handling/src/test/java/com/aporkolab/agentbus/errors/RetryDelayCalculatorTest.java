package com.aporkolab.agentbus.errors;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.MessageEnvelope;

class RetryDelayCalculatorTest {

    private final RetryDelayCalculator calculator = new RetryDelayCalculator(new Random(42));

    private static ErrorRecord record(int retryCount, ErrorKind kind) {
        AgentMessage message = new AgentMessage(MessageEnvelope.builder().id("m-1").build(), Map.of(), Map.of());
        return ErrorRecord.builder()
                .kind(kind)
                .originId("worker")
                .originalMessage(message)
                .retryCount(retryCount)
                .build();
    }

    private static RetryPolicy.Builder noJitter(RetryStrategy strategy) {
        return RetryPolicy.builder()
                .strategy(strategy)
                .initialDelay(Duration.ofSeconds(1))
                .backoffFactor(2.0)
                .maxDelay(Duration.ofSeconds(10))
                .jitter(false);
    }

    @Nested
    @DisplayName("Strategies without jitter")
    class Strategies {

        @ParameterizedTest(name = "retry {0}")
        @ValueSource(ints = {0, 1, 2, 3, 4, 5})
        @DisplayName("exponential should equal clamp(initial * factor^n)")
        void exponentialShouldMatchFormula(int n) {
            Duration delay = calculator.calculate(record(n, ErrorKind.NETWORK), noJitter(RetryStrategy.EXPONENTIAL).build());

            double expected = Math.min(Math.pow(2.0, n), 10.0);
            assertThat(delay).isEqualTo(Duration.ofMillis((long) (expected * 1000)));
        }

        @ParameterizedTest(name = "retry {0}")
        @ValueSource(ints = {0, 1, 2, 9, 12})
        @DisplayName("linear should equal clamp(initial * (n + 1))")
        void linearShouldMatchFormula(int n) {
            Duration delay = calculator.calculate(record(n, ErrorKind.NETWORK), noJitter(RetryStrategy.LINEAR).build());

            assertThat(delay).isEqualTo(Duration.ofSeconds(Math.min(n + 1, 10)));
        }

        @Test
        @DisplayName("none and immediate should not wait")
        void noneAndImmediateShouldNotWait() {
            assertThat(calculator.calculate(record(2, ErrorKind.NETWORK), noJitter(RetryStrategy.NONE).jitter(true).build()))
                    .isEqualTo(Duration.ZERO);
            assertThat(calculator.calculate(record(2, ErrorKind.NETWORK), noJitter(RetryStrategy.IMMEDIATE).build()))
                    .isEqualTo(Duration.ZERO);
        }
    }

    @Nested
    @DisplayName("Jitter")
    class Jitter {

        @Test
        @DisplayName("should stay within 80-120 percent of the base delay")
        void shouldStayWithinBounds() {
            RetryPolicy policy = noJitter(RetryStrategy.EXPONENTIAL).maxDelay(Duration.ofSeconds(100)).jitter(true).build();

            for (int i = 0; i < 200; i++) {
                Duration delay = calculator.calculate(record(2, ErrorKind.NETWORK), policy);
                assertThat(delay).isBetween(Duration.ofMillis(3200), Duration.ofMillis(4800));
            }
        }

        @Test
        @DisplayName("should still respect the maximum delay")
        void shouldClampAfterJitter() {
            RetryPolicy policy = noJitter(RetryStrategy.EXPONENTIAL).jitter(true).build();
            RetryDelayCalculator highJitter = new RetryDelayCalculator(new Random() {
                @Override
                public double nextDouble() {
                    return 0.999;
                }
            });

            assertThat(highJitter.calculate(record(3, ErrorKind.NETWORK), policy)).isEqualTo(Duration.ofSeconds(10));
        }
    }

    @Nested
    @DisplayName("Custom handlers")
    class CustomHandlers {

        @Test
        @DisplayName("should use the handler registered for origin and kind")
        void shouldUseRegisteredHandler() {
            calculator.registerCustomHandler(RetryDelayCalculator.customHandlerKey("worker", ErrorKind.RATE_LIMIT),
                    (rec, policy) -> Duration.ofSeconds(7));

            Duration delay = calculator.calculate(record(0, ErrorKind.RATE_LIMIT), noJitter(RetryStrategy.CUSTOM).build());

            assertThat(delay).isEqualTo(Duration.ofSeconds(7));
        }

        @Test
        @DisplayName("should fall back to exponential without a handler")
        void shouldFallBackToExponential() {
            Duration delay = calculator.calculate(record(2, ErrorKind.NETWORK), noJitter(RetryStrategy.CUSTOM).build());

            assertThat(delay).isEqualTo(Duration.ofSeconds(4));
        }

        @Test
        @DisplayName("should clamp custom delays")
        void shouldClampCustomDelays() {
            calculator.registerCustomHandler("worker_network", (rec, policy) -> Duration.ofMinutes(30));

            Duration delay = calculator.calculate(record(0, ErrorKind.NETWORK), noJitter(RetryStrategy.CUSTOM).build());

            assertThat(delay).isEqualTo(Duration.ofSeconds(10));
        }
    }
}
