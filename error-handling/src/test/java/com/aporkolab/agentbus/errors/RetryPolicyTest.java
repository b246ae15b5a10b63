package com.aporkolab.agentbus.errors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RetryPolicyTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should use three exponential retries with jitter")
        void shouldHaveDefaults() {
            RetryPolicy policy = RetryPolicy.defaults();

            assertThat(policy.getMaxRetries()).isEqualTo(3);
            assertThat(policy.getStrategy()).isEqualTo(RetryStrategy.EXPONENTIAL);
            assertThat(policy.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
            assertThat(policy.getMaxDelay()).isEqualTo(Duration.ofMinutes(5));
            assertThat(policy.getBackoffFactor()).isEqualTo(2.0);
            assertThat(policy.isJitter()).isTrue();
            assertThat(policy.getRetryOn()).isEmpty();
            assertThat(policy.getNoRetryOn()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("should stop once the budget is used up")
        void shouldStopAtMaxRetries() {
            RetryPolicy policy = RetryPolicy.builder().maxRetries(3).build();

            assertThat(policy.allowsRetry(ErrorKind.NETWORK, 2)).isTrue();
            assertThat(policy.allowsRetry(ErrorKind.NETWORK, 3)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(value = ErrorKind.class, names = {"VALIDATION", "AUTHENTICATION"})
        @DisplayName("should never retry terminal kinds even when allow-listed")
        void shouldNeverRetryTerminalKinds(ErrorKind kind) {
            RetryPolicy policy = RetryPolicy.builder().retryOn(List.of(ErrorKind.values())).maxRetries(10).build();

            assertThat(policy.allowsRetry(kind, 0)).isFalse();
        }

        @Test
        @DisplayName("should honour the allow-list")
        void shouldHonourAllowList() {
            RetryPolicy policy = RetryPolicy.builder().retryOn(ErrorKind.NETWORK, ErrorKind.TIMEOUT).build();

            assertThat(policy.allowsRetry(ErrorKind.NETWORK, 0)).isTrue();
            assertThat(policy.allowsRetry(ErrorKind.RESOURCE, 0)).isFalse();
        }

        @Test
        @DisplayName("should let the deny-list win over the allow-list")
        void shouldPreferDenyList() {
            RetryPolicy policy = RetryPolicy.builder()
                    .retryOn(ErrorKind.NETWORK, ErrorKind.TIMEOUT)
                    .noRetryOn(ErrorKind.NETWORK)
                    .build();

            assertThat(policy.allowsRetry(ErrorKind.NETWORK, 0)).isFalse();
            assertThat(policy.allowsRetry(ErrorKind.TIMEOUT, 0)).isTrue();
        }

        @Test
        @DisplayName("should treat an empty allow-list as unset")
        void shouldTreatEmptyAllowListAsUnset() {
            RetryPolicy policy = RetryPolicy.builder().retryOn(List.of()).build();

            assertThat(policy.getRetryOn()).isEmpty();
            assertThat(policy.allowsRetry(ErrorKind.NETWORK, 0)).isTrue();
        }

        @Test
        @DisplayName("should treat an empty deny-list as unset")
        void shouldTreatEmptyDenyListAsUnset() {
            RetryPolicy policy = RetryPolicy.builder().noRetryOn(List.of()).build();

            assertThat(policy.getNoRetryOn()).isEmpty();
            assertThat(policy.allowsRetry(ErrorKind.TIMEOUT, 0)).isTrue();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject invalid settings")
        void shouldRejectInvalidSettings() {
            assertThatThrownBy(() -> RetryPolicy.builder().maxRetries(-1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder().initialDelay(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder().backoffFactor(1.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder()
                    .initialDelay(Duration.ofSeconds(10))
                    .maxDelay(Duration.ofSeconds(5))
                    .build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should copy into an equivalent builder")
        void shouldCopy() {
            RetryPolicy policy = RetryPolicy.builder().maxRetries(7).noRetryOn(ErrorKind.RESOURCE).build();

            RetryPolicy copy = policy.toBuilder().jitter(false).build();

            assertThat(copy.getMaxRetries()).isEqualTo(7);
            assertThat(copy.getNoRetryOn()).contains(Set.of(ErrorKind.RESOURCE));
            assertThat(copy.isJitter()).isFalse();
        }
    }
}
