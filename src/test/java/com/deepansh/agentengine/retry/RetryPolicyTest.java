package com.deepansh.agentengine.retry;

import com.deepansh.agentengine.llm.FailureKind;
import com.deepansh.agentengine.llm.ProviderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static final ProviderException SERVER_ERROR = ProviderException.serverError(503, "unavailable", null);
    private static final ProviderException RATE_LIMITED = ProviderException.rateLimited("slow down", null);

    /** random 0 gives a jitter factor of exactly 1 */
    private final RetryPolicy noJitter = new RetryPolicy(RetryConfiguration.DEFAULT, () -> 0.0);

    @Test
    void nextDelay_doublesPerAttempt() {
        assertThat(noJitter.nextDelay(0, SERVER_ERROR)).contains(Duration.ofSeconds(1));
        assertThat(noJitter.nextDelay(1, SERVER_ERROR)).contains(Duration.ofSeconds(2));
        assertThat(noJitter.nextDelay(2, SERVER_ERROR)).contains(Duration.ofSeconds(4));
    }

    @Test
    void nextDelay_jitterOnlyLengthensWithinFraction() {
        RetryPolicy low = new RetryPolicy(RetryConfiguration.DEFAULT, () -> 0.0);
        RetryPolicy high = new RetryPolicy(RetryConfiguration.DEFAULT, () -> 0.999999);

        assertThat(low.nextDelay(0, SERVER_ERROR)).contains(Duration.ofSeconds(1));
        assertThat(high.nextDelay(0, SERVER_ERROR).orElseThrow())
                .isGreaterThan(Duration.ofMillis(1090))
                .isLessThanOrEqualTo(Duration.ofMillis(1100));
    }

    @Test
    void nextDelay_neverExceedsMaxDelay() {
        RetryConfiguration config = RetryConfiguration.custom(20, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.5);
        RetryPolicy high = new RetryPolicy(config, () -> 0.999999);

        for (int attempt = 0; attempt < 20; attempt++) {
            assertThat(high.nextDelay(attempt, SERVER_ERROR).orElseThrow())
                    .isLessThanOrEqualTo(Duration.ofSeconds(60));
        }
        assertThat(noJitter.nextDelay(4, SERVER_ERROR)).contains(Duration.ofSeconds(16));
    }

    @Test
    void nextDelay_neverDecreases_evenOnceCapped() {
        double[] draws = {0.999999, 0.0};
        int[] call = {0};
        RetryPolicy alternating = new RetryPolicy(RetryConfiguration.AGGRESSIVE, () -> draws[call[0]++ % 2]);

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < RetryConfiguration.AGGRESSIVE.maxRetries(); attempt++) {
            Duration delay = alternating.nextDelay(attempt, SERVER_ERROR).orElseThrow();
            assertThat(delay).isGreaterThanOrEqualTo(previous)
                    .isLessThanOrEqualTo(RetryConfiguration.AGGRESSIVE.maxDelay());
            previous = delay;
        }
        assertThat(previous).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    void nextDelay_fatal_neverRetries() {
        ProviderException fatal = ProviderException.fatal(401, "bad key", null);
        assertThat(noJitter.nextDelay(0, fatal)).isEmpty();
    }

    @Test
    void nextDelay_budgetExhausted_returnsEmpty() {
        assertThat(noJitter.nextDelay(4, SERVER_ERROR)).isPresent();
        assertThat(noJitter.nextDelay(5, SERVER_ERROR)).isEmpty();
    }

    @Test
    void nextDelay_disabled_neverRetries() {
        RetryPolicy disabled = new RetryPolicy(RetryConfiguration.DISABLED);
        assertThat(disabled.nextDelay(0, RATE_LIMITED)).isEmpty();
    }

    @Test
    void nextDelay_longerHintWins() {
        ProviderException hinted = RATE_LIMITED.withRetryAfter(Duration.ofSeconds(10));
        assertThat(noJitter.nextDelay(0, hinted)).contains(Duration.ofSeconds(10));
    }

    @Test
    void nextDelay_hintCappedAtMaxDelay() {
        ProviderException hinted = RATE_LIMITED.withRetryAfter(Duration.ofSeconds(600));
        assertThat(noJitter.nextDelay(0, hinted)).contains(Duration.ofSeconds(60));
    }

    @Test
    void nextDelay_shorterHintIgnored() {
        ProviderException hinted = RATE_LIMITED.withRetryAfter(Duration.ofMillis(100));
        assertThat(noJitter.nextDelay(1, hinted)).contains(Duration.ofSeconds(2));
    }

    @Test
    void configuration_clampsOutOfRangeValues() {
        RetryConfiguration config = RetryConfiguration.custom(-3, Duration.ofSeconds(5), Duration.ofSeconds(1), 2.5);

        assertThat(config.maxRetries()).isZero();
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.jitterFraction()).isEqualTo(1.0);
    }

    @Test
    void presets_matchDocumentedValues() {
        assertThat(RetryConfiguration.preset("aggressive").maxRetries()).isEqualTo(10);
        assertThat(RetryConfiguration.AGGRESSIVE.baseDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(RetryConfiguration.CONSERVATIVE.maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(RetryConfiguration.preset(null)).isSameAs(RetryConfiguration.DEFAULT);
        assertThat(RetryConfiguration.preset("disabled").maxRetries()).isZero();
        assertThatThrownBy(() -> RetryConfiguration.preset("reckless"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryEvent_remainingRetries() {
        RetryEvent event = new RetryEvent(2, 5, Duration.ofSeconds(2), FailureKind.RATE_LIMITED, 429, "slow down");
        assertThat(event.remainingRetries()).isEqualTo(3);
    }
}
