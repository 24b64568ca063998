package com.webhookretry.model;

import com.webhookretry.core.wait.FixedWaitStrategy;
import com.webhookretry.model.enums.FailureCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

    @Test
    void kind_MatchesFactory() {
        assertThat(Outcome.success("ok").kind()).isEqualTo(Outcome.Kind.SUCCESS);
        assertThat(Outcome.retryable(FailureCategory.RATE_LIMITED, 429, "x").kind())
                .isEqualTo(Outcome.Kind.RETRYABLE);
        assertThat(Outcome.fatal(FailureCategory.CLIENT_REJECTED, 404, "x").kind()).isEqualTo(Outcome.Kind.FATAL);
    }

    @Test
    void success_HasNoFailureFields() {
        Outcome<String> ok = Outcome.success("ok", 200);

        assertThat(ok.getReason()).isNull();
        assertThat(ok.getCategory()).isNull();
        assertThat(ok.getSuggestedDelay()).isEmpty();
        assertThat(ok.getStatusCode()).isEqualTo(200);
    }

    @Test
    void retryable_BlankReason_FallsBackToCategory() {
        assertThat(Outcome.retryable(FailureCategory.TRANSPORT_ERROR, Outcome.NO_STATUS, " ").getReason())
                .isEqualTo("TRANSPORT_ERROR");
    }

    @Test
    void retryable_NegativeHint_ThrowsException() {
        assertThatThrownBy(() -> Outcome.retryable(FailureCategory.RATE_LIMITED, 429, "x", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryPolicy_ZeroAttempts_ThrowsException() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0)
                .waitStrategy(new FixedWaitStrategy(Duration.ZERO)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void retryPolicy_DefaultPredicate_RetriesOnlyRetryable() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3)
                .waitStrategy(new FixedWaitStrategy(Duration.ZERO)).build();

        assertThat(policy.shouldRetry(Outcome.retryable(FailureCategory.TRANSIENT_SERVER_ERROR, 503, "x"))).isTrue();
        assertThat(policy.shouldRetry(Outcome.fatal(FailureCategory.CLIENT_REJECTED, 400, "x"))).isFalse();
        assertThat(policy.shouldRetry(Outcome.success("ok"))).isFalse();
    }
}
