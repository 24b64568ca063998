package com.webhookretry.model;

import com.webhookretry.core.spi.WaitStrategy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 重试策略: 尝试上限 + 等待策略 + 重试判定
 * 不可变, 同一类调用方共享
 */
@Getter
@ToString
public final class RetryPolicy {

    /** 默认判定: 只有 RetryableFailure 才继续 */
    public static final Predicate<Outcome<?>> RETRY_ON_RETRYABLE = Outcome::isRetryable;

    private final int maxAttempts;

    private final WaitStrategy waitStrategy;

    /** 只能收窄: FatalFailure 无论判定结果都终止 */
    @ToString.Exclude
    private final Predicate<Outcome<?>> retryPredicate;

    @Builder
    private RetryPolicy(int maxAttempts, WaitStrategy waitStrategy, Predicate<Outcome<?>> retryPredicate) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        this.maxAttempts = maxAttempts;
        this.waitStrategy = Objects.requireNonNull(waitStrategy, "waitStrategy");
        this.retryPredicate = retryPredicate == null ? RETRY_ON_RETRYABLE : retryPredicate;
    }

    /** 该结果是否允许进入下一次尝试（不考虑次数上限） */
    public boolean shouldRetry(Outcome<?> outcome) {
        return outcome.isRetryable() && retryPredicate.test(outcome);
    }
}
