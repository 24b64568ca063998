package com.webhookretry.core.wait;

import com.webhookretry.core.spi.JitterSource;
import com.webhookretry.core.spi.WaitStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * 指数退避: multiplier * 2^(attempt-1), 限制在 [min, max]
 * attempt 从1开始：1 -> multiplier, 2 -> 2 * multiplier, 3 -> 4 * multiplier ...
 */
public class ExponentialWaitStrategy implements WaitStrategy {

    private final Duration multiplier;

    private final Duration min;

    private final Duration max;

    private final JitterSource jitter;

    public ExponentialWaitStrategy(Duration multiplier, Duration min, Duration max) {
        this(multiplier, min, max, JitterSource.NONE);
    }

    public ExponentialWaitStrategy(Duration multiplier, Duration min, Duration max, JitterSource jitter) {
        this.multiplier = Objects.requireNonNull(multiplier, "multiplier");
        this.min = Objects.requireNonNull(min, "min");
        this.max = Objects.requireNonNull(max, "max");
        this.jitter = jitter == null ? JitterSource.NONE : jitter;
        if (multiplier.isNegative() || min.isNegative()) {
            throw new IllegalArgumentException("multiplier and min must be >= 0");
        }
        if (max.compareTo(min) < 0) {
            throw new IllegalArgumentException("max must be >= min (min: " + min + ", max: " + max + ")");
        }
    }

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt) {
        long base = multiplier.toMillis();
        long maxMs = max.toMillis();
        int exp = Math.max(0, attempt - 1);

        long ideal;
        // 超过 62 位直接封顶, 避免溢出
        if (exp >= Long.SIZE - 2 || base > (Long.MAX_VALUE >> exp)) {
            ideal = maxMs;
        } else {
            ideal = base << exp;
        }
        long jittered = ideal + jitter.jitter(Duration.ofMillis(ideal), attempt).toMillis();
        long delay = Math.max(min.toMillis(), Math.min(jittered, maxMs));
        return Duration.ofMillis(delay);
    }
}
