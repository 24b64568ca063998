package com.webhookretry.core.wait;

import com.webhookretry.core.spi.JitterSource;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * [0, bound] 均匀随机抖动, Random 由外部注入
 */
public class RandomJitterSource implements JitterSource {

    private final long boundMillis;

    private final Random random;

    public RandomJitterSource(Duration bound, Random random) {
        this.boundMillis = Objects.requireNonNull(bound, "bound").toMillis();
        this.random = Objects.requireNonNull(random, "random");
        if (boundMillis < 0) {
            throw new IllegalArgumentException("jitter bound must be >= 0");
        }
    }

    @Override
    public Duration jitter(Duration base, int attempt) {
        if (boundMillis == 0) {
            return Duration.ZERO;
        }
        synchronized (random) {
            return Duration.ofMillis((long) (random.nextDouble() * boundMillis));
        }
    }
}
