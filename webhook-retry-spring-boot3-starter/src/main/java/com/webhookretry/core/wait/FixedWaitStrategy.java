package com.webhookretry.core.wait;

import com.webhookretry.core.spi.WaitStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * 固定间隔策略
 */
public class FixedWaitStrategy implements WaitStrategy {

    private final Duration interval;

    public FixedWaitStrategy(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
        this.interval = interval;
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt) {
        return interval;
    }
}
