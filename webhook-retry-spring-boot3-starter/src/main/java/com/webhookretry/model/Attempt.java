package com.webhookretry.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次尝试的记录, 记录后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Attempt {

    /** 从 1 开始 */
    private final int index;

    private final Instant startedAt;

    private final Outcome<?> outcome;

    /** 本次之后选定的等待时长, 终态尝试为 null */
    @Getter(lombok.AccessLevel.NONE)
    private final Duration delay;

    public Attempt(int index, Instant startedAt, Outcome<?> outcome, Duration delay) {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1");
        }
        this.index = index;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.delay = delay;
    }

    public Optional<Duration> getDelay() {
        return Optional.ofNullable(delay);
    }

    public Outcome.Kind getKind() {
        return outcome.kind();
    }
}
