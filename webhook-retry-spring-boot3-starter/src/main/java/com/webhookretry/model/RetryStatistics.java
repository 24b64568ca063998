package com.webhookretry.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次运行的统计
 */
@Getter
@Builder
@ToString
public class RetryStatistics {

    /** 已执行的尝试次数 */
    private final int attemptNumber;

    private final Instant startTime;

    /** 累计等待 */
    private final Duration idleFor;

    /** 距首次尝试开始 */
    private final Duration delaySinceFirstAttempt;
}
