package com.webhookretry.core.spi;

import java.time.Duration;

/**
 * 抖动来源, 默认无抖动
 */
@FunctionalInterface
public interface JitterSource {

    JitterSource NONE = (base, attempt) -> Duration.ZERO;

    /** 返回叠加到 base 上的偏移量, 可为负 */
    Duration jitter(Duration base, int attempt);
}
