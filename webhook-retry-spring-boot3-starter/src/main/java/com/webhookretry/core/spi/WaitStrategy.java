package com.webhookretry.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * 等待策略（计算两次尝试之间的间隔）
 * 实现必须是确定性的, 随机抖动需通过 {@link JitterSource} 显式注入
 */
public interface WaitStrategy {

    /** 策略唯一名称（如 "fixed"、"fixed-chain"、"exponential"） */
    String name();

    /**
     * 默认计划
     * @param attempt 刚失败的尝试序号, 从1开始
     */
    Duration delay(int attempt);

    /**
     * 服务端指示优先, 否则回退到默认计划
     * @param override 已从 RetryState 取出（取出即清空）的服务端指示
     */
    default Duration delay(int attempt, Optional<Duration> override) {
        return override.orElseGet(() -> delay(attempt));
    }
}
