package com.webhookretry.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 服务端指示的一次性等待覆盖, 按调用标识隔离
 * 调用方在收到提示时写入, 执行器计算下一次等待时取出并清空
 */
public class RetryState {

    private final ConcurrentHashMap<String, Duration> pending = new ConcurrentHashMap<>();

    /** 覆盖已有值, 后写优先 */
    public void set(String callableId, Duration delay) {
        Objects.requireNonNull(callableId, "callableId");
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0 (current: " + delay + ")");
        }
        pending.put(callableId, delay);
    }

    /** 原子地取出并清空 */
    public Optional<Duration> takeAndClear(String callableId) {
        return Optional.ofNullable(pending.remove(callableId));
    }

    public Optional<Duration> peek(String callableId) {
        return Optional.ofNullable(pending.get(callableId));
    }

    public void clear(String callableId) {
        pending.remove(callableId);
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
