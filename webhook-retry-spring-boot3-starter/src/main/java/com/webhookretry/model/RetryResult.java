package com.webhookretry.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 成功运行的结果及其尝试序列
 */
@Getter
@ToString
public class RetryResult<T> {

    private final T value;

    private final List<Attempt> attempts;

    private final RetryStatistics statistics;

    public RetryResult(T value, List<Attempt> attempts, RetryStatistics statistics) {
        this.value = value;
        this.attempts = List.copyOf(attempts);
        this.statistics = statistics;
    }
}
