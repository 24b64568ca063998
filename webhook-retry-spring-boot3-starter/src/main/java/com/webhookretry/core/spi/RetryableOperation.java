package com.webhookretry.core.spi;

import com.webhookretry.model.Outcome;

import java.util.Objects;

/**
 * 被重试的业务操作
 * 通过返回 Outcome 表达成功/可重试/不可重试, 抛出的异常交给分类器
 */
public interface RetryableOperation<T> {

    /** 调用标识, RetryState 以此为键 */
    String id();

    Outcome<T> attempt(int attempt) throws Exception;

    static <T> RetryableOperation<T> of(String id, AttemptFunction<T> fn) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fn, "fn");
        return new RetryableOperation<>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Outcome<T> attempt(int attempt) throws Exception {
                return fn.apply(attempt);
            }

            @Override
            public String toString() {
                return "RetryableOperation[" + id + "]";
            }
        };
    }

    @FunctionalInterface
    interface AttemptFunction<T> {
        Outcome<T> apply(int attempt) throws Exception;
    }
}
