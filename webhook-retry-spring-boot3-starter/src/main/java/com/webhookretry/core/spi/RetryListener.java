package com.webhookretry.core.spi;

import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.Attempt;
import com.webhookretry.model.RetryStatistics;

/**
 * 运行事件监听, 同步回调
 * 回调抛出的异常只记录日志, 不影响运行
 */
public interface RetryListener {

    default void beforeAttempt(String operationId, int attempt) {
    }

    /** 每次尝试记录后, 含本次选定的等待 */
    default void onAttempt(String operationId, Attempt attempt) {
    }

    default void onSuccess(String operationId, RetryStatistics statistics) {
    }

    default void onFailure(String operationId, RetryTerminatedException failure) {
    }
}
