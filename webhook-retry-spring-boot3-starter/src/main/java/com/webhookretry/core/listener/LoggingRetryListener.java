package com.webhookretry.core.listener;

import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.exception.RetryCancelledException;
import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.Attempt;
import com.webhookretry.model.RetryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, 默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public void beforeAttempt(String operationId, int attempt) {
        log.debug("[Retry-{}] starting attempt {}", operationId, attempt);
    }

    @Override
    public void onAttempt(String operationId, Attempt attempt) {
        if (attempt.getOutcome().isSuccess()) {
            return;
        }
        attempt.getDelay().ifPresent(d -> log.info("[Retry-{}] attempt {} failed: {}, retrying in {} ms",
                operationId, attempt.getIndex(), truncate(attempt.getOutcome().getReason()), d.toMillis()));
    }

    @Override
    public void onSuccess(String operationId, RetryStatistics statistics) {
        if (statistics.getAttemptNumber() > 1) {
            log.info("[Retry-{}] succeeded after {} attempts, idle={} ms",
                    operationId, statistics.getAttemptNumber(), statistics.getIdleFor().toMillis());
        }
    }

    @Override
    public void onFailure(String operationId, RetryTerminatedException failure) {
        if (failure instanceof RetryCancelledException) {
            log.warn("[Retry-{}] {}", operationId, failure.getMessage());
        } else {
            log.error("[Retry-{}] gave up: {}", operationId, truncate(failure.getMessage()));
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
