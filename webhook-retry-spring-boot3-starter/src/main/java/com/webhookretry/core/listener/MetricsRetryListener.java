package com.webhookretry.core.listener;

import com.webhookretry.core.metric.RetryMetrics;
import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.exception.FatalFailureException;
import com.webhookretry.exception.RetriesExhaustedException;
import com.webhookretry.exception.RetryCancelledException;
import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.Attempt;
import com.webhookretry.model.RetryStatistics;

/**
 * 运行事件 -> Micrometer 指标
 */
public class MetricsRetryListener implements RetryListener {

    private final RetryMetrics meter;

    public MetricsRetryListener(RetryMetrics meter) {
        this.meter = meter;
    }

    @Override
    public void onAttempt(String operationId, Attempt attempt) {
        meter.incAttempt();
        if (!attempt.getOutcome().isSuccess()) {
            meter.incFailure(attempt.getOutcome().getCategory());
        }
        attempt.getDelay().ifPresent(d -> {
            meter.incRetry();
            meter.recordWait(d);
        });
    }

    @Override
    public void onSuccess(String operationId, RetryStatistics statistics) {
        meter.incSuccess();
        record(statistics);
    }

    @Override
    public void onFailure(String operationId, RetryTerminatedException failure) {
        if (failure instanceof RetryCancelledException) {
            meter.incCancelled();
        } else if (failure instanceof RetriesExhaustedException) {
            meter.incExhausted();
        } else if (failure instanceof FatalFailureException) {
            meter.incFatal();
        }
        record(failure.getStatistics());
    }

    private void record(RetryStatistics statistics) {
        if (statistics == null) {
            return;
        }
        meter.recordAttempts(statistics.getAttemptNumber());
        meter.recordCall(statistics.getDelaySinceFirstAttempt());
    }
}
