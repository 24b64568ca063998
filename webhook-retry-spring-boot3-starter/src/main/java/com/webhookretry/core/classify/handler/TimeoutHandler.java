package com.webhookretry.core.classify.handler;

import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.enums.FailureCategory;

import java.net.http.HttpTimeoutException;

/**
 * 超时处理
 */
public class TimeoutHandler implements FailureCaseHandler<HttpTimeoutException> {
    @Override
    public Class<HttpTimeoutException> exceptionType() {
        return HttpTimeoutException.class;
    }

    @Override
    public <T> Outcome<T> classify(HttpTimeoutException ex) {
        return Outcome.retryable(FailureCategory.TIMEOUT, Outcome.NO_STATUS, ex.toString());
    }
}
