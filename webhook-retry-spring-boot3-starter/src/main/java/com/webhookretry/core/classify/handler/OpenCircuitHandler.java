package com.webhookretry.core.classify.handler;

import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.exception.guard.DownstreamOpenCircuitException;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.enums.FailureCategory;

/**
 * 熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<DownstreamOpenCircuitException> {
    @Override
    public Class<DownstreamOpenCircuitException> exceptionType() {
        return DownstreamOpenCircuitException.class;
    }

    @Override
    public <T> Outcome<T> classify(DownstreamOpenCircuitException ex) {
        return Outcome.retryable(FailureCategory.OPEN_CIRCUIT, Outcome.NO_STATUS, ex.getMessage());
    }
}
