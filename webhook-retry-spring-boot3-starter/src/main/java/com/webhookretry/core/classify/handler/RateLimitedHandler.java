package com.webhookretry.core.classify.handler;

import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.exception.guard.DownstreamRateLimitedException;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.enums.FailureCategory;

/**
 * 本地限流拒绝, 没有服务端提示
 */
public class RateLimitedHandler implements FailureCaseHandler<DownstreamRateLimitedException> {
    @Override
    public Class<DownstreamRateLimitedException> exceptionType() {
        return DownstreamRateLimitedException.class;
    }

    @Override
    public <T> Outcome<T> classify(DownstreamRateLimitedException ex) {
        return Outcome.retryable(FailureCategory.RATE_LIMITED, Outcome.NO_STATUS, ex.getMessage());
    }
}
