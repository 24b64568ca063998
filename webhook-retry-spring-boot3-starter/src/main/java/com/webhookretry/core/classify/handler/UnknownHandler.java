package com.webhookretry.core.classify.handler;

import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.enums.FailureCategory;

/**
 * 未知异常, 兜底不重试
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public <T> Outcome<T> classify(Throwable ex) {
        return Outcome.fatal(FailureCategory.UNKNOWN, Outcome.NO_STATUS, String.valueOf(ex));
    }
}
