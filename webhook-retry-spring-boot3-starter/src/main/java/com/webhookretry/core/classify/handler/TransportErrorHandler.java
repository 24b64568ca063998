package com.webhookretry.core.classify.handler;

import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.enums.FailureCategory;

import java.io.IOException;

/**
 * 连接级失败, 视为瞬时
 */
public class TransportErrorHandler implements FailureCaseHandler<IOException> {

    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public <T> Outcome<T> classify(IOException ex) {
        return Outcome.retryable(FailureCategory.TRANSPORT_ERROR, Outcome.NO_STATUS, ex.toString());
    }
}
