package com.webhookretry.exception;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryStatistics;

import java.util.List;

/**
 * 对端以 4xx（429 除外）拒绝
 */
public class ClientRejectedException extends FatalFailureException {

    public ClientRejectedException(Outcome<?> lastOutcome, List<Attempt> attempts, RetryStatistics statistics) {
        super(lastOutcome, attempts, statistics);
    }

    public int getStatusCode() {
        return getLastOutcome().getStatusCode();
    }
}
