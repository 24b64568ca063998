package com.webhookretry.exception;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryStatistics;

import java.util.List;

/**
 * 达到最大尝试次数仍为可重试失败
 */
public class RetriesExhaustedException extends RetryTerminatedException {

    public RetriesExhaustedException(Outcome<?> lastOutcome, List<Attempt> attempts, RetryStatistics statistics) {
        super(describe(lastOutcome.getReason(), attempts.size()), lastOutcome, attempts, statistics);
    }
}
