package com.webhookretry.exception;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryStatistics;

import java.util.List;

/**
 * 不可重试的失败, 立即终止
 */
public class FatalFailureException extends RetryTerminatedException {

    public FatalFailureException(Outcome<?> lastOutcome, List<Attempt> attempts, RetryStatistics statistics) {
        super(describe(lastOutcome.getReason(), attempts.size()), lastOutcome, attempts, statistics);
    }
}
