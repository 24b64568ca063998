package com.webhookretry.exception;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryStatistics;

import java.util.List;

/**
 * 运行被取消（线程中断或执行器关闭）
 */
public class RetryCancelledException extends RetryTerminatedException {

    public RetryCancelledException(Outcome<?> lastOutcome, List<Attempt> attempts, RetryStatistics statistics) {
        super(describe("cancelled", attempts.size()), lastOutcome, attempts, statistics);
    }
}
