package com.webhookretry.exception;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryStatistics;

import java.util.List;

/**
 * 重试运行的终态异常
 * 携带最后一次结果及完整尝试序列
 */
public abstract class RetryTerminatedException extends RuntimeException {

    private final transient Outcome<?> lastOutcome;

    private final transient List<Attempt> attempts;

    private final transient RetryStatistics statistics;

    protected RetryTerminatedException(String message, Outcome<?> lastOutcome,
                                       List<Attempt> attempts, RetryStatistics statistics) {
        super(message);
        this.lastOutcome = lastOutcome;
        this.attempts = List.copyOf(attempts);
        this.statistics = statistics;
    }

    /** 取消发生在首次尝试前时为 null */
    public Outcome<?> getLastOutcome() {
        return lastOutcome;
    }

    public List<Attempt> getAttempts() {
        return attempts;
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public RetryStatistics getStatistics() {
        return statistics;
    }

    protected static String describe(String reason, int attempts) {
        return reason + " (attempts=" + attempts + ")";
    }
}
