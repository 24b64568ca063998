package com.webhookretry.core.engine;

import com.webhookretry.core.RetryState;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.core.spi.RetryableOperation;
import com.webhookretry.core.spi.Sleeper;
import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.RetryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 阻塞式重试执行器
 * 在调用线程上串行执行尝试, 通过线程中断取消:
 * - 每次尝试开始前检查中断
 * - 等待期间被中断立即终止
 * - 不打断在途尝试
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final OutcomeClassifier classifier;

    private final Sleeper sleeper;

    private final List<RetryListener> listeners;

    private final Clock clock;

    public RetryExecutor(OutcomeClassifier classifier, Sleeper sleeper, List<RetryListener> listeners) {
        this(classifier, sleeper, listeners, Clock.systemUTC());
    }

    public RetryExecutor(OutcomeClassifier classifier, Sleeper sleeper, List<RetryListener> listeners, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 使用全新的 RetryState 执行
     * @throws RetryTerminatedException 不可重试、重试耗尽或被取消
     */
    public <T> T execute(RetryableOperation<T> operation, RetryPolicy policy) {
        return execute(operation, policy, new RetryState());
    }

    public <T> T execute(RetryableOperation<T> operation, RetryPolicy policy, RetryState retryState) {
        return executeForResult(operation, policy, retryState).getValue();
    }

    /**
     * 返回值附带尝试序列与统计
     */
    public <T> RetryResult<T> executeForResult(RetryableOperation<T> operation, RetryPolicy policy,
                                               RetryState retryState) {
        RetryRun<T> run = newRun(operation, policy, retryState);
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw run.cancel();
            }
            Duration delay = run.attemptOnce();
            if (run.isTerminal()) {
                break;
            }
            log.debug("[Retry-Executor] {} attempt {} failed, waiting {} ms",
                    operation.id(), run.getAttempts().size(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw run.cancel();
            }
            run.waited(delay);
        }
        if (run.getState() == RetryRun.State.SUCCEEDED) {
            return run.result();
        }
        throw run.failure();
    }

    <T> RetryRun<T> newRun(RetryableOperation<T> operation, RetryPolicy policy, RetryState retryState) {
        return new RetryRun<>(operation, policy, retryState, classifier, listeners, clock);
    }
}
