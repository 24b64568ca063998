package com.webhookretry.core.engine;

import com.webhookretry.core.RetryState;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.core.spi.RetryableOperation;
import com.webhookretry.exception.ClientRejectedException;
import com.webhookretry.exception.FatalFailureException;
import com.webhookretry.exception.RetriesExhaustedException;
import com.webhookretry.exception.RetryCancelledException;
import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.RetryResult;
import com.webhookretry.model.RetryStatistics;
import com.webhookretry.model.enums.FailureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 单次逻辑调用的状态机
 * ATTEMPTING(i) -> SUCCEEDED | EXHAUSTED | FATAL | CANCELLED
 * 状态推进互斥, 尝试之间严格串行
 */
public final class RetryRun<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryRun.class);

    public enum State { ATTEMPTING, SUCCEEDED, EXHAUSTED, FATAL, CANCELLED }

    private final RetryableOperation<T> operation;

    private final RetryPolicy policy;

    private final RetryState retryState;

    private final OutcomeClassifier classifier;

    private final List<RetryListener> listeners;

    private final Clock clock;

    /** 其他线程可能读取快照 */
    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    private final Instant startTime;

    private volatile State state = State.ATTEMPTING;

    private int attempt;

    private Duration idleFor = Duration.ZERO;

    private volatile Outcome<T> lastOutcome;

    private volatile RetryTerminatedException failure;

    RetryRun(RetryableOperation<T> operation, RetryPolicy policy, RetryState retryState,
             OutcomeClassifier classifier, List<RetryListener> listeners, Clock clock) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.retryState = Objects.requireNonNull(retryState, "retryState");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.listeners = listeners;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /**
     * 执行一次尝试并推进状态
     * @return 进入下一次尝试前应等待的时长; 已进入终态时返回 null
     * @throws RetryCancelledException 操作自身被中断
     */
    public synchronized Duration attemptOnce() {
        if (state != State.ATTEMPTING) {
            throw new IllegalStateException("run already terminated: " + state);
        }
        int index = ++attempt;
        Instant startedAt = clock.instant();
        fire(l -> l.beforeAttempt(operation.id(), index));

        Outcome<T> outcome = invoke(index);
        lastOutcome = outcome;

        Duration delay = null;
        if (outcome.isSuccess()) {
            state = State.SUCCEEDED;
        } else if (!policy.shouldRetry(outcome)) {
            state = State.FATAL;
        } else if (index >= policy.getMaxAttempts()) {
            state = State.EXHAUSTED;
        } else {
            delay = policy.getWaitStrategy().delay(index, retryState.takeAndClear(operation.id()));
        }

        Attempt recorded = new Attempt(index, startedAt, outcome, delay);
        attempts.add(recorded);
        fire(l -> l.onAttempt(operation.id(), recorded));

        if (state != State.ATTEMPTING) {
            terminate();
        }
        return delay;
    }

    /** 等待完成后记账 */
    public synchronized void waited(Duration delay) {
        idleFor = idleFor.plus(delay);
    }

    /**
     * 在尝试之间取消
     */
    public synchronized RetryCancelledException cancel() {
        if (state == State.CANCELLED) {
            return (RetryCancelledException) failure;
        }
        if (state != State.ATTEMPTING) {
            throw new IllegalStateException("run already terminated: " + state);
        }
        state = State.CANCELLED;
        terminate();
        return (RetryCancelledException) failure;
    }

    public boolean isTerminal() {
        return state != State.ATTEMPTING;
    }

    public State getState() {
        return state;
    }

    public String getOperationId() {
        return operation.id();
    }

    public List<Attempt> getAttempts() {
        return List.copyOf(attempts);
    }

    public Outcome<T> getLastOutcome() {
        return lastOutcome;
    }

    public RetryStatistics statistics() {
        return RetryStatistics.builder()
                .attemptNumber(attempts.size())
                .startTime(startTime)
                .idleFor(idleFor)
                .delaySinceFirstAttempt(Duration.between(startTime, clock.instant()))
                .build();
    }

    /** 仅 SUCCEEDED 可调用 */
    public RetryResult<T> result() {
        if (state != State.SUCCEEDED) {
            throw new IllegalStateException("run did not succeed: " + state);
        }
        return new RetryResult<>(((Outcome.Success<T>) lastOutcome).getBody(), attempts, statistics());
    }

    /** 失败终态对应的异常 */
    public RetryTerminatedException failure() {
        if (failure == null) {
            throw new IllegalStateException("run has no failure: " + state);
        }
        return failure;
    }

    private Outcome<T> invoke(int index) {
        try {
            Outcome<T> outcome = operation.attempt(index);
            if (outcome == null) {
                return classifier.classify(new IllegalStateException("operation returned no outcome"));
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // 本次尝试未完成, 不记录
            --attempt;
            throw cancel();
        } catch (Exception e) {
            log.debug("[Retry-Run] operation {} attempt {} threw", operation.id(), index, e);
            return classifier.classify(e);
        }
    }

    private void terminate() {
        // 遗留的服务端提示只属于本次运行
        retryState.clear(operation.id());
        RetryStatistics stats = statistics();
        List<Attempt> snapshot = List.copyOf(attempts);
        switch (state) {
            case SUCCEEDED -> {
                fire(l -> l.onSuccess(operation.id(), stats));
                return;
            }
            case FATAL -> failure = lastOutcome.getCategory() == FailureCategory.CLIENT_REJECTED
                    ? new ClientRejectedException(lastOutcome, snapshot, stats)
                    : new FatalFailureException(lastOutcome, snapshot, stats);
            case EXHAUSTED -> failure = new RetriesExhaustedException(lastOutcome, snapshot, stats);
            case CANCELLED -> failure = new RetryCancelledException(lastOutcome, snapshot, stats);
            default -> throw new IllegalStateException("not terminal: " + state);
        }
        RetryTerminatedException f = failure;
        fire(l -> l.onFailure(operation.id(), f));
    }

    private void fire(Consumer<RetryListener> event) {
        for (RetryListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.warn("[Retry-Run] listener {} failed for {}", l.getClass().getSimpleName(), operation.id(), e);
            }
        }
    }
}
