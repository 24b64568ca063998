package com.webhookretry.core.engine;

import com.webhookretry.core.RetryState;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.RetryListener;
import com.webhookretry.core.spi.RetryableOperation;
import com.webhookretry.exception.RetryCancelledException;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.WheelTask;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 非阻塞重试执行器
 * 尝试在 handler 线程池执行, 两次尝试之间的等待挂在时间轮上, 等待期间不占用线程
 */
public class WheelRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(WheelRetryExecutor.class);

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** handler执行线程池 */
    private final ExecutorService handlerExecutor;

    private final OutcomeClassifier classifier;

    private final List<RetryListener> listeners;

    private final Clock clock;

    /** 未完成的运行 */
    private final Set<RetryFuture<?>> inflight = ConcurrentHashMap.newKeySet();

    /** 运行状态 */
    private final AtomicBoolean running = new AtomicBoolean(true);

    public WheelRetryExecutor(HashedWheelTimer timer, ExecutorService handlerExecutor,
                              OutcomeClassifier classifier, List<RetryListener> listeners) {
        this(timer, handlerExecutor, classifier, listeners, Clock.systemUTC());
    }

    public WheelRetryExecutor(HashedWheelTimer timer, ExecutorService handlerExecutor,
                              OutcomeClassifier classifier, List<RetryListener> listeners, Clock clock) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <T> RetryFuture<T> submit(RetryableOperation<T> operation, RetryPolicy policy) {
        return submit(operation, policy, new RetryState());
    }

    /**
     * 提交一次逻辑调用, 立即返回
     * 成功时 future 以 RetryResult 完成, 失败时以 RetryTerminatedException 异常完成
     */
    public <T> RetryFuture<T> submit(RetryableOperation<T> operation, RetryPolicy policy, RetryState retryState) {
        if (!running.get()) {
            throw new RejectedExecutionException("wheel retry executor is stopped");
        }
        RetryRun<T> run = new RetryRun<>(operation, policy, retryState, classifier, listeners, clock);
        RetryFuture<T> future = new RetryFuture<>(run, this);
        inflight.add(future);
        future.whenComplete((r, e) -> inflight.remove(future));
        dispatch(future, null);
        return future;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 未完成的运行数 */
    public int inflightCount() {
        return inflight.size();
    }

    /**
     * 停止接收新任务, 挂起中的运行以 RetryCancelledException 结束, 等待在途尝试完成
     */
    public void shutdown() {
        shutdown(Duration.ofSeconds(10));
    }

    public void shutdown(Duration await) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Set<Timeout> unProcessed = timer.stop();
        int drained = 0;
        for (Timeout t : unProcessed) {
            if (t.task() instanceof WheelTask wt) {
                log.debug("[Retry-Wheel] drop pending {} (attempt {})", wt.getOperationId(), wt.getNextAttempt());
                drained++;
            }
        }
        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(Math.max(1, await.toMillis()), TimeUnit.MILLISECONDS)) {
                handlerExecutor.shutdownNow();
                log.warn("[Retry-Wheel] handlerExecutor forced shutdown after {}", await);
            }
        } catch (InterruptedException ie) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        // 剩余的运行不会再被推进
        for (RetryFuture<?> f : inflight) {
            abort(f);
        }
        log.info("[Retry-Wheel] shutdown done, drainedWheelTasks={}", drained);
    }

    private <T> void dispatch(RetryFuture<T> future, Duration waited) {
        try {
            handlerExecutor.execute(() -> step(future, waited));
        } catch (RejectedExecutionException e) {
            log.warn("[Retry-Wheel] handler rejected {}", future.getOperationId(), e);
            abort(future);
        }
    }

    /**
     * 推进一次尝试, 未终止则在时间轮上挂下一次
     */
    private <T> void step(RetryFuture<T> future, Duration waited) {
        RetryRun<T> run = future.run();
        future.pending(null);
        if (waited != null) {
            run.waited(waited);
        }
        if (future.isCancelled()) {
            finishCancelled(future);
            return;
        }
        Duration delay;
        try {
            delay = run.attemptOnce();
        } catch (RetryCancelledException e) {
            future.completeExceptionally(e);
            return;
        } catch (RuntimeException e) {
            log.error("[Retry-Wheel] run {} broken", run.getOperationId(), e);
            abort(future);
            return;
        }
        if (run.isTerminal()) {
            complete(future);
            return;
        }
        if (future.isCancelled()) {
            finishCancelled(future);
            return;
        }
        schedule(future, delay);
    }

    private <T> void schedule(RetryFuture<T> future, Duration delay) {
        RetryRun<T> run = future.run();
        int next = run.getAttempts().size() + 1;
        if (!running.get()) {
            abort(future);
            return;
        }
        try {
            Timeout timeout = timer.newTimeout(
                    new WheelTask(run.getOperationId(), next, () -> dispatch(future, delay)),
                    Math.max(0, delay.toMillis()),
                    TimeUnit.MILLISECONDS);
            future.pending(timeout);
            // cancel 可能落在 isCancelled 检查与 pending 之间, 此时它看不到 timeout
            if (future.isCancelled()) {
                if (timeout.cancel()) {
                    finishCancelled(future);
                }
                return;
            }
            log.debug("[Retry-Wheel] {} attempt {} scheduled in {} ms", run.getOperationId(), next, delay.toMillis());
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或挂起数超限
            log.warn("[Retry-Wheel] schedule {} failed", run.getOperationId(), e);
            abort(future);
        }
    }

    private <T> void complete(RetryFuture<T> future) {
        RetryRun<T> run = future.run();
        if (run.getState() == RetryRun.State.SUCCEEDED) {
            future.complete(run.result());
        } else {
            future.completeExceptionally(run.failure());
        }
    }

    /** 调用方取消后结束运行, future 本身已是取消态 */
    void finishCancelled(RetryFuture<?> future) {
        RetryRun<?> run = future.run();
        synchronized (run) {
            if (!run.isTerminal()) {
                run.cancel();
            }
        }
    }

    /** 以 RetryCancelledException 结束, 已到终态的按原结果完成 */
    private void abort(RetryFuture<?> future) {
        RetryRun<?> run = future.run();
        synchronized (run) {
            if (!run.isTerminal()) {
                run.cancel();
            }
        }
        if (run.getState() == RetryRun.State.CANCELLED) {
            future.completeExceptionally(run.failure());
        } else {
            complete(future);
        }
    }
}
