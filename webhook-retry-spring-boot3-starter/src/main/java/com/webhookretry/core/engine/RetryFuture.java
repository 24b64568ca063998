package com.webhookretry.core.engine;

import com.webhookretry.model.Attempt;
import com.webhookretry.model.RetryResult;
import io.netty.util.Timeout;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 时间轮执行器返回的结果句柄
 * cancel 会撤销挂起的等待, 正在进行的尝试先完成
 */
public class RetryFuture<T> extends CompletableFuture<RetryResult<T>> {

    private final RetryRun<T> run;

    private final WheelRetryExecutor owner;

    /** 当前挂在时间轮上的等待, 尝试进行中为 null */
    private volatile Timeout pending;

    RetryFuture(RetryRun<T> run, WheelRetryExecutor owner) {
        this.run = run;
        this.owner = owner;
    }

    public String getOperationId() {
        return run.getOperationId();
    }

    /** 截至目前的尝试快照 */
    public List<Attempt> getAttempts() {
        return run.getAttempts();
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        if (cancelled) {
            Timeout t = pending;
            // 撤销成功说明等待任务不会再执行, 由这里收尾
            if (t != null && t.cancel()) {
                owner.finishCancelled(this);
            }
        }
        return cancelled;
    }

    RetryRun<T> run() {
        return run;
    }

    void pending(Timeout timeout) {
        this.pending = timeout;
    }
}
