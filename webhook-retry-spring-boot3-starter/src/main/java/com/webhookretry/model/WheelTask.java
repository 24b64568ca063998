package com.webhookretry.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的重试等待任务
 * 让时间轮返回的 Timeout 能识别属于哪次运行
 */
public class WheelTask implements TimerTask {

    private final String operationId;

    /** 到期后将执行的尝试序号 */
    private final int nextAttempt;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public WheelTask(String operationId, int nextAttempt, Runnable actual) {
        this.operationId = operationId;
        this.nextAttempt = nextAttempt;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getOperationId() {
        return operationId;
    }

    public int getNextAttempt() {
        return nextAttempt;
    }

    @Override
    public String toString() {
        return "WheelTask[" + operationId + ", next=" + nextAttempt + "]";
    }
}
