package com.webhookretry.core.engine;

import com.webhookretry.core.spi.Sleeper;

import java.time.Duration;

/**
 * 阻塞执行器默认的等待实现, 直接睡眠当前线程
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration d) throws InterruptedException {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
