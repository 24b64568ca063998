package com.webhookretry.core.engine;

import com.webhookretry.core.spi.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 只记录等待时长, 不真正睡眠
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    /** 第 n 次等待时抛出中断, 0 表示从不 */
    private final int interruptOn;

    public RecordingSleeper() {
        this(0);
    }

    public RecordingSleeper(int interruptOn) {
        this.interruptOn = interruptOn;
    }

    @Override
    public void sleep(Duration d) throws InterruptedException {
        sleeps.add(d);
        if (interruptOn > 0 && sleeps.size() == interruptOn) {
            throw new InterruptedException("interrupted while waiting");
        }
    }

    public List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }
}
