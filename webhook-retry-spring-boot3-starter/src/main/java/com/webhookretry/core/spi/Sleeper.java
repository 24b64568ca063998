package com.webhookretry.core.spi;

import java.time.Duration;

/**
 * 阻塞等待, 测试中替换为记录实现
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
