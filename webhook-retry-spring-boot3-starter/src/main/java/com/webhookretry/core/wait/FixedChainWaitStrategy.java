package com.webhookretry.core.wait;

import com.webhookretry.core.spi.WaitStrategy;

import java.time.Duration;
import java.util.List;

/**
 * 阶梯策略: 第 n 次失败后使用第 n 级, 超出后沿用最后一级
 * 例 1s,1s,3s,3s,6s: 前两次短等待, 之后逐步拉长
 */
public class FixedChainWaitStrategy implements WaitStrategy {

    private final List<Duration> steps;

    public FixedChainWaitStrategy(List<Duration> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("wait chain must not be empty");
        }
        for (Duration d : steps) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("wait chain step must be >= 0 (current: " + d + ")");
            }
        }
        this.steps = List.copyOf(steps);
    }

    public static FixedChainWaitStrategy ofSeconds(long... seconds) {
        Duration[] steps = new Duration[seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            steps[i] = Duration.ofSeconds(seconds[i]);
        }
        return new FixedChainWaitStrategy(List.of(steps));
    }

    @Override
    public String name() {
        return "fixed-chain";
    }

    @Override
    public Duration delay(int attempt) {
        int idx = Math.min(Math.max(attempt, 1), steps.size()) - 1;
        return steps.get(idx);
    }

    public List<Duration> getSteps() {
        return steps;
    }
}
