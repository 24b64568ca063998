package com.webhookretry.config;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Webhook 重试配置（绑定前缀：webhook.retry）
 *
 * YAML 示例：
 * webhook:
 *   retry:
 *     max-attempts: 4
 *     retry-after-max: 60s
 *     targets:
 *       slack:
 *         url: https://hooks.slack.com/services/xxx
 *         channel: learning
 *       slack-mock5xx:
 *         url: http://localhost:8080/5xx
 *     wait:
 *       strategy: exponential
 *       fixed: 1s
 *       chain: 1s,1s,3s,3s,6s
 *       multiplier: 1s
 *       min: 0s
 *       max: 10s
 *       jitter: 0ms
 *     http:
 *       connect-timeout: 5s
 *       request-timeout: 10s
 *     executor:
 *       core-pool-size: 4
 *       max-pool-size: 16
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 *       max-pending-timeouts: 100000
 */
@ConfigurationProperties(prefix = "webhook.retry")
public class WebhookRetryProperties implements InitializingBean {

    /** 单次逻辑调用的最大尝试次数（含首次） */
    private int maxAttempts = 4;

    /** 服务端 Retry-After 的上限, 为空表示不限制 */
    private Duration retryAfterMax;

    /** 逻辑名 -> 目标 */
    private Map<String, Target> targets = new LinkedHashMap<>();

    private Wait wait = new Wait();

    private Http http = new Http();

    private Exec executor = new Exec();

    private Wheel wheel = new Wheel();

    /**
     * 启动时校验, 非法配置直接拒绝启动
     */
    @Override
    public void afterPropertiesSet() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("webhook.retry.max-attempts must be >= 1 (current: " + maxAttempts + ")");
        }
        if (wait.getMin().compareTo(wait.getMax()) > 0) {
            throw new IllegalArgumentException("webhook.retry.wait.max must be >= wait.min (current: min="
                    + wait.getMin() + ", max=" + wait.getMax() + ")");
        }
        targets.forEach((name, t) -> {
            if (t.getUrl() == null || t.getUrl().isBlank()) {
                throw new IllegalArgumentException("webhook.retry.targets." + name + ".url must not be blank");
            }
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryAfterMax() {
        return retryAfterMax;
    }

    public void setRetryAfterMax(Duration retryAfterMax) {
        this.retryAfterMax = retryAfterMax;
    }

    public Map<String, Target> getTargets() {
        return targets;
    }

    public void setTargets(Map<String, Target> targets) {
        this.targets = targets;
    }

    public Wait getWait() {
        return wait;
    }

    public void setWait(Wait wait) {
        this.wait = wait;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Exec getExecutor() {
        return executor;
    }

    public void setExecutor(Exec executor) {
        this.executor = executor;
    }

    public Wheel getWheel() {
        return wheel;
    }

    public void setWheel(Wheel wheel) {
        this.wheel = wheel;
    }

    // ----------------- 嵌套配置对象 -----------------

    public static class Target {
        private String url;

        /** 默认频道, 发送时补上 '#' */
        private String channel;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }
    }

    public static class Wait {
        /** fixed | fixed-chain | exponential | spi:{name} */
        private String strategy = "exponential";

        /** fixed 的间隔 */
        private Duration fixed = Duration.ofSeconds(1);

        /** fixed-chain 的阶梯, 超出后沿用最后一级 */
        private List<Duration> chain = new ArrayList<>(List.of(
                Duration.ofSeconds(1), Duration.ofSeconds(1),
                Duration.ofSeconds(3), Duration.ofSeconds(3),
                Duration.ofSeconds(6)));

        /** exponential: multiplier * 2^(attempt-1) */
        private Duration multiplier = Duration.ofSeconds(1);

        private Duration min = Duration.ZERO;

        private Duration max = Duration.ofSeconds(10);

        /** 随机抖动上限, 0 表示不抖动 */
        private Duration jitter = Duration.ZERO;

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Duration getFixed() {
            return fixed;
        }

        public void setFixed(Duration fixed) {
            this.fixed = fixed;
        }

        public List<Duration> getChain() {
            return chain;
        }

        public void setChain(List<Duration> chain) {
            this.chain = chain;
        }

        public Duration getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(Duration multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMin() {
            return min;
        }

        public void setMin(Duration min) {
            this.min = min;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public Duration getJitter() {
            return jitter;
        }

        public void setJitter(Duration jitter) {
            this.jitter = jitter;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);

        /** 单次请求超时, 取消不会打断在途请求, 由它兜底 */
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        private int queueCapacity = 1000;

        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getKeepAlive() {
            return keepAlive;
        }

        public void setKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
        }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(100);

        private int ticksPerWheel = 512;

        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() {
            return tickDuration;
        }

        public void setTickDuration(Duration tickDuration) {
            this.tickDuration = tickDuration;
        }

        public int getTicksPerWheel() {
            return ticksPerWheel;
        }

        public void setTicksPerWheel(int ticksPerWheel) {
            this.ticksPerWheel = ticksPerWheel;
        }

        public long getMaxPendingTimeouts() {
            return maxPendingTimeouts;
        }

        public void setMaxPendingTimeouts(long maxPendingTimeouts) {
            this.maxPendingTimeouts = maxPendingTimeouts;
        }
    }
}
