package com.webhookretry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * webhook:
 *   retry:
 *     guard:
 *       enabled: true
 *       circuit-breaker:
 *         failure-rate-threshold: 60
 *         sliding-window-size: 20
 *         wait-duration-in-open-state: 15s
 *       rate-limiter:
 *         enabled: true
 *         limit-for-period: 1
 *         limit-refresh-period: 1s
 *         timeout-duration: 0ms
 *       cb-per-target:
 *         slack: { failure-rate-threshold: 30, wait-duration-in-open-state: 5s }
 */
@Data
@ConfigurationProperties(prefix = "webhook.retry.guard")
public class WebhookGuardProperties {
    /** 开关, 关闭时直接使用原始传输 */
    private boolean enabled = false;

    /** 默认配置（可被目标名覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按目标名覆盖 */
    private Map<String, CbConfig> cbPerTarget;
    private Map<String, RlConfig> rlPerTarget;

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 1;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(0);
    }
}
