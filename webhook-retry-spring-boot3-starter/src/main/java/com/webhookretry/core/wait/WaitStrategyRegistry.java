package com.webhookretry.core.wait;

import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.spi.JitterSource;
import com.webhookretry.core.spi.WaitStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / fixed-chain / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 WaitStrategy（name() 返回的名字）
 * - 未知名称回退到 exponential
 */
@Slf4j
public class WaitStrategyRegistry {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, WaitStrategy> strategies = new ConcurrentHashMap<>(16);

    public WaitStrategyRegistry(WebhookRetryProperties.Wait props, JitterSource jitter,
                                @Nullable List<WaitStrategy> discovered) {
        Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(s -> register(s.name(), s));
        }
        // 内置策略
        strategies.putIfAbsent("fixed", new FixedWaitStrategy(props.getFixed()));
        strategies.putIfAbsent("fixed-chain", new FixedChainWaitStrategy(props.getChain()));
        strategies.putIfAbsent(DEFAULT,
                new ExponentialWaitStrategy(props.getMultiplier(), props.getMin(), props.getMax(), jitter));
    }

    /**
     * 注册或覆盖策略
     */
    public WaitStrategyRegistry register(String name, WaitStrategy strategy) {
        strategies.put(normalize(name), Objects.requireNonNull(strategy, "strategy"));
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀
     */
    public WaitStrategy resolve(@Nullable String name) {
        if (name == null || name.isBlank()) {
            return strategies.get(DEFAULT);
        }
        String s = name.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        WaitStrategy found = strategies.get(normalize(s));
        if (found == null) {
            log.warn("[Wait-Registry] unknown wait strategy '{}', falling back to {}", name, DEFAULT);
            return strategies.get(DEFAULT);
        }
        return found;
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(strategies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }
}
