package com.webhookretry.core.transport;

import com.webhookretry.config.WebhookGuardProperties;
import com.webhookretry.core.notify.WebhookTargets;
import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.exception.guard.DownstreamOpenCircuitException;
import com.webhookretry.exception.guard.DownstreamRateLimitedException;
import com.webhookretry.model.WebhookResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 为任意传输加上按目标隔离的 RateLimiter → CircuitBreaker
 * 目标键优先取配置的目标名, 未配置的 url 以 scheme://host/path 为键
 * 拒绝以 Downstream*Exception 抛出, 由分类器判为可重试
 * 5xx 响应计为熔断失败, 其余响应计为成功
 */
public class GuardedWebhookTransport implements WebhookTransport {

    private final WebhookTransport delegate;

    private final WebhookGuardProperties props;

    /** 可为 null */
    private final WebhookTargets targets;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>    rlCache = new ConcurrentHashMap<>();

    public GuardedWebhookTransport(WebhookTransport delegate, WebhookGuardProperties props) {
        this(delegate, props, null);
    }

    public GuardedWebhookTransport(WebhookTransport delegate, WebhookGuardProperties props, WebhookTargets targets) {
        this.delegate = delegate;
        this.props = props;
        this.targets = targets;
    }

    @Override
    public WebhookResponse send(URI url, String jsonBody, Map<String, String> headers) throws IOException {
        String key = key(url);

        // RateLimit最外层限流，抑制突发流量
        if (rlEnabled(key)) {
            RateLimiter rl = rlCache.computeIfAbsent(key, this::buildRl);
            try {
                RateLimiter.waitForPermission(rl);
            } catch (RequestNotPermitted rnp) {
                throw new DownstreamRateLimitedException(key, rnp);
            }
        }

        if (!cbEnabled(key)) {
            return delegate.send(url, jsonBody, headers);
        }

        // CircuitBreaker fail-fast 熔断器
        CircuitBreaker cb = cbCache.computeIfAbsent(key, this::buildCb);
        try {
            cb.acquirePermission();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(key, open);
        }
        long start = System.nanoTime();
        WebhookResponse resp;
        try {
            resp = delegate.send(url, jsonBody, headers);
        } catch (IOException | RuntimeException e) {
            cb.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            throw e;
        }
        long elapsed = System.nanoTime() - start;
        if (resp.getStatusCode() >= 500) {
            cb.onError(elapsed, TimeUnit.NANOSECONDS,
                    new IOException("server error " + resp.getStatusCode() + " from " + key));
        } else {
            cb.onSuccess(elapsed, TimeUnit.NANOSECONDS);
        }
        return resp;
    }

    /** 未启用熔断时返回 null */
    public CircuitBreaker getCircuitBreakerIfEnabled(String target) {
        if (!cbEnabled(target)) {
            return null;
        }
        return cbCache.computeIfAbsent(target, this::buildCb);
    }

    String key(URI url) {
        if (targets != null) {
            Optional<String> name = targets.nameOf(url);
            if (name.isPresent()) {
                return name.get();
            }
        }
        return url.getScheme() + "://" + url.getAuthority() + (url.getPath() == null ? "" : url.getPath());
    }

    private RateLimiter buildRl(String target) {
        WebhookGuardProperties.RlConfig r = rlConfig(target);
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + target, cfg);
    }

    private CircuitBreaker buildCb(String target) {
        WebhookGuardProperties.CbConfig c = cbConfig(target);
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + target, cfg);
    }

    private WebhookGuardProperties.CbConfig cbConfig(String target) {
        Map<String, WebhookGuardProperties.CbConfig> m = props.getCbPerTarget();
        return m != null && m.get(target) != null ? m.get(target) : props.getCircuitBreaker();
    }

    private WebhookGuardProperties.RlConfig rlConfig(String target) {
        Map<String, WebhookGuardProperties.RlConfig> m = props.getRlPerTarget();
        return m != null && m.get(target) != null ? m.get(target) : props.getRateLimiter();
    }

    private boolean cbEnabled(String target) {
        WebhookGuardProperties.CbConfig c = cbConfig(target);
        return c != null && c.isEnabled();
    }

    private boolean rlEnabled(String target) {
        WebhookGuardProperties.RlConfig r = rlConfig(target);
        return r != null && r.isEnabled();
    }
}
