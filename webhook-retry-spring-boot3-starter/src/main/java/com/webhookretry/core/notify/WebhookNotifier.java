package com.webhookretry.core.notify;

import com.webhookretry.core.RetryState;
import com.webhookretry.core.engine.RetryExecutor;
import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.PayloadSerializer;
import com.webhookretry.core.spi.RetryableOperation;
import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.exception.RetryTerminatedException;
import com.webhookretry.model.Attempt;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.RetryResult;
import com.webhookretry.model.RetryStatistics;
import com.webhookretry.model.WebhookEndpoint;
import com.webhookretry.model.WebhookResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Webhook 通知: 加频道 -> 序列化 -> POST -> 分类, 交给执行器重试
 * 收到 429 的 Retry-After 时写入 RetryState, 下一次等待由服务端决定
 */
@Slf4j
public class WebhookNotifier {

    public static final String CHANNEL_KEY = "channel";

    private static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    private final WebhookTransport transport;

    private final OutcomeClassifier classifier;

    private final PayloadSerializer serializer;

    private final RetryExecutor executor;

    private final RetryPolicy policy;

    private final WebhookTargets targets;

    /** 本实例独享 */
    private final RetryState retryState = new RetryState();

    private final AtomicLong seq = new AtomicLong();

    private volatile RetryStatistics lastStatistics;

    private volatile List<Attempt> lastAttempts = List.of();

    public WebhookNotifier(WebhookTransport transport, OutcomeClassifier classifier, PayloadSerializer serializer,
                           RetryExecutor executor, RetryPolicy policy, WebhookTargets targets) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.targets = targets;
    }

    /**
     * 按配置的逻辑名发送
     * @throws IllegalArgumentException 目标未配置
     */
    public String notify(String target, Map<String, ?> payload) {
        if (targets == null) {
            throw new IllegalArgumentException("no webhook targets configured");
        }
        return notify(targets.get(target), payload);
    }

    /**
     * 发送一次逻辑通知, 成功返回响应体
     * @throws RetryTerminatedException 不可重试、重试耗尽或被取消
     */
    public String notify(WebhookEndpoint endpoint, Map<String, ?> payload) {
        Objects.requireNonNull(endpoint, "endpoint");
        String body = serializer.serialize(withChannel(payload, endpoint.getChannel()));
        String id = endpoint.getName() + "#" + seq.incrementAndGet();
        RetryableOperation<String> op = RetryableOperation.of(id, attempt -> post(id, endpoint, body, attempt));
        try {
            RetryResult<String> result = executor.executeForResult(op, policy, retryState);
            lastStatistics = result.getStatistics();
            lastAttempts = result.getAttempts();
            return result.getValue();
        } catch (RetryTerminatedException e) {
            lastStatistics = e.getStatistics();
            lastAttempts = e.getAttempts();
            throw e;
        }
    }

    /** 最近一次运行的统计, 尚未运行返回 null */
    public RetryStatistics getLastStatistics() {
        return lastStatistics;
    }

    public List<Attempt> getLastAttempts() {
        return lastAttempts;
    }

    RetryState retryState() {
        return retryState;
    }

    private Outcome<String> post(String id, WebhookEndpoint endpoint, String body, int attempt) {
        Outcome<String> outcome;
        try {
            WebhookResponse resp = transport.send(endpoint.getUri(), body, JSON_HEADERS);
            outcome = classifier.classify(resp);
        } catch (IOException | RuntimeException e) {
            outcome = classifier.classify(e);
        }
        if (!outcome.isSuccess()) {
            log.debug("[Webhook-Notifier] {} attempt {} -> {}", id, attempt, outcome);
            outcome.getSuggestedDelay().ifPresent(d -> retryState.set(id, d));
        }
        return outcome;
    }

    /** 复制一份, 不修改调用方的 map */
    static Map<String, Object> withChannel(Map<String, ?> payload, String channel) {
        Map<String, Object> copy = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        if (channel != null) {
            copy.put(CHANNEL_KEY, channel.startsWith("#") ? channel : "#" + channel);
        }
        return copy;
    }
}
