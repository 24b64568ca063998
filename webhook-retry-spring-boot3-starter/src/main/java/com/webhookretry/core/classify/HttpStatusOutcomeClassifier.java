package com.webhookretry.core.classify;

import com.webhookretry.core.spi.OutcomeClassifier;
import com.webhookretry.core.spi.failure.FailureCaseHandler;
import com.webhookretry.model.Outcome;
import com.webhookretry.model.WebhookResponse;
import com.webhookretry.model.enums.FailureCategory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 状态码分类:
 * - 2xx 成功
 * - 429 可重试, 可能携带 Retry-After
 * - 5xx 可重试
 * - 其余 不重试
 * 异常按类型路由到最近的 FailureCaseHandler
 */
public class HttpStatusOutcomeClassifier implements OutcomeClassifier {

    public static final int TOO_MANY_REQUESTS = 429;

    private final RetryAfterParser retryAfter;

    private final List<FailureCaseHandler<?>> handlers;

    public HttpStatusOutcomeClassifier(RetryAfterParser retryAfter, List<FailureCaseHandler<?>> handlers) {
        this.retryAfter = Objects.requireNonNull(retryAfter, "retryAfter");
        this.handlers = List.copyOf(handlers);
    }

    @Override
    public Outcome<String> classify(WebhookResponse response) {
        int status = response.getStatusCode();
        if (status >= 200 && status < 300) {
            return Outcome.success(response.getBody(), status);
        }
        String reason = response.getBody() + " - " + status;
        if (status == TOO_MANY_REQUESTS) {
            return Outcome.retryable(FailureCategory.RATE_LIMITED, status, reason,
                    retryAfter.parse(response).orElse(null));
        }
        if (status >= 500) {
            return Outcome.retryable(FailureCategory.TRANSIENT_SERVER_ERROR, status, reason);
        }
        return Outcome.fatal(FailureCategory.CLIENT_REJECTED, status, reason);
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     * 兜底处理器（Throwable）只在整条 cause 链都没有命中时使用
     */
    @Override
    public <T> Outcome<T> classify(Throwable failure) {
        // 展开 cause 链 先本体, 再逐级cause
        for (Throwable e = failure; e != null; e = e.getCause() == e ? null : e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e, false);
            if (matched != null) {
                return call(matched, e);
            }
        }
        FailureCaseHandler<?> fallback = findBestHandler(failure, true);
        if (fallback != null) {
            return call(fallback, failure);
        }
        return Outcome.fatal(FailureCategory.UNKNOWN, Outcome.NO_STATUS, String.valueOf(failure));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <T> Outcome<T> call(FailureCaseHandler h, Throwable e) {
        return h.classify(e);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e, boolean catchAll) {
        // 过滤 supports 再按继承层级深度排序
        return handlers.stream()
                .filter(h -> catchAll == (h.exceptionType() == Throwable.class))
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
