package com.webhookretry.model.enums;

/**
 * 失败分类
 */
public enum FailureCategory {
    /** 5xx */
    TRANSIENT_SERVER_ERROR(true),
    /** 429, 可能携带 Retry-After */
    RATE_LIMITED(true),
    /** 其余非 2xx, 不重试 */
    CLIENT_REJECTED(false),
    /** 连接级异常 */
    TRANSPORT_ERROR(true),
    /** 传输层超时 */
    TIMEOUT(true),
    /** 本地熔断打开 */
    OPEN_CIRCUIT(true),
    /** 未识别的异常, 兜底不重试 */
    UNKNOWN(false);

    private final boolean transientFailure;

    FailureCategory(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
