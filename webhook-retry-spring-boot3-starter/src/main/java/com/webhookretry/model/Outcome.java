package com.webhookretry.model;

import com.webhookretry.model.enums.FailureCategory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 单次尝试的分类结果
 * Success | RetryableFailure | FatalFailure, 创建后不可变
 *
 * @param <T> 成功时的返回体类型
 */
public abstract class Outcome<T> {

    /** 状态码缺失（未拿到响应）时的取值 */
    public static final int NO_STATUS = -1;

    public enum Kind { SUCCESS, RETRYABLE, FATAL }

    private Outcome() {
    }

    public abstract Kind kind();

    public boolean isSuccess() {
        return kind() == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind() == Kind.RETRYABLE;
    }

    public boolean isFatal() {
        return kind() == Kind.FATAL;
    }

    /** 成功返回 null */
    public String getReason() {
        return null;
    }

    /** 成功返回 null */
    public FailureCategory getCategory() {
        return null;
    }

    public int getStatusCode() {
        return NO_STATUS;
    }

    /** 服务端指示的等待时长, 仅 RetryableFailure 可能存在 */
    public Optional<Duration> getSuggestedDelay() {
        return Optional.empty();
    }

    public static <T> Outcome<T> success(T body) {
        return new Success<>(body, NO_STATUS);
    }

    public static <T> Outcome<T> success(T body, int statusCode) {
        return new Success<>(body, statusCode);
    }

    public static <T> Outcome<T> retryable(FailureCategory category, int statusCode, String reason,
                                           Duration suggestedDelay) {
        return new RetryableFailure<>(category, statusCode, reason, suggestedDelay);
    }

    public static <T> Outcome<T> retryable(FailureCategory category, int statusCode, String reason) {
        return new RetryableFailure<>(category, statusCode, reason, null);
    }

    public static <T> Outcome<T> fatal(FailureCategory category, int statusCode, String reason) {
        return new FatalFailure<>(category, statusCode, reason);
    }

    public static final class Success<T> extends Outcome<T> {
        private final T body;
        private final int statusCode;

        private Success(T body, int statusCode) {
            this.body = body;
            this.statusCode = statusCode;
        }

        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }

        public T getBody() {
            return body;
        }

        @Override
        public int getStatusCode() {
            return statusCode;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Success<?> that)) return false;
            return statusCode == that.statusCode && Objects.equals(body, that.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(body, statusCode);
        }

        @Override
        public String toString() {
            return "Success{status=" + statusCode + ", body=" + body + "}";
        }
    }

    /**
     * 失败的公共部分
     */
    private abstract static class Failure<T> extends Outcome<T> {
        private final FailureCategory category;
        private final int statusCode;
        private final String reason;

        Failure(FailureCategory category, int statusCode, String reason) {
            this.category = Objects.requireNonNull(category, "category");
            this.statusCode = statusCode;
            this.reason = reason == null || reason.isBlank() ? category.name() : reason;
        }

        @Override
        public FailureCategory getCategory() {
            return category;
        }

        @Override
        public int getStatusCode() {
            return statusCode;
        }

        @Override
        public String getReason() {
            return reason;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Failure<?> that = (Failure<?>) o;
            return statusCode == that.statusCode && category == that.category
                    && reason.equals(that.reason) && getSuggestedDelay().equals(that.getSuggestedDelay());
        }

        @Override
        public int hashCode() {
            return Objects.hash(category, statusCode, reason, getSuggestedDelay());
        }
    }

    public static final class RetryableFailure<T> extends Failure<T> {
        private final Duration suggestedDelay;

        private RetryableFailure(FailureCategory category, int statusCode, String reason, Duration suggestedDelay) {
            super(category, statusCode, reason);
            if (suggestedDelay != null && suggestedDelay.isNegative()) {
                throw new IllegalArgumentException("suggestedDelay must be >= 0");
            }
            this.suggestedDelay = suggestedDelay;
        }

        @Override
        public Kind kind() {
            return Kind.RETRYABLE;
        }

        @Override
        public Optional<Duration> getSuggestedDelay() {
            return Optional.ofNullable(suggestedDelay);
        }

        @Override
        public String toString() {
            return "RetryableFailure{category=" + getCategory() + ", status=" + getStatusCode()
                    + ", reason=" + getReason() + ", suggestedDelay=" + suggestedDelay + "}";
        }
    }

    public static final class FatalFailure<T> extends Failure<T> {

        private FatalFailure(FailureCategory category, int statusCode, String reason) {
            super(category, statusCode, reason);
        }

        @Override
        public Kind kind() {
            return Kind.FATAL;
        }

        @Override
        public String toString() {
            return "FatalFailure{category=" + getCategory() + ", status=" + getStatusCode()
                    + ", reason=" + getReason() + "}";
        }
    }
}
