package com.webhookretry.core.classify;

import com.webhookretry.model.WebhookResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Retry-After 解析
 * 支持 delta-seconds 与 RFC 1123 HTTP-date, 无法解析时忽略
 */
@Slf4j
public class RetryAfterParser {

    public static final String HEADER = "Retry-After";

    private final Clock clock;

    /** 为 null 时不设上限 */
    private final Duration max;

    public RetryAfterParser() {
        this(Clock.systemUTC(), null);
    }

    public RetryAfterParser(Clock clock, @Nullable Duration max) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (max != null && max.isNegative()) {
            throw new IllegalArgumentException("retry-after max must be >= 0");
        }
        this.max = max;
    }

    public Optional<Duration> parse(WebhookResponse response) {
        return response.firstHeader(HEADER).flatMap(this::parse);
    }

    public Optional<Duration> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        Optional<Duration> parsed = parseDeltaSeconds(v).or(() -> parseHttpDate(v));
        if (parsed.isEmpty()) {
            log.warn("[Retry-After] ignoring unparseable value '{}'", v);
        }
        return parsed.map(this::cap);
    }

    private Optional<Duration> parseDeltaSeconds(String v) {
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            // delta-seconds 只允许 ASCII 数字
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(v)));
        } catch (NumberFormatException e) {
            // 超过 long 范围, 视为无限大
            return Optional.of(Duration.ofSeconds(Long.MAX_VALUE / 1_000_000_000L));
        }
    }

    private Optional<Duration> parseHttpDate(String v) {
        try {
            ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration d = Duration.between(clock.instant(), at.toInstant());
            return Optional.of(d.isNegative() ? Duration.ZERO : d);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Duration cap(Duration d) {
        return max != null && d.compareTo(max) > 0 ? max : d;
    }
}
