package com.webhookretry.core.classify;

import com.webhookretry.model.WebhookResponse;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetryAfterParserTest {

    /** Sun, 06 Nov 1994 08:49:37 GMT */
    private static final Instant NOW = Instant.parse("1994-11-06T08:49:37Z");

    private final RetryAfterParser parser = new RetryAfterParser(Clock.fixed(NOW, ZoneOffset.UTC), null);

    @Test
    void parse_DeltaSeconds_ReturnsSeconds() {
        assertThat(parser.parse("2")).contains(Duration.ofSeconds(2));
        assertThat(parser.parse(" 120 ")).contains(Duration.ofSeconds(120));
        assertThat(parser.parse("0")).contains(Duration.ZERO);
    }

    @Test
    void parse_HttpDate_ReturnsDistanceFromClock() {
        assertThat(parser.parse("Sun, 06 Nov 1994 08:50:07 GMT")).contains(Duration.ofSeconds(30));
    }

    @Test
    void parse_HttpDateInPast_FlooredAtZero() {
        assertThat(parser.parse("Sun, 06 Nov 1994 08:00:00 GMT")).contains(Duration.ZERO);
    }

    @Test
    void parse_NonAsciiDigits_Ignored() {
        // 阿拉伯-印度数字 ٣
        assertThat(parser.parse("\u0663")).isEmpty();
        assertThat(parser.parse("1\u0663")).isEmpty();
    }

    @Test
    void parse_Garbage_Ignored() {
        assertThat(parser.parse("soon")).isEmpty();
        assertThat(parser.parse("-5")).isEmpty();
        assertThat(parser.parse("1.5")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse((String) null)).isEmpty();
    }

    @Test
    void parse_AboveCap_Capped() {
        RetryAfterParser capped = new RetryAfterParser(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(60));

        assertThat(capped.parse("3600")).contains(Duration.ofSeconds(60));
        assertThat(capped.parse("10")).contains(Duration.ofSeconds(10));
    }

    @Test
    void parse_Response_HeaderNameCaseInsensitive() {
        WebhookResponse resp = new WebhookResponse(429, Map.of("retry-after", List.of("7")), "slow down");

        assertThat(parser.parse(resp)).contains(Duration.ofSeconds(7));
        assertThat(parser.parse(WebhookResponse.of(429, "slow down"))).isEmpty();
    }
}
