package com.webhookretry.core.notify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.core.classify.HttpStatusOutcomeClassifier;
import com.webhookretry.core.classify.RetryAfterParser;
import com.webhookretry.core.classify.handler.TransportErrorHandler;
import com.webhookretry.core.classify.handler.UnknownHandler;
import com.webhookretry.core.engine.RecordingSleeper;
import com.webhookretry.core.engine.RetryExecutor;
import com.webhookretry.core.serializer.JacksonPayloadSerializer;
import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.core.wait.ExponentialWaitStrategy;
import com.webhookretry.exception.ClientRejectedException;
import com.webhookretry.exception.RetriesExhaustedException;
import com.webhookretry.model.RetryPolicy;
import com.webhookretry.model.WebhookEndpoint;
import com.webhookretry.model.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookNotifierTest {

    private final ScriptedTransport transport = new ScriptedTransport();

    private final RecordingSleeper sleeper = new RecordingSleeper();

    private WebhookNotifier notifier;

    private final WebhookEndpoint slack = WebhookEndpoint.of("slack", "http://hooks.local/slack", "learning");

    @BeforeEach
    void setUp() {
        HttpStatusOutcomeClassifier classifier = new HttpStatusOutcomeClassifier(new RetryAfterParser(),
                List.of(new UnknownHandler(), new TransportErrorHandler()));
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(4)
                .waitStrategy(new ExponentialWaitStrategy(Duration.ofSeconds(1), Duration.ZERO, Duration.ofSeconds(10)))
                .build();
        WebhookRetryProperties props = new WebhookRetryProperties();
        WebhookRetryProperties.Target target = new WebhookRetryProperties.Target();
        target.setUrl("http://hooks.local/slack");
        target.setChannel("learning");
        props.getTargets().put("slack", target);

        notifier = new WebhookNotifier(transport, classifier, new JacksonPayloadSerializer(),
                new RetryExecutor(classifier, sleeper, List.of()), policy, WebhookTargets.from(props));
    }

    @Test
    void notify_RateLimitedThenOk_HonoursRetryAfter() {
        // Given
        transport.enqueue(new WebhookResponse(429, Map.of("Retry-After", List.of("2")), "rate limited"));
        transport.enqueue(WebhookResponse.of(200, "ok"));

        // When
        String body = notifier.notify("slack", Map.of("text", "hello"));

        // Then
        assertThat(body).isEqualTo("ok");
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(2));
        assertThat(notifier.getLastAttempts()).hasSize(2);
        assertThat(notifier.getLastStatistics().getAttemptNumber()).isEqualTo(2);
        assertThat(notifier.retryState().isEmpty()).isTrue();
    }

    @Test
    void notify_AddsChannelAndJsonContentType() {
        transport.enqueue(WebhookResponse.of(200, "ok"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "hello");

        notifier.notify(slack, payload);

        assertThat(transport.bodies).containsExactly("{\"channel\":\"#learning\",\"text\":\"hello\"}");
        assertThat(transport.headers.get(0)).containsEntry("Content-Type", "application/json");
        assertThat(transport.uris).containsExactly(URI.create("http://hooks.local/slack"));
        assertThat(payload).doesNotContainKey("channel");
    }

    @Test
    void notify_ChannelAlreadyPrefixed_NotDoubled() {
        transport.enqueue(WebhookResponse.of(200, "ok"));

        notifier.notify(slack.withChannel("#alerts"), Map.of("text", "x"));

        assertThat(transport.bodies.get(0)).contains("\"channel\":\"#alerts\"");
    }

    @Test
    void notify_NoChannel_PayloadUnchanged() {
        transport.enqueue(WebhookResponse.of(200, "ok"));

        notifier.notify(slack.withChannel(null), Map.of("text", "x"));

        assertThat(transport.bodies).containsExactly("{\"text\":\"x\"}");
    }

    @Test
    void notify_NotFound_ClientRejectedAfterOneAttempt() {
        transport.enqueue(WebhookResponse.of(404, "no_service"));

        assertThatThrownBy(() -> notifier.notify("slack", Map.of("text", "x")))
                .isInstanceOf(ClientRejectedException.class)
                .hasMessage("no_service - 404 (attempts=1)");

        assertThat(transport.bodies).hasSize(1);
        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(notifier.getLastStatistics().getAttemptNumber()).isEqualTo(1);
    }

    @Test
    void notify_ServerErrorsThenOk_DefaultBackoff() {
        transport.enqueue(WebhookResponse.of(503, "down"));
        transport.enqueue(WebhookResponse.of(503, "down"));
        transport.enqueue(WebhookResponse.of(503, "down"));
        transport.enqueue(WebhookResponse.of(200, "ok"));

        assertThat(notifier.notify("slack", Map.of("text", "x"))).isEqualTo("ok");

        assertThat(transport.bodies).hasSize(4);
        assertThat(sleeper.getSleeps())
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void notify_TransportKeepsFailing_Exhausted() {
        for (int i = 0; i < 4; i++) {
            transport.enqueue(new IOException("connection refused"));
        }

        assertThatThrownBy(() -> notifier.notify("slack", Map.of("text", "x")))
                .isInstanceOf(RetriesExhaustedException.class);

        assertThat(transport.bodies).hasSize(4);
    }

    @Test
    void notify_FailedAttempt_LoggedAtDebugOnly() {
        Logger logger = (Logger) LoggerFactory.getLogger(WebhookNotifier.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            transport.enqueue(WebhookResponse.of(503, "down"));
            transport.enqueue(WebhookResponse.of(200, "ok"));

            notifier.notify("slack", Map.of("text", "x"));

            // 尝试级别的 INFO 由 LoggingRetryListener 负责
            assertThat(appender.list)
                    .filteredOn(e -> e.getFormattedMessage().contains("attempt 1"))
                    .isNotEmpty()
                    .allMatch(e -> e.getLevel() == Level.DEBUG);
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void notify_UnknownTarget_ThrowsException() {
        assertThatThrownBy(() -> notifier.notify("teams", Map.of("text", "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("teams");
    }

    static class ScriptedTransport implements WebhookTransport {

        private final Deque<Object> script = new ArrayDeque<>();

        final List<URI> uris = new ArrayList<>();

        final List<String> bodies = new ArrayList<>();

        final List<Map<String, String>> headers = new ArrayList<>();

        void enqueue(Object step) {
            script.add(step);
        }

        @Override
        public WebhookResponse send(URI url, String jsonBody, Map<String, String> hdrs) throws IOException {
            uris.add(url);
            bodies.add(jsonBody);
            headers.add(hdrs);
            Object next = script.poll();
            if (next instanceof IOException e) {
                throw e;
            }
            return (WebhookResponse) next;
        }
    }
}
