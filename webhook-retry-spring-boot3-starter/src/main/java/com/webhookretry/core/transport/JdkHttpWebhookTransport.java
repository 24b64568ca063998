package com.webhookretry.core.transport;

import com.webhookretry.core.spi.WebhookTransport;
import com.webhookretry.model.WebhookResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * 基于 java.net.http 的默认传输
 * 使用 sendAsync().join() 等待, 调用线程被中断不会打断在途请求, 由请求超时兜底
 */
public class JdkHttpWebhookTransport implements WebhookTransport {

    private final HttpClient client;

    private final Duration requestTimeout;

    public JdkHttpWebhookTransport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .build(), requestTimeout);
    }

    public JdkHttpWebhookTransport(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public WebhookResponse send(URI url, String jsonBody, Map<String, String> headers) throws IOException {
        HttpRequest.Builder rb = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody, StandardCharsets.UTF_8));
        if (headers != null) {
            headers.forEach(rb::header);
        }
        HttpResponse<String> resp;
        try {
            resp = client.sendAsync(rb.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("webhook request to " + url + " failed", cause);
        }
        return new WebhookResponse(resp.statusCode(), resp.headers().map(), resp.body());
    }
}
