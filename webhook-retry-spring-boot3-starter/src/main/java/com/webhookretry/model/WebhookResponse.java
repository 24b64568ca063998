package com.webhookretry.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 传输层返回: 状态码 + 响应头 + 响应体
 */
@Getter
@ToString
public class WebhookResponse {

    private final int statusCode;

    private final Map<String, List<String>> headers;

    private final String body;

    public WebhookResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.body = body == null ? "" : body;
    }

    public static WebhookResponse of(int statusCode, String body) {
        return new WebhookResponse(statusCode, Map.of(), body);
    }

    /** 头名大小写不敏感 */
    public Optional<String> firstHeader(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }
}
