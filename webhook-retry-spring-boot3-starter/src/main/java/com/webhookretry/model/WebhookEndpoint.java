package com.webhookretry.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.net.URI;
import java.util.Objects;

/**
 * 通知目标: 逻辑名 -> url + 默认频道
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WebhookEndpoint {

    private final String name;

    private final URI uri;

    /** 可为 null */
    private final String channel;

    public WebhookEndpoint(String name, URI uri, String channel) {
        this.name = Objects.requireNonNull(name, "name");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.channel = channel == null || channel.isBlank() ? null : channel.trim();
    }

    public static WebhookEndpoint of(String name, String url, String channel) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("webhook target '" + name + "' has no url");
        }
        return new WebhookEndpoint(name, URI.create(url.trim()), channel);
    }

    /** 同一目标换频道 */
    public WebhookEndpoint withChannel(String channel) {
        return new WebhookEndpoint(name, uri, channel);
    }
}
