package com.webhookretry.core.notify;

import com.webhookretry.config.WebhookRetryProperties;
import com.webhookretry.model.WebhookEndpoint;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 启动时从配置构建的只读目标表
 */
public class WebhookTargets {

    private final Map<String, WebhookEndpoint> endpoints;

    public WebhookTargets(Map<String, WebhookEndpoint> endpoints) {
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    public static WebhookTargets from(WebhookRetryProperties props) {
        Map<String, WebhookEndpoint> m = new LinkedHashMap<>();
        props.getTargets().forEach((name, t) -> m.put(name, WebhookEndpoint.of(name, t.getUrl(), t.getChannel())));
        return new WebhookTargets(m);
    }

    /**
     * @throws IllegalArgumentException 未配置的目标
     */
    public WebhookEndpoint get(String name) {
        WebhookEndpoint e = endpoints.get(name);
        if (e == null) {
            throw new IllegalArgumentException("unknown webhook target '" + name + "', configured: " + endpoints.keySet());
        }
        return e;
    }

    /** 按 url 反查目标名 */
    public Optional<String> nameOf(URI uri) {
        return endpoints.values().stream()
                .filter(e -> e.getUri().equals(uri))
                .map(WebhookEndpoint::getName)
                .findFirst();
    }
}
