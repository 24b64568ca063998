package com.webhookretry.core.spi;

import com.webhookretry.model.WebhookResponse;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * HTTP 传输
 * 只负责发出一次 POST, 不做重试
 */
public interface WebhookTransport {

    /**
     * @throws IOException 连接级失败（含超时）
     */
    WebhookResponse send(URI url, String jsonBody, Map<String, String> headers) throws IOException;
}
