package com.webhookretry.core.spi;

/**
 * 序列化
 */
public interface PayloadSerializer {

    /** 将对象序列化为 JSON 字符串 */
    String serialize(Object payload);
}
