package com.webhookretry.core.serializer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.webhookretry.core.spi.PayloadSerializer;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 输出稳定, 便于比对
        m.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.findAndRegisterModules();
        return m;
    }
}
