package com.deepknow.sessionoz.api.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;

import java.util.Objects;

/**
 * 基于 Jackson 的单值编解码器
 *
 * <p>每个会话值都以一段独立的 JSON 文本保存。</p>
 */
public class JsonValueCodec {

    private static final JsonValueCodec SHARED = new JsonValueCodec();

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public JsonValueCodec() {
        this(defaultObjectMapper());
    }

    public JsonValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 进程内共享的默认编解码器
     */
    public static JsonValueCodec shared() {
        return SHARED;
    }

    /**
     * 默认 ObjectMapper：自动注册模块（java.time 等），忽略未知字段，日期写为 ISO 文本，
     * 关闭标量之间的隐式转换（数字/布尔不能读成字符串，字符串不能读成数字/布尔，小数不能截断为整数）
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String encode(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public <T> T decode(String raw, JavaType type) throws JsonProcessingException {
        return objectMapper.readValue(raw, type);
    }

    public JavaType typeOf(Class<?> type) {
        return objectMapper.constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    /**
     * 判断一段文本是否为完整的 JSON 值（不允许尾随内容）
     */
    public boolean isValidJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        try {
            JsonNode node = strictReader.readTree(raw);
            return node != null && !node.isMissingNode();
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
