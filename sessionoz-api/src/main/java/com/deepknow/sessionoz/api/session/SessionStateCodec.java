package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.storage.JsonValueCodec;
import com.deepknow.sessionoz.api.store.SessionStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 整个 {@link SessionState} 的持久化编解码
 *
 * <p>持久化格式为一个 JSON 对象，字段为会话 key，字段值为该 key 对应值的 JSON 文本（字符串形式），例如：</p>
 * <pre>
 * {"user":"{\"username\":\"brandon\",\"password\":\"hunter2\"}","visits":"3"}
 * </pre>
 */
public class SessionStateCodec {

    private final JsonValueCodec valueCodec;
    private final ObjectMapper objectMapper;

    public SessionStateCodec() {
        this(JsonValueCodec.shared());
    }

    public SessionStateCodec(JsonValueCodec valueCodec) {
        this.valueCodec = valueCodec;
        this.objectMapper = valueCodec.getObjectMapper();
    }

    public String encode(SessionState state) {
        try {
            return objectMapper.writeValueAsString(state.asMap());
        } catch (JsonProcessingException e) {
            throw new SessionStoreException(SessionOzErrorCode.STORE_ENCODE_FAILED,
                    SessionOzErrorCode.STORE_ENCODE_FAILED.getMessage(), e);
        }
    }

    /**
     * 解码持久化文本；非对象、非字符串字段或字段值不是合法 JSON 时视为损坏条目
     */
    public SessionState decode(String blob) {
        JsonNode root;
        try {
            root = objectMapper.readTree(blob);
        } catch (JsonProcessingException e) {
            throw corrupt("blob is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw corrupt("blob is not a JSON object", null);
        }
        Map<String, String> entries = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isTextual()) {
                throw corrupt("value of '" + field.getKey() + "' is not a string", null);
            }
            if (!valueCodec.isValidJson(value.textValue())) {
                throw corrupt("value of '" + field.getKey() + "' is not an encoded value", null);
            }
            entries.put(field.getKey(), value.textValue());
        }
        return new SessionState(entries);
    }

    private static SessionStoreException corrupt(String reason, Throwable cause) {
        return new SessionStoreException(SessionOzErrorCode.STORE_CORRUPT_ENTRY,
                SessionOzErrorCode.STORE_CORRUPT_ENTRY.getMessage() + ": " + reason, cause);
    }
}
