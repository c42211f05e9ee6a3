package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.storage.DeserializeException;
import com.deepknow.sessionoz.api.storage.JsonValueCodec;
import com.deepknow.sessionoz.api.storage.SerializeException;
import com.deepknow.sessionoz.api.storage.Storage;
import com.deepknow.sessionoz.api.storage.StorageException;
import com.deepknow.sessionoz.api.storage.StorageOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;

import java.util.Objects;
import java.util.Optional;

/**
 * 在 {@link SessionState} 上实现的 JSON 类型化存储
 */
class SessionStateStorage implements Storage<String, StorageException> {

    private final SessionState state;
    private final JsonValueCodec codec;

    SessionStateStorage(SessionState state, JsonValueCodec codec) {
        this.state = state;
        this.codec = codec;
    }

    @Override
    public void insert(String key, Object value) {
        Objects.requireNonNull(key, "key");
        String encoded;
        try {
            encoded = codec.encode(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializeException(key, e);
        }
        state.put(key, encoded);
    }

    @Override
    public <T> Optional<T> remove(String key, Class<T> type) {
        return remove(key, codec.typeOf(type));
    }

    @Override
    public <T> Optional<T> remove(String key, TypeReference<T> type) {
        return remove(key, codec.typeOf(type));
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, codec.typeOf(type));
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, codec.typeOf(type));
    }

    private <T> Optional<T> remove(String key, JavaType type) {
        Objects.requireNonNull(key, "key");
        // 先移除再解码：解码失败时槽位同样被清空
        Optional<String> raw = state.remove(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return decode(StorageOperation.REMOVE, key, raw.get(), type);
    }

    private <T> Optional<T> get(String key, JavaType type) {
        Objects.requireNonNull(key, "key");
        Optional<String> raw = state.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return decode(StorageOperation.GET, key, raw.get(), type);
    }

    private <T> Optional<T> decode(StorageOperation operation, String key, String raw, JavaType type) {
        try {
            T value = codec.decode(raw, type);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DeserializeException(operation, key, e);
        }
    }
}
