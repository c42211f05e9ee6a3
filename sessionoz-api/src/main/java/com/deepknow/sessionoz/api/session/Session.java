package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.storage.JsonValueCodec;
import com.deepknow.sessionoz.api.storage.StorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * 会话聚合：持有唯一一份 {@link SessionState}，并在其上叠加生命周期状态机
 *
 * <h3>规则</h3>
 * <ul>
 *   <li>所有操作先检查会话是否已销毁，已销毁的会话不会触碰底层数据</li>
 *   <li>insert/remove 成功后状态变为 {@link SessionStatus#CHANGED}；
 *       remove 即使 key 不存在也算一次修改</li>
 *   <li>remove 解码失败时 key 已被移除，但状态保持不变，随后抛出异常</li>
 *   <li>get 为纯读操作，不改变状态</li>
 * </ul>
 *
 * <p>非线程安全，一个会话只应属于一个进行中的请求。</p>
 */
@Slf4j
public class Session {

    private final SessionState state;
    private final SessionStateStorage storage;
    private SessionStatus status = SessionStatus.CLEAN;

    public Session() {
        this(new SessionState());
    }

    public Session(SessionState state) {
        this(state, JsonValueCodec.shared());
    }

    public Session(SessionState state, JsonValueCodec codec) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(codec, "codec");
        this.state = state.copy();
        this.storage = new SessionStateStorage(this.state, codec);
    }

    /**
     * 从已加载的状态恢复会话，初始状态总是 {@link SessionStatus#CLEAN}
     */
    public static Session from(SessionState state) {
        return new Session(state);
    }

    /**
     * 导出用于持久化的状态副本，生命周期状态不包含在内
     */
    public SessionState toState() {
        return state.copy();
    }

    public void insert(String key, Object value) {
        ensureActive();
        try {
            storage.insert(key, value);
        } catch (StorageException e) {
            throw new SessionStorageException(e);
        }
        status = SessionStatus.CHANGED;
    }

    public <T> Optional<T> remove(String key, Class<T> type) {
        ensureActive();
        return removeWith(() -> storage.remove(key, type));
    }

    public <T> Optional<T> remove(String key, TypeReference<T> type) {
        ensureActive();
        return removeWith(() -> storage.remove(key, type));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        ensureActive();
        return getWith(() -> storage.get(key, type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        ensureActive();
        return getWith(() -> storage.get(key, type));
    }

    /**
     * 标记会话销毁，幂等且不可逆
     */
    public void destroy() {
        if (status != SessionStatus.DESTROYED) {
            log.debug("[Session] destroyed, keys={}", state.size());
        }
        status = SessionStatus.DESTROYED;
    }

    public boolean isActive() {
        return status != SessionStatus.DESTROYED;
    }

    public boolean isChanged() {
        return status == SessionStatus.CHANGED;
    }

    public SessionStatus getStatus() {
        return status;
    }

    private void ensureActive() {
        if (!isActive()) {
            throw new SessionDestroyedException();
        }
    }

    private <T> Optional<T> removeWith(StorageCall<Optional<T>> call) {
        try {
            Optional<T> removed = call.execute();
            status = SessionStatus.CHANGED;
            return removed;
        } catch (StorageException e) {
            throw new SessionStorageException(e);
        }
    }

    private <T> Optional<T> getWith(StorageCall<Optional<T>> call) {
        try {
            return call.execute();
        } catch (StorageException e) {
            throw new SessionStorageException(e);
        }
    }

    @FunctionalInterface
    private interface StorageCall<R> {
        R execute();
    }
}
