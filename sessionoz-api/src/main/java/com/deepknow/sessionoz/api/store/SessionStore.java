package com.deepknow.sessionoz.api.store;

import com.deepknow.sessionoz.api.session.SessionState;

import java.util.Optional;

/**
 * 会话持久化契约
 *
 * <p>实现类只接收和返回 {@link SessionState}，从不持有 {@code Session}。
 * 所有方法都必须可以被多个线程并发调用；同一 key 的并发保存采用"最后一次 save 生效"，
 * 不提供乐观锁或 CAS。超时与重试由后端客户端负责。</p>
 *
 * <p>失败时抛出 {@link SessionStoreException}。</p>
 */
public interface SessionStore {

    /**
     * 生成一个当前未被占用的新 key
     */
    SessionKey generateKey();

    /**
     * 读取 key 对应的完整状态；不存在时返回 empty，调用方应自行创建空会话。
     * 存储内容无法解码时抛出 {@code STORE_CORRUPT_ENTRY}，不会返回空状态。
     */
    Optional<SessionState> load(SessionKey key);

    /**
     * 原子地整体覆盖写入，可同时刷新过期时间
     */
    void save(SessionKey key, SessionState state);

    /**
     * 删除 key 对应的条目，key 不存在不算错误
     */
    void remove(SessionKey key);
}
