package com.deepknow.sessionoz.server.manager;

import com.deepknow.sessionoz.api.session.Session;
import com.deepknow.sessionoz.api.session.SessionState;
import com.deepknow.sessionoz.api.session.SessionStatus;
import com.deepknow.sessionoz.api.storage.JsonValueCodec;
import com.deepknow.sessionoz.api.store.SessionKey;
import com.deepknow.sessionoz.api.store.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 会话管理器：把 {@link Session} 与 {@link SessionStore} 串起来
 *
 * <h3>请求结束时的提交策略</h3>
 * <ul>
 *   <li>会话已销毁 -> {@link SessionStore#remove}</li>
 *   <li>状态 CHANGED -> {@link SessionStore#save}</li>
 *   <li>状态 CLEAN -> 跳过后端写入</li>
 * </ul>
 */
@Slf4j
public class SessionManager {

    private final SessionStore store;
    private final JsonValueCodec codec;

    public SessionManager(SessionStore store) {
        this(store, JsonValueCodec.shared());
    }

    public SessionManager(SessionStore store, JsonValueCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * 创建新会话，key 由存储分配。后端在首次 commit 之前不会有条目。
     */
    public SessionHandle create() {
        SessionKey key = store.generateKey();
        log.debug("[SessionManager] Session created: key={}", key.masked());
        return new SessionHandle(key, new Session(new SessionState(), codec), true);
    }

    /**
     * 按 key 打开会话；后端不存在时返回一个空的新会话
     */
    public SessionHandle open(SessionKey key) {
        Optional<SessionState> state = store.load(key);
        if (state.isEmpty()) {
            log.debug("[SessionManager] Session not found, starting empty: key={}", key.masked());
            return new SessionHandle(key, new Session(new SessionState(), codec), true);
        }
        return new SessionHandle(key, new Session(state.get(), codec), false);
    }

    public CommitOutcome commit(SessionHandle handle) {
        return commit(handle.getKey(), handle.getSession());
    }

    public CommitOutcome commit(SessionKey key, Session session) {
        SessionStatus status = session.getStatus();
        switch (status) {
            case DESTROYED:
                store.remove(key);
                log.debug("[SessionManager] Commit: key={}, outcome={}", key.masked(), CommitOutcome.REMOVED);
                return CommitOutcome.REMOVED;
            case CHANGED:
                store.save(key, session.toState());
                log.debug("[SessionManager] Commit: key={}, outcome={}", key.masked(), CommitOutcome.SAVED);
                return CommitOutcome.SAVED;
            default:
                return CommitOutcome.SKIPPED;
        }
    }

    public SessionStore getStore() {
        return store;
    }
}
