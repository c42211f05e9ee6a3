package com.deepknow.sessionoz.server.infra.memory;

import com.deepknow.sessionoz.api.session.SessionState;
import com.deepknow.sessionoz.api.session.SessionStateCodec;
import com.deepknow.sessionoz.api.store.SessionKey;
import com.deepknow.sessionoz.api.store.SessionStore;
import com.deepknow.sessionoz.api.store.SessionStoreException;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内会话存储
 *
 * <p>与 Redis 实现保持相同语义：保存编码后的 JSON 文本（而非对象引用），整体覆盖写入，按 ttl 过期。
 * 过期条目在访问时或调用 {@link #purgeExpired()} 时清理。适用于单节点部署和测试。</p>
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    public static final int DEFAULT_MAX_KEY_ATTEMPTS = 8;

    private final Map<String, StoredEntry> entries = new ConcurrentHashMap<>();
    private final SessionStateCodec codec;
    private final SessionKeyGenerator keyGenerator;
    private final Duration ttl;
    private final Clock clock;
    private final int maxKeyAttempts;

    public InMemorySessionStore() {
        this(new SessionStateCodec(), new SessionKeyGenerator(), null, Clock.systemUTC());
    }

    public InMemorySessionStore(Duration ttl) {
        this(new SessionStateCodec(), new SessionKeyGenerator(), ttl, Clock.systemUTC());
    }

    public InMemorySessionStore(SessionStateCodec codec, SessionKeyGenerator keyGenerator,
                                Duration ttl, Clock clock) {
        this(codec, keyGenerator, ttl, clock, DEFAULT_MAX_KEY_ATTEMPTS);
    }

    public InMemorySessionStore(SessionStateCodec codec, SessionKeyGenerator keyGenerator,
                                Duration ttl, Clock clock, int maxKeyAttempts) {
        this.codec = codec;
        this.keyGenerator = keyGenerator;
        this.ttl = ttl;
        this.clock = clock;
        this.maxKeyAttempts = Math.max(1, maxKeyAttempts);
    }

    @Override
    public SessionKey generateKey() {
        for (int attempt = 1; attempt <= maxKeyAttempts; attempt++) {
            SessionKey key = keyGenerator.generate();
            if (lookup(key) == null) {
                return key;
            }
            log.warn("[InMemorySessionStore] Generated key already in use, retrying: attempt={}", attempt);
        }
        throw SessionStoreException.keyExhausted(maxKeyAttempts);
    }

    @Override
    public Optional<SessionState> load(SessionKey key) {
        StoredEntry entry = lookup(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(entry.getBlob()));
    }

    @Override
    public void save(SessionKey key, SessionState state) {
        Instant expiresAt = expires() ? clock.instant().plus(ttl) : null;
        entries.put(key.value(), new StoredEntry(codec.encode(state), expiresAt));
        log.debug("[InMemorySessionStore] Session saved: key={}, entries={}", key.masked(), state.size());
    }

    @Override
    public void remove(SessionKey key) {
        entries.remove(key.value());
        log.debug("[InMemorySessionStore] Session removed: key={}", key.masked());
    }

    /**
     * 清理所有已过期条目
     *
     * @return 清理的条目数
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.info("[InMemorySessionStore] Purged expired sessions: count={}", purged);
        }
        return purged;
    }

    public int size() {
        return entries.size();
    }

    public int getMaxKeyAttempts() {
        return maxKeyAttempts;
    }

    private StoredEntry lookup(SessionKey key) {
        StoredEntry entry = entries.get(key.value());
        if (entry != null && entry.isExpired(clock.instant())) {
            entries.remove(key.value(), entry);
            return null;
        }
        return entry;
    }

    private boolean expires() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    @Getter
    @AllArgsConstructor
    private static final class StoredEntry {
        private final String blob;
        private final Instant expiresAt;

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
