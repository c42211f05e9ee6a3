package com.deepknow.sessionoz.server.infra.redis;

import com.deepknow.sessionoz.api.session.SessionState;
import com.deepknow.sessionoz.api.session.SessionStateCodec;
import com.deepknow.sessionoz.api.store.SessionKey;
import com.deepknow.sessionoz.api.store.SessionStore;
import com.deepknow.sessionoz.api.store.SessionStoreException;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * 基于 Redis 的会话存储
 *
 * <h3>设计</h3>
 * <ul>
 *   <li>每个会话一个 String 条目：{@code keyPrefix + sessionKey} -> 整个 SessionState 的 JSON</li>
 *   <li>save 使用 {@code SET key value EX ttl}，一次写入整体覆盖并刷新过期时间</li>
 *   <li>ttl 为 null、0 或负数表示不过期</li>
 *   <li>并发 save 同一个 key 时后写覆盖先写（last save wins），不做 CAS</li>
 * </ul>
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

    public static final String DEFAULT_PREFIX = "sessionoz:session:";
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);
    public static final int DEFAULT_MAX_KEY_ATTEMPTS = 8;

    private final StringRedisTemplate redisTemplate;
    private final SessionStateCodec codec;
    private final SessionKeyGenerator keyGenerator;
    private final String keyPrefix;
    private final Duration ttl;
    private final int maxKeyAttempts;

    public RedisSessionStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, new SessionStateCodec(), new SessionKeyGenerator(),
                DEFAULT_PREFIX, DEFAULT_TTL, DEFAULT_MAX_KEY_ATTEMPTS);
    }

    public RedisSessionStore(StringRedisTemplate redisTemplate, SessionStateCodec codec,
                             SessionKeyGenerator keyGenerator, String keyPrefix,
                             Duration ttl, int maxKeyAttempts) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.keyGenerator = keyGenerator;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.ttl = ttl;
        this.maxKeyAttempts = Math.max(1, maxKeyAttempts);
    }

    @Override
    public SessionKey generateKey() {
        for (int attempt = 1; attempt <= maxKeyAttempts; attempt++) {
            SessionKey key = keyGenerator.generate();
            Boolean exists;
            try {
                exists = redisTemplate.hasKey(redisKey(key));
            } catch (DataAccessException e) {
                log.error("[RedisSessionStore] Failed to check key: key={}", key.masked(), e);
                throw SessionStoreException.unavailable("generateKey", key, e);
            }
            if (!Boolean.TRUE.equals(exists)) {
                return key;
            }
            log.warn("[RedisSessionStore] Generated key already in use, retrying: attempt={}", attempt);
        }
        throw SessionStoreException.keyExhausted(maxKeyAttempts);
    }

    @Override
    public Optional<SessionState> load(SessionKey key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(redisKey(key));
        } catch (DataAccessException e) {
            log.error("[RedisSessionStore] Failed to load session: key={}", key.masked(), e);
            throw SessionStoreException.unavailable("load", key, e);
        }
        if (json == null) {
            log.debug("[RedisSessionStore] Session not found: key={}", key.masked());
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(json));
        } catch (SessionStoreException e) {
            log.error("[RedisSessionStore] Corrupt session entry: key={}, reason={}", key.masked(), e.getMessage());
            throw e;
        }
    }

    @Override
    public void save(SessionKey key, SessionState state) {
        String json = codec.encode(state);
        String redisKey = redisKey(key);
        try {
            if (expires()) {
                redisTemplate.opsForValue().set(redisKey, json, ttl);
            } else {
                redisTemplate.opsForValue().set(redisKey, json);
            }
        } catch (DataAccessException e) {
            log.error("[RedisSessionStore] Failed to save session: key={}", key.masked(), e);
            throw SessionStoreException.unavailable("save", key, e);
        }
        log.debug("[RedisSessionStore] Session saved: key={}, entries={}", key.masked(), state.size());
    }

    @Override
    public void remove(SessionKey key) {
        try {
            redisTemplate.delete(redisKey(key));
        } catch (DataAccessException e) {
            log.error("[RedisSessionStore] Failed to remove session: key={}", key.masked(), e);
            throw SessionStoreException.unavailable("remove", key, e);
        }
        log.debug("[RedisSessionStore] Session removed: key={}", key.masked());
    }

    /**
     * 只刷新过期时间，不重写内容
     *
     * @return 条目存在且刷新成功时为 true；未配置过期时间时总是 false
     */
    public boolean refresh(SessionKey key) {
        if (!expires()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.expire(redisKey(key), ttl));
        } catch (DataAccessException e) {
            log.error("[RedisSessionStore] Failed to refresh session: key={}", key.masked(), e);
            throw SessionStoreException.unavailable("refresh", key, e);
        }
    }

    /**
     * 命名空间前缀只在这里追加
     */
    public String redisKey(SessionKey key) {
        return keyPrefix + key.value();
    }

    public Duration getTtl() {
        return ttl;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    private boolean expires() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
