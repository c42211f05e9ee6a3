package com.deepknow.sessionoz.server.infra.redis;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.session.Session;
import com.deepknow.sessionoz.api.session.SessionState;
import com.deepknow.sessionoz.api.session.SessionStateCodec;
import com.deepknow.sessionoz.api.store.SessionKey;
import com.deepknow.sessionoz.api.store.SessionStoreException;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class RedisSessionStoreTest {

    private final Map<String, String> redis = new HashMap<>();
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenAnswer(inv -> redis.get(inv.<String>getArgument(0)));
        doAnswer(inv -> redis.put(inv.getArgument(0), inv.getArgument(1)))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));
        doAnswer(inv -> redis.put(inv.getArgument(0), inv.getArgument(1)))
                .when(valueOps).set(anyString(), anyString());
        when(redisTemplate.delete(anyString())).thenAnswer(inv -> redis.remove(inv.<String>getArgument(0)) != null);
        when(redisTemplate.hasKey(anyString())).thenAnswer(inv -> redis.containsKey(inv.<String>getArgument(0)));
    }

    private RedisSessionStore newStore() {
        return new RedisSessionStore(redisTemplate);
    }

    private static SessionState sampleState() {
        Session session = new Session();
        session.insert("user", Map.of("username", "brandon", "password", "hunter2"));
        session.insert("visits", 7);
        return session.toState();
    }

    @Test
    public void testSaveThenLoadOnFreshStoreHandle() {
        SessionKey key = SessionKey.of("abcdefghijklmnop");
        SessionState state = sampleState();

        newStore().save(key, state);
        Optional<SessionState> loaded = newStore().load(key);

        assertEquals(Optional.of(state), loaded);
    }

    @Test
    public void testRemoveThenLoadReturnsEmpty() {
        RedisSessionStore store = newStore();
        SessionKey key = SessionKey.of("abcdefghijklmnop");
        store.save(key, sampleState());

        store.remove(key);

        assertTrue(newStore().load(key).isEmpty());
    }

    @Test
    public void testRemoveOfMissingKeyIsNotAnError() {
        assertDoesNotThrow(() -> newStore().remove(SessionKey.of("missing-key")));
    }

    @Test
    public void testLoadOfMissingKeyReturnsEmpty() {
        assertTrue(newStore().load(SessionKey.of("missing-key")).isEmpty());
    }

    @Test
    public void testNamespacePrefixAppliedExactlyOnce() {
        RedisSessionStore store = newStore();
        SessionKey key = SessionKey.of("abcdefghijklmnop");

        store.save(key, sampleState());

        assertEquals(List.of("sessionoz:session:abcdefghijklmnop"), List.copyOf(redis.keySet()));
        assertEquals("sessionoz:session:abcdefghijklmnop", store.redisKey(key));
    }

    @Test
    public void testSaveSetsTtlAtomically() {
        RedisSessionStore store = new RedisSessionStore(redisTemplate, new SessionStateCodec(),
                new SessionKeyGenerator(), "app:", Duration.ofMinutes(30), 3);
        SessionKey key = SessionKey.of("abcdefghijklmnop");

        store.save(key, sampleState());

        verify(valueOps).set(eq("app:abcdefghijklmnop"), anyString(), eq(Duration.ofMinutes(30)));
        verify(valueOps, never()).set(anyString(), anyString());
    }

    @Test
    public void testZeroTtlSavesWithoutExpiry() {
        RedisSessionStore store = new RedisSessionStore(redisTemplate, new SessionStateCodec(),
                new SessionKeyGenerator(), "app:", Duration.ZERO, 3);
        SessionKey key = SessionKey.of("abcdefghijklmnop");

        store.save(key, sampleState());

        verify(valueOps).set(eq("app:abcdefghijklmnop"), anyString());
        assertFalse(store.refresh(key));
    }

    @Test
    public void testSaveFullyReplacesPreviousValue() {
        RedisSessionStore store = newStore();
        SessionKey key = SessionKey.of("abcdefghijklmnop");
        store.save(key, sampleState());

        Session session = new Session();
        session.insert("only", "this");
        store.save(key, session.toState());

        SessionState loaded = store.load(key).orElseThrow();
        assertEquals(1, loaded.size());
        assertTrue(loaded.containsKey("only"));
    }

    @Test
    public void testCorruptEntryIsReportedNotHidden() {
        redis.put("sessionoz:session:abcdefghijklmnop", "{\"user\":42}");

        SessionStoreException e = assertThrows(SessionStoreException.class,
                () -> newStore().load(SessionKey.of("abcdefghijklmnop")));

        assertEquals(SessionOzErrorCode.STORE_CORRUPT_ENTRY, e.getErrorCode());
    }

    @Test
    public void testBackendFailureBecomesStoreUnavailable() {
        when(valueOps.get(anyString())).thenThrow(new QueryTimeoutException("redis timed out"));

        SessionStoreException e = assertThrows(SessionStoreException.class,
                () -> newStore().load(SessionKey.of("abcdefghijklmnop")));

        assertEquals(SessionOzErrorCode.STORE_UNAVAILABLE, e.getErrorCode());
        assertInstanceOf(QueryTimeoutException.class, e.getCause());
        assertFalse(e.getMessage().contains("abcdefghijklmnop"));
    }

    @Test
    public void testGenerateKeyReturnsUnusedKey() {
        SessionKey key = newStore().generateKey();

        assertFalse(redis.containsKey("sessionoz:session:" + key.value()));
        assertEquals(43, key.value().length());
    }

    @Test
    public void testGenerateKeyRetriesOnCollision() {
        SessionKeyGenerator generator = mock(SessionKeyGenerator.class);
        SessionKey taken = SessionKey.of("takentakentakentaken");
        SessionKey free = SessionKey.of("freefreefreefreefree");
        when(generator.generate()).thenReturn(taken, free);
        redis.put("sessionoz:session:" + taken.value(), "{}");
        RedisSessionStore store = new RedisSessionStore(redisTemplate, new SessionStateCodec(), generator,
                RedisSessionStore.DEFAULT_PREFIX, RedisSessionStore.DEFAULT_TTL, 3);

        assertEquals(free, store.generateKey());
    }

    @Test
    public void testGenerateKeyGivesUpAfterMaxAttempts() {
        when(redisTemplate.hasKey(anyString())).thenReturn(true);
        RedisSessionStore store = new RedisSessionStore(redisTemplate, new SessionStateCodec(),
                new SessionKeyGenerator(), RedisSessionStore.DEFAULT_PREFIX, RedisSessionStore.DEFAULT_TTL, 2);

        SessionStoreException e = assertThrows(SessionStoreException.class, store::generateKey);

        assertEquals(SessionOzErrorCode.STORE_KEY_EXHAUSTED, e.getErrorCode());
        verify(redisTemplate, times(2)).hasKey(anyString());
    }

    @Test
    public void testRefreshReappliesTtl() {
        when(redisTemplate.expire(anyString(), any(Duration.class))).thenReturn(true);
        RedisSessionStore store = newStore();
        SessionKey key = SessionKey.of("abcdefghijklmnop");

        assertTrue(store.refresh(key));
        verify(redisTemplate).expire("sessionoz:session:abcdefghijklmnop", RedisSessionStore.DEFAULT_TTL);
    }
}
