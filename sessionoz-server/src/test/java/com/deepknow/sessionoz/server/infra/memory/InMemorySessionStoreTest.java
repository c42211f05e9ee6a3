package com.deepknow.sessionoz.server.infra.memory;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.session.Session;
import com.deepknow.sessionoz.api.session.SessionState;
import com.deepknow.sessionoz.api.session.SessionStateCodec;
import com.deepknow.sessionoz.api.store.SessionKey;
import com.deepknow.sessionoz.api.store.SessionStoreException;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class InMemorySessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    private InMemorySessionStore storeWithTtl(Duration ttl) {
        return new InMemorySessionStore(new SessionStateCodec(), new SessionKeyGenerator(), ttl, clock);
    }

    private static SessionState sampleState() {
        Session session = new Session();
        session.insert("cart", List.of("apple", "pear"));
        return session.toState();
    }

    @Test
    public void testSaveLoadRemove() {
        InMemorySessionStore store = new InMemorySessionStore();
        SessionKey key = store.generateKey();
        SessionState state = sampleState();

        assertTrue(store.load(key).isEmpty());
        store.save(key, state);
        assertEquals(Optional.of(state), store.load(key));

        store.remove(key);
        assertTrue(store.load(key).isEmpty());
        assertDoesNotThrow(() -> store.remove(key));
    }

    @Test
    public void testLoadedStateIsDetachedFromStore() {
        InMemorySessionStore store = new InMemorySessionStore();
        SessionKey key = store.generateKey();
        store.save(key, sampleState());

        Session session = Session.from(store.load(key).orElseThrow());
        session.insert("extra", 1);

        assertFalse(store.load(key).orElseThrow().containsKey("extra"));
    }

    @Test
    public void testEntriesExpireAfterTtl() {
        InMemorySessionStore store = storeWithTtl(Duration.ofMinutes(10));
        SessionKey key = store.generateKey();
        store.save(key, sampleState());

        clock.advance(Duration.ofMinutes(9));
        assertTrue(store.load(key).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(store.load(key).isEmpty());
    }

    @Test
    public void testSaveRefreshesExpiration() {
        InMemorySessionStore store = storeWithTtl(Duration.ofMinutes(10));
        SessionKey key = store.generateKey();
        store.save(key, sampleState());

        clock.advance(Duration.ofMinutes(8));
        store.save(key, sampleState());
        clock.advance(Duration.ofMinutes(8));

        assertTrue(store.load(key).isPresent());
    }

    @Test
    public void testPurgeExpired() {
        InMemorySessionStore store = storeWithTtl(Duration.ofMinutes(1));
        store.save(store.generateKey(), sampleState());
        store.save(store.generateKey(), sampleState());

        assertEquals(0, store.purgeExpired());
        clock.advance(Duration.ofMinutes(2));

        assertEquals(2, store.purgeExpired());
        assertEquals(0, store.size());
    }

    @Test
    public void testNoTtlNeverExpires() {
        InMemorySessionStore store = storeWithTtl(null);
        SessionKey key = store.generateKey();
        store.save(key, sampleState());

        clock.advance(Duration.ofDays(365));

        assertTrue(store.load(key).isPresent());
    }

    @Test
    public void testGeneratedKeysAreDistinct() {
        InMemorySessionStore store = new InMemorySessionStore();

        assertNotEquals(store.generateKey(), store.generateKey());
    }

    @Test
    public void testGenerateKeyHonoursConfiguredMaxAttempts() {
        SessionKey taken = SessionKey.of("taken-key");
        SessionKeyGenerator generator = mock(SessionKeyGenerator.class);
        when(generator.generate()).thenReturn(taken);
        InMemorySessionStore store = new InMemorySessionStore(new SessionStateCodec(), generator,
                null, clock, 3);
        store.save(taken, sampleState());

        SessionStoreException e = assertThrows(SessionStoreException.class, store::generateKey);

        assertEquals(SessionOzErrorCode.STORE_KEY_EXHAUSTED, e.getErrorCode());
        verify(generator, times(3)).generate();
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
