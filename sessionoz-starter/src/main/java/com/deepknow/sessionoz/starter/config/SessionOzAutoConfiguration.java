package com.deepknow.sessionoz.starter.config;

import com.deepknow.sessionoz.api.session.SessionStateCodec;
import com.deepknow.sessionoz.api.storage.JsonValueCodec;
import com.deepknow.sessionoz.api.store.SessionStore;
import com.deepknow.sessionoz.server.infra.memory.InMemorySessionStore;
import com.deepknow.sessionoz.server.infra.redis.RedisSessionStore;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import com.deepknow.sessionoz.server.manager.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * SessionOz 自动配置
 *
 * <p>容器中存在 {@link StringRedisTemplate} 时使用 {@link RedisSessionStore}，
 * 否则退回 {@link InMemorySessionStore}。任何一个 Bean 都可以由应用自行覆盖。</p>
 */
@Slf4j
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(SessionOzProperties.class)
@ConditionalOnProperty(prefix = "sessionoz", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionOzAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JsonValueCodec sessionOzValueCodec() {
        return new JsonValueCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStateCodec sessionStateCodec(JsonValueCodec valueCodec) {
        return new SessionStateCodec(valueCodec);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionKeyGenerator sessionKeyGenerator(SessionOzProperties properties) {
        return new SessionKeyGenerator(properties.getStore().getKeyLength());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnBean(StringRedisTemplate.class)
    static class RedisStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(SessionStore.class)
        public RedisSessionStore redisSessionStore(StringRedisTemplate redisTemplate,
                                                   SessionStateCodec codec,
                                                   SessionKeyGenerator keyGenerator,
                                                   SessionOzProperties properties) {
            SessionOzProperties.Store store = properties.getStore();
            log.info("[SessionOz] 使用 Redis 会话存储: prefix={}, ttl={}", store.getKeyPrefix(), store.getTtl());
            return new RedisSessionStore(redisTemplate, codec, keyGenerator,
                    store.getKeyPrefix(), store.getTtl(), store.getMaxKeyAttempts());
        }
    }

    /**
     * 未配置 Redis 时的进程内存储
     */
    @Bean
    @ConditionalOnMissingBean(SessionStore.class)
    public InMemorySessionStore inMemorySessionStore(SessionStateCodec codec,
                                                     SessionKeyGenerator keyGenerator,
                                                     SessionOzProperties properties) {
        log.warn("[SessionOz] 未发现 StringRedisTemplate，使用进程内会话存储");
        SessionOzProperties.Store store = properties.getStore();
        return new InMemorySessionStore(codec, keyGenerator, store.getTtl(), Clock.systemUTC(),
                store.getMaxKeyAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionManager sessionManager(SessionStore store, JsonValueCodec valueCodec) {
        return new SessionManager(store, valueCodec);
    }
}
