package com.deepknow.sessionoz.starter.config;

import com.deepknow.sessionoz.server.infra.redis.RedisSessionStore;
import com.deepknow.sessionoz.server.key.SessionKeyGenerator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "sessionoz")
public class SessionOzProperties {

    /**
     * 是否启用会话存储自动配置
     */
    private boolean enabled = true;

    private Store store = new Store();

    @Data
    public static class Store {

        /**
         * 后端 key 命名空间前缀
         */
        private String keyPrefix = RedisSessionStore.DEFAULT_PREFIX;

        /**
         * 会话过期时间，每次保存时刷新；0 表示不过期
         */
        private Duration ttl = RedisSessionStore.DEFAULT_TTL;

        /**
         * 随机 key 的字节数
         */
        private int keyLength = SessionKeyGenerator.DEFAULT_BYTE_LENGTH;

        /**
         * 生成 key 时遇到冲突的最大尝试次数
         */
        private int maxKeyAttempts = RedisSessionStore.DEFAULT_MAX_KEY_ATTEMPTS;
    }
}
