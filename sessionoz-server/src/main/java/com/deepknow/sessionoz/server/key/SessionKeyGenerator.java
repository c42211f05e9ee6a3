package com.deepknow.sessionoz.server.key;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.common.exception.SessionOzException;
import com.deepknow.sessionoz.api.store.SessionKey;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 会话 Key 生成器
 *
 * <p>SecureRandom 生成随机字节，URL-safe Base64（无填充）编码。默认 32 字节，即 256 bit 熵。</p>
 */
public class SessionKeyGenerator {

    public static final int DEFAULT_BYTE_LENGTH = 32;

    // 低于 128 bit 不能作为凭证使用
    private static final int MIN_BYTE_LENGTH = 16;

    private final SecureRandom random;
    private final int byteLength;

    public SessionKeyGenerator() {
        this(new SecureRandom(), DEFAULT_BYTE_LENGTH);
    }

    public SessionKeyGenerator(int byteLength) {
        this(new SecureRandom(), byteLength);
    }

    public SessionKeyGenerator(SecureRandom random, int byteLength) {
        if (byteLength < MIN_BYTE_LENGTH) {
            throw new SessionOzException(SessionOzErrorCode.INVALID_PARAM,
                    "Session key length must be at least " + MIN_BYTE_LENGTH + " bytes");
        }
        this.random = random;
        this.byteLength = byteLength;
    }

    public SessionKey generate() {
        byte[] bytes = new byte[byteLength];
        random.nextBytes(bytes);
        return SessionKey.of(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes));
    }

    public int getByteLength() {
        return byteLength;
    }
}
