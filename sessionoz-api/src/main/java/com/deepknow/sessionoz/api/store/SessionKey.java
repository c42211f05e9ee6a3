package com.deepknow.sessionoz.api.store;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.common.exception.SessionOzException;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * 会话 Key：不透明、不可变的后端查找标识
 *
 * <p>Key 本身不包含后端命名空间前缀，前缀由具体的 {@link SessionStore} 实现追加且只追加一次。
 * 作为凭证使用时必须由密码学安全的随机源生成。</p>
 */
@EqualsAndHashCode
public final class SessionKey {

    public static final int MAX_LENGTH = 256;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_\\-.]+");

    private final String value;

    private SessionKey(String value) {
        this.value = value;
    }

    /**
     * @throws SessionOzException key 为空、过长或包含 URL 不安全字符时
     */
    public static SessionKey of(String value) {
        if (value == null || value.isEmpty()) {
            throw new SessionOzException(SessionOzErrorCode.INVALID_PARAM, "Session key must not be empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw new SessionOzException(SessionOzErrorCode.INVALID_PARAM,
                    "Session key is longer than " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new SessionOzException(SessionOzErrorCode.INVALID_PARAM,
                    "Session key contains unsupported characters");
        }
        return new SessionKey(value);
    }

    public String value() {
        return value;
    }

    public byte[] toBytes() {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 用于日志输出的脱敏形式
     */
    public String masked() {
        if (value.length() <= 8) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "SessionKey(" + masked() + ")";
    }
}
