package com.deepknow.sessionoz.api.store;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.common.exception.SessionOzException;

/**
 * 后端存储异常：网络/后端故障、条目损坏或无法分配 key
 */
public class SessionStoreException extends SessionOzException {

    public SessionStoreException(SessionOzErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public SessionStoreException(SessionOzErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static SessionStoreException unavailable(String operation, SessionKey key, Throwable cause) {
        return new SessionStoreException(SessionOzErrorCode.STORE_UNAVAILABLE,
                String.format("%s: operation=%s, key=%s", SessionOzErrorCode.STORE_UNAVAILABLE.getMessage(),
                        operation, key == null ? "-" : key.masked()), cause);
    }

    public static SessionStoreException keyExhausted(int attempts) {
        return new SessionStoreException(SessionOzErrorCode.STORE_KEY_EXHAUSTED,
                String.format("%s: attempts=%d", SessionOzErrorCode.STORE_KEY_EXHAUSTED.getMessage(), attempts));
    }
}
