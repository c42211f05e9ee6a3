package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.common.exception.SessionOzException;

/**
 * {@link Session} 操作异常基类
 */
public abstract class SessionException extends SessionOzException {

    protected SessionException(SessionOzErrorCode errorCode) {
        super(errorCode);
    }

    protected SessionException(SessionOzErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
