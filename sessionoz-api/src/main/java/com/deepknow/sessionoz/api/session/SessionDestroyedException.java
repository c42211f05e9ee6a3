package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;

/**
 * 在已销毁的会话上执行读写操作
 */
public class SessionDestroyedException extends SessionException {

    public SessionDestroyedException() {
        super(SessionOzErrorCode.SESSION_DESTROYED);
    }
}
