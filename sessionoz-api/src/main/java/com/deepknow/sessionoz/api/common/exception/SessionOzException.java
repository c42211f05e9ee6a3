package com.deepknow.sessionoz.api.common.exception;

/**
 * SessionOz 异常基类
 *
 * <p>所有错误都以带错误码的非受检异常抛给直接调用方，内部不做恢复</p>
 */
public class SessionOzException extends RuntimeException {

    private final SessionOzErrorCode errorCode;

    public SessionOzException(SessionOzErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public SessionOzException(SessionOzErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SessionOzException(SessionOzErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public SessionOzErrorCode getErrorCode() {
        return errorCode;
    }
}
