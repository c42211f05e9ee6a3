package com.deepknow.sessionoz.api.storage;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.common.exception.SessionOzException;

/**
 * 类型化存储异常
 *
 * <p>只有两种具体类型：{@link SerializeException} 和 {@link DeserializeException}。
 * 两者都携带出错的 key 以及所在的操作。</p>
 */
public abstract class StorageException extends SessionOzException {

    private final String key;
    private final StorageOperation operation;

    protected StorageException(SessionOzErrorCode errorCode, StorageOperation operation,
                               String key, Throwable cause) {
        super(errorCode, String.format("%s: operation=%s, key=%s, cause=%s",
                errorCode.getMessage(), operation, key, describe(cause)), cause);
        this.key = key;
        this.operation = operation;
    }

    public String getKey() {
        return key;
    }

    public StorageOperation getOperation() {
        return operation;
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown" : cause.getMessage();
    }
}
