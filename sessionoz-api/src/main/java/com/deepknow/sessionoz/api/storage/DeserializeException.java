package com.deepknow.sessionoz.api.storage;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;

/**
 * 已存储的值无法按请求的类型解码
 *
 * <p>当 {@link #getOperation()} 为 {@link StorageOperation#REMOVE} 时，对应的 key 已经被移除。</p>
 */
public class DeserializeException extends StorageException {

    public DeserializeException(StorageOperation operation, String key, Throwable cause) {
        super(SessionOzErrorCode.DESERIALIZE_FAILED, operation, key, cause);
    }
}
