package com.deepknow.sessionoz.api.storage;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;

/**
 * 值无法编码为存储格式（不支持的类型或编码器内部错误）
 */
public class SerializeException extends StorageException {

    public SerializeException(String key, Throwable cause) {
        super(SessionOzErrorCode.SERIALIZE_FAILED, StorageOperation.INSERT, key, cause);
    }
}
