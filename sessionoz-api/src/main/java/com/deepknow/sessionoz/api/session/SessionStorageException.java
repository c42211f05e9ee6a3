package com.deepknow.sessionoz.api.session;

import com.deepknow.sessionoz.api.common.exception.SessionOzErrorCode;
import com.deepknow.sessionoz.api.storage.StorageException;

/**
 * 包装底层存储层的编解码错误
 */
public class SessionStorageException extends SessionException {

    private final StorageException storageError;

    public SessionStorageException(StorageException storageError) {
        super(SessionOzErrorCode.SESSION_STORAGE_ERROR, storageError.getMessage(), storageError);
        this.storageError = storageError;
    }

    /**
     * 原始的 {@link com.deepknow.sessionoz.api.storage.SerializeException}
     * 或 {@link com.deepknow.sessionoz.api.storage.DeserializeException}
     */
    public StorageException getStorageError() {
        return storageError;
    }
}
