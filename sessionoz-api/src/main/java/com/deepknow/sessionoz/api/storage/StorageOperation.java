package com.deepknow.sessionoz.api.storage;

/**
 * 触发存储错误的操作类型
 */
public enum StorageOperation {
    INSERT,
    GET,
    REMOVE
}
