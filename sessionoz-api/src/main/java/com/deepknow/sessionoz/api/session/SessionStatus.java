package com.deepknow.sessionoz.api.session;

/**
 * 会话生命周期状态
 *
 * <pre>
 * CLEAN   --insert/remove--> CHANGED
 * CLEAN   --destroy-->       DESTROYED
 * CHANGED --destroy-->       DESTROYED
 * </pre>
 *
 * DESTROYED 为终态。
 */
public enum SessionStatus {
    CLEAN,      // 加载后未修改
    CHANGED,    // 至少一次 insert/remove 成功，需要保存
    DESTROYED   // 已显式结束，后端条目应删除
}
