package com.deepknow.sessionoz.server.manager;

/**
 * 请求结束时对后端执行的动作
 */
public enum CommitOutcome {
    SAVED,      // 状态 CHANGED，已整体写回
    REMOVED,    // 会话已销毁，后端条目已删除
    SKIPPED     // 状态 CLEAN，无需写入
}
