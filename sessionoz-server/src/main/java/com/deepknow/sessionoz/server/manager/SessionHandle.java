package com.deepknow.sessionoz.server.manager;

import com.deepknow.sessionoz.api.session.Session;
import com.deepknow.sessionoz.api.store.SessionKey;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 一次请求内使用的会话及其 key
 */
@Getter
@RequiredArgsConstructor
public class SessionHandle {

    private final SessionKey key;
    private final Session session;

    /**
     * 是否为本次请求新建（后端尚无条目）
     */
    private final boolean fresh;
}
