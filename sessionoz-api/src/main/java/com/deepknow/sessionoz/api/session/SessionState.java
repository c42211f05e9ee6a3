package com.deepknow.sessionoz.api.session;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 会话的原始键值数据，也是持久化的最小单位
 *
 * <p>value 为某个值的 JSON 编码文本。修改入口仅对同包的存储层开放，
 * 外部代码只能读取，所有写操作都经由 {@link Session}。</p>
 */
public final class SessionState {

    private final Map<String, String> entries;

    public SessionState() {
        this.entries = new HashMap<>();
    }

    SessionState(Map<String, String> entries) {
        this.entries = new HashMap<>(entries);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public SessionState copy() {
        return new SessionState(entries);
    }

    void put(String key, String encoded) {
        entries.put(key, encoded);
    }

    Optional<String> remove(String key) {
        return Optional.ofNullable(entries.remove(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionState)) {
            return false;
        }
        return entries.equals(((SessionState) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        // 只输出 key，value 可能包含敏感数据
        return "SessionState{keys=" + entries.keySet() + "}";
    }
}
