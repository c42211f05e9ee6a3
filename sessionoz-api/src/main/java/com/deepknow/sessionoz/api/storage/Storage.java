package com.deepknow.sessionoz.api.storage;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;

/**
 * 类型化键值存储抽象
 *
 * <p>任意值在写入时编码为统一的文本表示，读取时再按调用方请求的类型解码。</p>
 *
 * <ul>
 *   <li>{@code insert}：编码失败抛出 {@link SerializeException}，成功则无条件覆盖旧值</li>
 *   <li>{@code get}：不修改底层状态，解码失败抛出 {@link DeserializeException}，原始值保持不变</li>
 *   <li>{@code remove}：key 存在时<b>总是</b>移除；解码失败只影响返回值，异常抛出前槽位已经清空</li>
 * </ul>
 *
 * <p>key 不存在时 {@code get}/{@code remove} 返回 {@link Optional#empty()}，不视为错误。</p>
 *
 * @param <K> key 类型
 * @param <E> 存储失败时抛出的异常类型
 */
public interface Storage<K, E extends Exception> {

    void insert(K key, Object value) throws E;

    <T> Optional<T> remove(K key, Class<T> type) throws E;

    <T> Optional<T> remove(K key, TypeReference<T> type) throws E;

    <T> Optional<T> get(K key, Class<T> type) throws E;

    <T> Optional<T> get(K key, TypeReference<T> type) throws E;
}
