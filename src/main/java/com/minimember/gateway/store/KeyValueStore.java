package com.minimember.gateway.store;

/**
 * 键值持久化，只被管理员列表使用。未命中返回 null。
 */
public interface KeyValueStore {

    byte[] get(String key);

    void set(String key, byte[] value);

    void erase(String key);
}
