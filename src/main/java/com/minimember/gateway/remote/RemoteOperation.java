package com.minimember.gateway.remote;

/**
 * 一次远端调用。T 为成功时的返回类型。
 */
public interface RemoteOperation<T> {

    long conversationId();

    default String name() {
        return getClass().getSimpleName();
    }
}
