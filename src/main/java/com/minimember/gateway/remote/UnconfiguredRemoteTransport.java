package com.minimember.gateway.remote;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 默认实现：没有接入真实远端时所有调用都以 503 失败。宿主应用提供自己的 {@link RemoteTransport} bean 覆盖它。
 */
@Slf4j
public class UnconfiguredRemoteTransport implements RemoteTransport {

    public static final String ERROR = "TRANSPORT_NOT_CONFIGURED";

    @Override
    public <T> CompletableFuture<T> send(RemoteOperation<T> operation) {
        log.warn("remote transport not configured: op={}, conversationId={}", operation.name(), operation.conversationId());
        return CompletableFuture.failedFuture(new RemoteException(503, ERROR));
    }
}
