package com.minimember.gateway.remote;

import java.util.concurrent.CompletableFuture;

/**
 * 远端调用通道。序列化与网络细节由实现方负责。
 *
 * <p>失败时 future 以 {@link RemoteException} 结束。</p>
 */
public interface RemoteTransport {

    <T> CompletableFuture<T> send(RemoteOperation<T> operation);
}
