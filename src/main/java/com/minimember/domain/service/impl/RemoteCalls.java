package com.minimember.domain.service.impl;

import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipException;
import com.minimember.domain.service.MembershipLifecycle;
import com.minimember.gateway.remote.RemoteException;
import com.minimember.gateway.remote.RemoteOperation;
import com.minimember.gateway.remote.RemoteTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 进入 worker 线程、发远端、回到 worker 线程。
 *
 * <p>停止后回来的结果直接丢弃，调用方收到 CLOSING。</p>
 */
@Slf4j
@Component
public class RemoteCalls {

    private final RemoteTransport transport;
    private final MembershipLifecycle lifecycle;
    private final Executor worker;

    public RemoteCalls(RemoteTransport transport,
                       MembershipLifecycle lifecycle,
                       @Qualifier("membershipWorker") Executor worker) {
        this.transport = transport;
        this.lifecycle = lifecycle;
        this.worker = worker;
    }

    /**
     * 在 worker 上执行 body；body 同步抛出的异常和异步失败都会经过 {@link RemoteErrors#translate}。
     */
    public <T> CompletableFuture<T> onWorker(Supplier<CompletableFuture<T>> body) {
        if (!lifecycle.isRunning()) {
            return CompletableFuture.failedFuture(MembershipException.closing());
        }
        CompletableFuture<T> out = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                CompletableFuture<T> f;
                try {
                    f = body.get();
                } catch (RuntimeException e) {
                    f = CompletableFuture.failedFuture(e);
                }
                f.whenComplete((v, err) -> {
                    if (err != null) {
                        out.completeExceptionally(RemoteErrors.translate(err));
                    } else {
                        out.complete(v);
                    }
                });
            });
        } catch (RejectedExecutionException e) {
            out.completeExceptionally(MembershipException.closing());
        }
        return out;
    }

    public void runOnWorker(String name, Runnable task) {
        if (!lifecycle.isRunning()) {
            log.debug("membership stopped, drop task: {}", name);
            return;
        }
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("membership task failed: {}", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("membership worker rejected task: {}", name);
        }
    }

    /**
     * 发远端；完成后回到 worker。失败原样返回（RemoteException），由上层决定是否翻译。
     */
    public <T> CompletableFuture<T> call(RemoteOperation<T> op) {
        CompletableFuture<T> out = new CompletableFuture<>();
        CompletableFuture<T> sent;
        try {
            sent = transport.send(op);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenCompleteAsync((v, err) -> {
            if (!lifecycle.isRunning()) {
                out.completeExceptionally(MembershipException.closing());
                return;
            }
            if (err != null) {
                Throwable cause = Futures.unwrap(err);
                if (cause instanceof RemoteException re && re.isTransient()) {
                    log.warn("remote call failed: op={}, conversationId={}, code={}, err={}",
                            op.name(), op.conversationId(), re.getCode(), re.getMessage());
                } else {
                    log.debug("remote call rejected: op={}, conversationId={}, err={}", op.name(), op.conversationId(), cause.toString());
                }
                out.completeExceptionally(cause);
                return;
            }
            out.complete(v);
        }, worker);
        return out;
    }
}
