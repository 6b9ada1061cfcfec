package com.minimember.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 成员子系统的运行标记。
 *
 * <p>停止后，尚未返回的远端调用结果一律丢弃：不再修改任何缓存，调用方收到 CLOSING。</p>
 */
@Slf4j
@Component
public class MembershipLifecycle implements SmartLifecycle {

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        log.info("membership subsystem started");
    }

    @Override
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        log.info("membership subsystem stopping, pending continuations will be discarded");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
