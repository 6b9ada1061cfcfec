package com.minimember.gateway.timer;

import java.time.Duration;
import java.time.Instant;

/**
 * 定时器。所有回调都在成员 worker 线程上执行。
 *
 * <p>keyed 定时器同一个 key 只保留一个：重新设置会取消旧的。</p>
 */
public interface TimerService {

    void scheduleOnce(Duration delay, Runnable task);

    void scheduleKeyed(String key, Instant deadline, Runnable task);

    void cancelKeyed(String key);

    /**
     * 当前 key 的触发时间，没有则返回 null。
     */
    Instant keyedDeadline(String key);
}
