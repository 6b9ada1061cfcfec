package com.minimember.gateway.timer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 基于 Spring {@link TaskScheduler} 的实现，调度器就是单线程的 membershipWorker。
 */
@Slf4j
public class SchedulerTimerService implements TimerService {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, KeyedTimer> keyed = new ConcurrentHashMap<>();

    public SchedulerTimerService(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void scheduleOnce(Duration delay, Runnable task) {
        Instant at = clock.instant().plus(delay == null || delay.isNegative() ? Duration.ZERO : delay);
        scheduler.schedule(() -> runSafely("once", task), at);
    }

    @Override
    public void scheduleKeyed(String key, Instant deadline, Runnable task) {
        KeyedTimer timer = new KeyedTimer(deadline);
        KeyedTimer prev = keyed.put(key, timer);
        if (prev != null) {
            prev.cancel();
        }
        timer.future = scheduler.schedule(() -> {
            if (keyed.remove(key, timer)) {
                runSafely(key, task);
            }
        }, deadline);
    }

    @Override
    public void cancelKeyed(String key) {
        KeyedTimer prev = keyed.remove(key);
        if (prev != null) {
            prev.cancel();
        }
    }

    @Override
    public Instant keyedDeadline(String key) {
        KeyedTimer t = keyed.get(key);
        return t == null ? null : t.deadline;
    }

    private static void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("membership timer task failed: timer={}", name, e);
        }
    }

    private static final class KeyedTimer {
        private final Instant deadline;
        private volatile ScheduledFuture<?> future;

        private KeyedTimer(Instant deadline) {
            this.deadline = deadline;
        }

        private void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
