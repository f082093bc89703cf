package io.hivemesh.broker;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface ReconnectScheduler {
    void schedule(Runnable task, long delayMs);

    static ReconnectScheduler using(ScheduledExecutorService executor) {
        return (task, delayMs) -> executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    }
}
