package com.sessionhub.observer.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于单线程 {@link ScheduledExecutorService} 的默认实现。
 */
public class ExecutorObserverScheduler implements ObserverScheduler, AutoCloseable {

    private final ScheduledExecutorService executor;

    public ExecutorObserverScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("observer-reconnect-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(task, Math.max(delay.toMillis(), 0L), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
