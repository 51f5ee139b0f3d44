package com.sessionhub.test.support;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 虚拟时间调度器：只有 {@link #advance(Duration)} 时才执行到期任务。
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<ManualFuture> tasks = new ArrayList<>();

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime);
        tasks.add(future);
        return future;
    }

    /**
     * 推进时钟并按到期时间顺序执行任务，已取消的任务跳过。
     */
    public void advance(Duration duration) {
        clock.advance(duration);
        Instant now = clock.instant();
        List<ManualFuture> due = new ArrayList<>();
        synchronized (this) {
            for (ManualFuture future : new ArrayList<>(tasks)) {
                if (!future.runAt.isAfter(now)) {
                    due.add(future);
                    tasks.remove(future);
                }
            }
        }
        due.sort(Comparator.comparing(future -> future.runAt));
        for (ManualFuture future : due) {
            future.run();
        }
    }

    public synchronized int pendingCount() {
        int count = 0;
        for (ManualFuture future : tasks) {
            if (!future.isCancelled()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("trigger scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("fixed rate not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("fixed rate not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("fixed delay not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("fixed delay not supported");
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Instant runAt;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ManualFuture(Runnable task, Instant runAt) {
            this.task = task;
            this.runAt = runAt;
        }

        private void run() {
            if (cancelled) {
                return;
            }
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), runAt).toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
