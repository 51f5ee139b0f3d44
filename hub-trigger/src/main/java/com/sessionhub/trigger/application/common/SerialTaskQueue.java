package com.sessionhub.trigger.application.common;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 有界串行任务队列：任务按提交顺序在共享线程池上逐个执行，同一时刻最多一个任务在跑。
 * 提交永不阻塞，超过上限直接拒绝。
 */
@Slf4j
public class SerialTaskQueue {

    private final String name;
    private final Executor executor;
    private final int maxPending;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SerialTaskQueue(String name, Executor executor, int maxPending) {
        this.name = name;
        this.executor = executor;
        this.maxPending = maxPending <= 0 ? Integer.MAX_VALUE : maxPending;
    }

    /**
     * @return false 表示队列已满，任务被丢弃
     */
    public boolean offer(Runnable task) {
        if (task == null) {
            return false;
        }
        if (pending.incrementAndGet() > maxPending) {
            pending.decrementAndGet();
            return false;
        }
        tasks.add(task);
        scheduleDrain();
        return true;
    }

    public int pendingSize() {
        return pending.get();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.warn("Serial task queue rejected by executor. queue={}, pending={}", name, pending.get());
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                pending.decrementAndGet();
                try {
                    task.run();
                } catch (Exception ex) {
                    log.warn("Serial task failed. queue={}, error={}", name, ex.getMessage(), ex);
                }
            }
        } finally {
            draining.set(false);
        }
        if (!tasks.isEmpty()) {
            scheduleDrain();
        }
    }
}
