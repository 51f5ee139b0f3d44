package com.sessionhub.observer.scheduler;

import java.time.Duration;

/**
 * 重连定时抽象，测试中以虚拟时钟替换。
 */
public interface ObserverScheduler {

    Cancellable schedule(Runnable task, Duration delay);

    @FunctionalInterface
    interface Cancellable {

        void cancel();
    }
}
