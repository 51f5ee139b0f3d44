package com.sessionhub.trigger.application.common;

import java.util.concurrent.Executor;

/**
 * 按 key 分条带的串行执行器：同一 key 的任务严格按提交顺序执行，不同条带之间并发。
 */
public class StripedSerialExecutor {

    private final SerialTaskQueue[] stripes;

    public StripedSerialExecutor(String name, Executor executor, int stripeCount) {
        int count = Math.max(stripeCount, 1);
        this.stripes = new SerialTaskQueue[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new SerialTaskQueue(name + "-" + i, executor, 0);
        }
    }

    public void execute(String key, Runnable task) {
        stripes[Math.floorMod(key == null ? 0 : key.hashCode(), stripes.length)].offer(task);
    }
}
