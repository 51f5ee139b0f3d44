package com.sessionhub.trigger.websocket;

import java.io.IOException;

/**
 * 观察端推送通道。send 可能在推送线程上调用，实现需保证线程安全。
 */
public interface ObserverChannel {

    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close();
}
