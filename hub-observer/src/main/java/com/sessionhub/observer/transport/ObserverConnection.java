package com.sessionhub.observer.transport;

public interface ObserverConnection {

    void send(String text);

    void close();
}
