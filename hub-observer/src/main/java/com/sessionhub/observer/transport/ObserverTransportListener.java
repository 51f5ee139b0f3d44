package com.sessionhub.observer.transport;

/**
 * 传输层回调。onClosed 与 onError 可能对同一连接先后触发。
 */
public interface ObserverTransportListener {

    void onText(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
