package com.sessionhub.observer.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

public interface ObserverTransport {

    /**
     * 异步建立连接，失败时 future 异常完成。
     */
    CompletableFuture<ObserverConnection> connect(URI endpoint, ObserverTransportListener listener);
}
