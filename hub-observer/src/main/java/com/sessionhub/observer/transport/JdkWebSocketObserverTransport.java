package com.sessionhub.observer.transport;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 基于 {@link java.net.http.WebSocket} 的传输实现。分片文本帧在收齐后整体回调。
 */
@Slf4j
public class JdkWebSocketObserverTransport implements ObserverTransport {

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketObserverTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<ObserverConnection> connect(URI endpoint, ObserverTransportListener listener) {
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(endpoint, new ListenerAdapter(listener))
                .thenApply(JdkWebSocketConnection::new);
    }

    private static final class ListenerAdapter implements WebSocket.Listener {

        private final ObserverTransportListener listener;
        private final StringBuilder buffer = new StringBuilder();

        private ListenerAdapter(ObserverTransportListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    private static final class JdkWebSocketConnection implements ObserverConnection {

        private final WebSocket webSocket;
        private CompletableFuture<WebSocket> lastSend = CompletableFuture.completedFuture(null);

        private JdkWebSocketConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        /**
         * JDK WebSocket 不允许并发 sendText，这里串成链。
         */
        @Override
        public synchronized void send(String text) {
            lastSend = lastSend
                    .exceptionally(error -> null)
                    .thenCompose(ignored -> webSocket.sendText(text, true));
        }

        @Override
        public void close() {
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                    .exceptionally(error -> {
                        log.debug("Observer close handshake failed: {}", error.getMessage());
                        webSocket.abort();
                        return null;
                    });
        }
    }
}
