package com.sessionhub.test.support;

import com.sessionhub.observer.transport.ObserverConnection;
import com.sessionhub.observer.transport.ObserverTransport;
import com.sessionhub.observer.transport.ObserverTransportListener;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 每次 connect 记录一次尝试，由测试决定成功、失败或断开。
 */
public class FakeObserverTransport implements ObserverTransport {

    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<ObserverConnection> connect(URI endpoint, ObserverTransportListener listener) {
        Attempt attempt = new Attempt(listener);
        attempts.add(attempt);
        return attempt.future;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public Attempt lastAttempt() {
        return attempts.get(attempts.size() - 1);
    }

    public Attempt attempt(int index) {
        return attempts.get(index);
    }

    public static final class Attempt {

        private final ObserverTransportListener listener;
        private final CompletableFuture<ObserverConnection> future = new CompletableFuture<>();
        private final FakeConnection connection = new FakeConnection();

        private Attempt(ObserverTransportListener listener) {
            this.listener = listener;
        }

        public FakeConnection succeed() {
            future.complete(connection);
            return connection;
        }

        public void fail() {
            future.completeExceptionally(new IOException("connection refused"));
        }

        public void receive(String text) {
            listener.onText(text);
        }

        public void serverClose() {
            listener.onClosed(1006, "abnormal closure");
        }

        public void transportError() {
            listener.onError(new IOException("reset by peer"));
        }

        public FakeConnection connection() {
            return connection;
        }
    }

    public static final class FakeConnection implements ObserverConnection {

        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean closed;

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close() {
            closed = true;
        }

        public List<String> sent() {
            return new ArrayList<>(sent);
        }

        public boolean isClosed() {
            return closed;
        }
    }
}
