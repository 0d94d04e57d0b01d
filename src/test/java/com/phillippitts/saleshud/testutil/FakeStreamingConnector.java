package com.phillippitts.saleshud.testutil;

import com.phillippitts.saleshud.service.transcription.StreamingConnector;
import org.apache.logging.log4j.ThreadContext;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link StreamingConnector}. Connections succeed unless failures are queued with
 * {@link #failNext(Throwable)} or the connector is told to hang.
 */
public class FakeStreamingConnector implements StreamingConnector {

    private final Deque<Throwable> failures = new ArrayDeque<>();
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger connectCalls = new AtomicInteger();
    private final List<Map<String, String>> connectContexts = new CopyOnWriteArrayList<>();
    private volatile boolean hang;
    private volatile URI lastUri;
    private volatile Map<String, String> lastHeaders;

    public synchronized void failNext(Throwable error) {
        failures.addLast(error);
    }

    /** Subsequent connects never complete. */
    public void hang(boolean value) {
        this.hang = value;
    }

    @Override
    public CompletableFuture<StreamingConnection> connect(URI uri, Map<String, String> headers, Handler handler) {
        connectCalls.incrementAndGet();
        connectContexts.add(Map.copyOf(ThreadContext.getImmutableContext()));
        lastUri = uri;
        lastHeaders = headers;
        if (hang) {
            return new CompletableFuture<>();
        }
        Throwable failure;
        synchronized (this) {
            failure = failures.pollFirst();
        }
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        FakeConnection connection = new FakeConnection(handler);
        connections.add(connection);
        return CompletableFuture.completedFuture(connection);
    }

    public int connectCalls() {
        return connectCalls.get();
    }

    /** Log context of the calling thread at each connect, in call order. */
    public List<Map<String, String>> connectContexts() {
        return List.copyOf(connectContexts);
    }

    public List<FakeConnection> connections() {
        return List.copyOf(connections);
    }

    public FakeConnection lastConnection() {
        return connections.isEmpty() ? null : connections.get(connections.size() - 1);
    }

    public URI lastUri() {
        return lastUri;
    }

    public Map<String, String> lastHeaders() {
        return lastHeaders;
    }

    /** One fake connection; inbound messages are pushed through its handler. */
    public static class FakeConnection implements StreamingConnection {

        private final Handler handler;
        private final List<byte[]> audio = new CopyOnWriteArrayList<>();
        private final List<String> texts = new CopyOnWriteArrayList<>();
        private volatile boolean closed;
        private volatile int closeCode = -1;

        FakeConnection(Handler handler) {
            this.handler = handler;
        }

        @Override
        public CompletableFuture<Void> sendAudio(ByteBuffer pcm) {
            byte[] copy = new byte[pcm.remaining()];
            pcm.get(copy);
            audio.add(copy);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendText(String message) {
            texts.add(message);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close(int statusCode, String reason) {
            closed = true;
            closeCode = statusCode;
        }

        public void receive(String json) {
            handler.onText(json);
        }

        /** Simulates the server dropping the connection. */
        public void drop(String reason) {
            handler.onClosed(1006, reason);
        }

        public List<byte[]> audio() {
            return List.copyOf(audio);
        }

        public List<String> texts() {
            return List.copyOf(texts);
        }

        public boolean isClosed() {
            return closed;
        }

        public int closeCode() {
            return closeCode;
        }
    }
}
