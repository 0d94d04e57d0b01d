package com.phillippitts.saleshud.service.transcription;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link StreamingConnector} over {@link java.net.http.WebSocket}.
 */
public class JdkWebSocketConnector implements StreamingConnector {

    private static final Logger LOG = LogManager.getLogger(JdkWebSocketConnector.class);

    private final HttpClient client;
    private final Duration connectTimeout;

    public JdkWebSocketConnector(HttpClient client, Duration connectTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<StreamingConnection> connect(URI uri, Map<String, String> headers, Handler handler) {
        WebSocket.Builder builder = client.newWebSocketBuilder().connectTimeout(connectTimeout);
        headers.forEach(builder::header);
        return builder.buildAsync(uri, new ListenerAdapter(handler))
                .thenApply(WebSocketConnection::new);
    }

    /** Reassembles fragmented text messages and forwards them to the handler. */
    private static final class ListenerAdapter implements WebSocket.Listener {

        private final Handler handler;
        private final StringBuilder partial = new StringBuilder();

        ListenerAdapter(Handler handler) {
            this.handler = handler;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                handler.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            LOG.debug("WebSocket closed by peer: code={}, reason={}", statusCode, reason);
            handler.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            handler.onFailure(error);
        }
    }

    private static final class WebSocketConnection implements StreamingConnection {

        private final WebSocket webSocket;

        WebSocketConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public CompletableFuture<Void> sendAudio(ByteBuffer pcm) {
            return webSocket.sendBinary(pcm, true).thenApply(ws -> null);
        }

        @Override
        public CompletableFuture<Void> sendText(String message) {
            return webSocket.sendText(message, true).thenApply(ws -> null);
        }

        @Override
        public void close(int statusCode, String reason) {
            webSocket.sendClose(statusCode, reason)
                    .exceptionally(ex -> {
                        LOG.debug("Close handshake failed, aborting: {}", ex.toString());
                        webSocket.abort();
                        return null;
                    });
        }
    }
}
