package com.phillippitts.saleshud.service.transcription;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens bidirectional streaming connections to the transcription backend.
 */
public interface StreamingConnector {

    CompletableFuture<StreamingConnection> connect(URI uri, Map<String, String> headers, Handler handler);

    /** Inbound events for one connection. */
    interface Handler {
        void onText(String message);

        void onClosed(int statusCode, String reason);

        void onFailure(Throwable error);
    }

    /** An open connection. At most one send may be outstanding at a time. */
    interface StreamingConnection {
        CompletableFuture<Void> sendAudio(ByteBuffer pcm);

        CompletableFuture<Void> sendText(String message);

        void close(int statusCode, String reason);
    }
}
