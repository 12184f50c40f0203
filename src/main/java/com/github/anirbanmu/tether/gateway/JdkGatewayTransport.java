package com.github.anirbanmu.tether.gateway;

import com.github.anirbanmu.tether.log.Log;
import com.github.anirbanmu.tether.util.Http;
import java.io.IOException;
import java.net.URI;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

// gateway sockets over java.net.http.WebSocket
public class JdkGatewayTransport implements GatewayTransport {
    private final String userAgent;

    public JdkGatewayTransport(String userAgent) {
        this.userAgent = userAgent;
    }

    // blocks until the websocket handshake completes (or throws)
    @Override
    public Connection connect(URI uri, Listener listener, Duration timeout) throws IOException, InterruptedException {
        try {
            WebSocket ws = Http.CLIENT.newWebSocketBuilder()
                .header("User-Agent", userAgent)
                .connectTimeout(timeout)
                .buildAsync(uri, new Adapter(listener))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new JdkConnection(ws);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException("Gateway handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IOException("Gateway handshake timed out after " + timeout.toMillis() + "ms", e);
        }
    }

    private static final class JdkConnection implements Connection {
        private final WebSocket ws;

        JdkConnection(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public void sendText(String text) throws IOException {
            try {
                // websocket allows one outstanding send, so wait for each
                ws.sendText(text, true).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while sending", e);
            } catch (ExecutionException e) {
                throw new IOException("Send failed", e.getCause());
            }
        }

        @Override
        public void close(int code, String reason) {
            if (ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            ws.sendClose(code, reason).whenComplete((w, err) -> {
                if (err != null) {
                    Log.debug("gateway.close_frame_failed", "err", err.getMessage());
                }
                ws.abort();
            });
        }

        @Override
        public void abort() {
            ws.abort();
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final Listener listener;
        private final StringBuilder textBuffer = new StringBuilder();

        Adapter(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            listener.onBinary(bytes);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
