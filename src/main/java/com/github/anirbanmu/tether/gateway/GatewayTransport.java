package com.github.anirbanmu.tether.gateway;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

// opens gateway sockets. the session owns whatever connection this returns and is the
// only thing allowed to touch it.
public interface GatewayTransport {

    Connection connect(URI uri, Listener listener, Duration timeout) throws IOException, InterruptedException;

    interface Connection {
        void sendText(String text) throws IOException;

        // polite close with a close frame
        void close(int code, String reason);

        // drop the tcp connection without a close frame
        void abort();
    }

    // callbacks arrive on transport threads. text is always a whole message, binary
    // may be any slice of the compressed stream
    interface Listener {
        void onText(String text);

        void onBinary(byte[] data);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }
}
