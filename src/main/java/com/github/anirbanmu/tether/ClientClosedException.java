package com.github.anirbanmu.tether;

// raised to callers blocked in the client when it is closed or their thread is interrupted
public class ClientClosedException extends TetherException {
    public ClientClosedException(String message) {
        super(message);
    }

    public ClientClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
