package com.github.anirbanmu.tether;

// root of every error the client core raises
public class TetherException extends RuntimeException {
    public TetherException(String message) {
        super(message);
    }

    public TetherException(String message, Throwable cause) {
        super(message, cause);
    }
}
