package com.github.anirbanmu.tether.gateway;

public class FrameDecodeException extends GatewayException {
    public FrameDecodeException(String message) {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
