package com.github.anirbanmu.tether.gateway;

import com.github.anirbanmu.tether.TetherException;

public class GatewayException extends TetherException {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
