package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.TetherException;

// the request never produced a response: connect failure, timeout, reset
public class RestTransportException extends TetherException {
    public RestTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
