package com.github.anirbanmu.tether.gateway;

// the gateway closed with a code that must not be retried (bad token, bad intents, bad shard...)
public class GatewayClosedException extends GatewayException {
    private final int closeCode;
    private final String reason;

    public GatewayClosedException(int closeCode, String reason) {
        super("Gateway closed with non-resumable code " + closeCode + (reason == null || reason.isEmpty() ? "" : ": " + reason));
        this.closeCode = closeCode;
        this.reason = reason;
    }

    public int closeCode() {
        return closeCode;
    }

    public String reason() {
        return reason;
    }
}
