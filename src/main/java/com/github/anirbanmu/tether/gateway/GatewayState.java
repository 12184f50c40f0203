package com.github.anirbanmu.tether.gateway;

public enum GatewayState {
    CONNECTING,
    AWAITING_HELLO,
    IDENTIFYING,
    RESUMING,
    READY,
    CLOSED
}
