package com.github.anirbanmu.tether.config;

public record TetherConfig(GatewayConfig gateway, RestConfig rest) {
    public static final TetherConfig DEFAULTS = new TetherConfig(GatewayConfig.DEFAULTS, RestConfig.DEFAULTS);
}
