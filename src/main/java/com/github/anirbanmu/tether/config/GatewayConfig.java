package com.github.anirbanmu.tether.config;

import com.github.anirbanmu.tether.gateway.CloseCodes;
import java.time.Duration;
import java.util.Set;

public record GatewayConfig(
    long intents,
    int largeThreshold,
    boolean transportCompression,
    boolean payloadCompression,
    Integer shardId,
    Integer shardCount,
    int apiVersion,
    int sendLimit,
    Duration sendWindow,
    Set<Integer> nonResumableCloseCodes,
    Duration invalidSessionDelayMin,
    Duration invalidSessionDelayMax,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay,
    int maxReconnectAttempts,
    Duration connectTimeout) {

    public static final GatewayConfig DEFAULTS = new GatewayConfig(
        0,
        250,
        true,
        false,
        null,
        null,
        10,
        120,
        Duration.ofSeconds(60),
        CloseCodes.DEFAULT_NON_RESUMABLE,
        Duration.ofSeconds(1),
        Duration.ofSeconds(5),
        Duration.ofMillis(200),
        Duration.ofSeconds(30),
        0,
        Duration.ofSeconds(30));

    public boolean isSharded() {
        return shardId != null && shardCount != null;
    }

    public boolean isResumable(int closeCode) {
        return !nonResumableCloseCodes.contains(closeCode);
    }

    // appends version, encoding and compression to the url handed out by /gateway/bot
    public String connectUrl(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String url = base + "/?v=" + apiVersion + "&encoding=json";
        return transportCompression ? url + "&compress=zlib-stream" : url;
    }
}
