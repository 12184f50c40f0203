package com.github.anirbanmu.tether.util;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class Http {
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tether-http");
        t.setDaemon(true);
        return t;
    });

    // shared by the rest transport and the gateway websocket
    public static final HttpClient CLIENT = HttpClient.newBuilder()
        .executor(EXECUTOR)
        .connectTimeout(Duration.ofMillis(2500))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    private Http() {
    }
}
