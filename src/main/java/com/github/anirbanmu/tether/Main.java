package com.github.anirbanmu.tether;

import com.github.anirbanmu.tether.config.ConfigLoader;
import com.github.anirbanmu.tether.config.TetherConfig;
import com.github.anirbanmu.tether.gateway.GatewayClosedException;
import com.github.anirbanmu.tether.gateway.GatewaySession;
import com.github.anirbanmu.tether.gateway.JdkGatewayTransport;
import com.github.anirbanmu.tether.gateway.json.GatewayDispatch;
import com.github.anirbanmu.tether.log.Log;
import com.github.anirbanmu.tether.rest.RequestExecutor;
import com.github.anirbanmu.tether.rest.RestClient;
import com.github.anirbanmu.tether.rest.json.GatewayBot;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

public class Main {
    public static void main(String[] args) {
        String token = System.getenv("DISCORD_TOKEN");
        String appId = System.getenv("DISCORD_APPLICATION_ID");

        if (token == null) {
            Log.error("startup.missing_token", "message", "DISCORD_TOKEN env var is required");
            System.exit(1);
        }

        Path configPath = Path.of(System.getProperty("config", "tether.toml"));
        TetherConfig config;
        try {
            if (Files.exists(configPath)) {
                config = ConfigLoader.load(configPath);
                Log.info("startup.config_loaded", "path", configPath.toAbsolutePath());
            } else {
                config = TetherConfig.DEFAULTS;
                Log.warn("startup.config_defaults", "path", configPath.toAbsolutePath());
            }
        } catch (Exception e) {
            Log.error("startup.config_error", e);
            System.exit(1);
            return;
        }

        Log.info("startup", "status", "starting", "version", "1.0.0");

        RestClient rest = new RestClient(new RequestExecutor(token, config.rest()), appId);
        GatewayBot bot;
        try {
            bot = rest.getGatewayBot();
        } catch (TetherException e) {
            Log.error("startup.gateway_bot_failed", e);
            System.exit(1);
            return;
        }
        if (bot.shards() > 1 && !config.gateway().isSharded()) {
            Log.warn("startup.sharding_recommended", "shards", bot.shards());
        }

        GatewaySession session = new GatewaySession(token, bot.url(), config.gateway(),
            new JdkGatewayTransport(config.rest().userAgent()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            session.close();
            rest.close();
        }, "tether-shutdown"));

        int healthPort = Integer.parseInt(System.getenv().getOrDefault("HEALTH_PORT", "8080"));
        try {
            startHealthCheck(healthPort, session::isHealthy);
        } catch (IOException e) {
            Log.error("startup.health_server_failed", e);
            System.exit(1);
        }

        try {
            while (true) {
                GatewayDispatch dispatch = session.next();
                Log.info("dispatch", "type", dispatch.type(), "seq", dispatch.sequence());
            }
        } catch (GatewayClosedException e) {
            Log.error("gateway.fatal_close", e, "code", e.closeCode());
            System.exit(2);
        } catch (ClientClosedException e) {
            Log.info("gateway.stopped");
        } catch (TetherException e) {
            Log.error("gateway.failed", e);
            System.exit(1);
        }
    }

    private static void startHealthCheck(int port, BooleanSupplier healthy) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health");
            t.setDaemon(true);
            return t;
        }));
        server.createContext("/health", exchange -> {
            boolean ok = healthy.getAsBoolean();
            int status = ok ? 200 : 503;
            byte[] body = (ok ? "ok" : "unhealthy").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        Log.info("health.started", "port", port);
    }
}
