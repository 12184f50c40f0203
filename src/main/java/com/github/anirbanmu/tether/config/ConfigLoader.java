package com.github.anirbanmu.tether.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

// every key is optional; missing keys fall back to GatewayConfig.DEFAULTS / RestConfig.DEFAULTS
public class ConfigLoader {
    public static TetherConfig load(Path path) throws IOException {
        return parse(Toml.parse(path));
    }

    public static TetherConfig load(InputStream stream) throws IOException {
        return parse(Toml.parse(stream));
    }

    public static TetherConfig load(String content) {
        return parse(Toml.parse(content));
    }

    private static TetherConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        GatewayConfig gateway = result.isTable("gateway")
            ? parseGateway(result.getTable("gateway"))
            : GatewayConfig.DEFAULTS;
        RestConfig rest = result.isTable("rest")
            ? parseRest(result.getTable("rest"))
            : RestConfig.DEFAULTS;
        return new TetherConfig(gateway, rest);
    }

    private static GatewayConfig parseGateway(TomlTable table) {
        GatewayConfig d = GatewayConfig.DEFAULTS;

        Integer shardId = null;
        Integer shardCount = null;
        if (table.contains("shard")) {
            List<Long> shard = longs(table, "gateway.shard", "shard");
            if (shard.size() != 2) {
                throw new ConfigException("'gateway.shard' must be [shard_id, shard_count], got " + shard);
            }
            shardId = Math.toIntExact(shard.get(0));
            shardCount = Math.toIntExact(shard.get(1));
            if (shardCount < 1 || shardId < 0 || shardId >= shardCount) {
                throw new ConfigException("'gateway.shard' has invalid shard " + shard);
            }
        }

        Set<Integer> closeCodes = d.nonResumableCloseCodes();
        if (table.contains("non_resumable_close_codes")) {
            Set<Integer> codes = new HashSet<>();
            for (Long code : longs(table, "gateway.non_resumable_close_codes", "non_resumable_close_codes")) {
                codes.add(Math.toIntExact(code));
            }
            closeCodes = Set.copyOf(codes);
        }

        Duration delayMin = duration(table, "gateway", "invalid_session_delay_min", d.invalidSessionDelayMin());
        Duration delayMax = duration(table, "gateway", "invalid_session_delay_max", d.invalidSessionDelayMax());
        if (delayMax.compareTo(delayMin) < 0) {
            throw new ConfigException("'gateway.invalid_session_delay_max' must not be less than the min delay.");
        }

        return new GatewayConfig(
            positiveOrZero(table, "gateway", "intents", d.intents()),
            (int) positive(table, "gateway", "large_threshold", d.largeThreshold()),
            bool(table, "gateway", "transport_compression", d.transportCompression()),
            bool(table, "gateway", "payload_compression", d.payloadCompression()),
            shardId,
            shardCount,
            (int) positive(table, "gateway", "api_version", d.apiVersion()),
            (int) positive(table, "gateway", "send_limit", d.sendLimit()),
            duration(table, "gateway", "send_window", d.sendWindow()),
            closeCodes,
            delayMin,
            delayMax,
            duration(table, "gateway", "reconnect_base_delay", d.reconnectBaseDelay()),
            duration(table, "gateway", "reconnect_max_delay", d.reconnectMaxDelay()),
            (int) positiveOrZero(table, "gateway", "max_reconnect_attempts", d.maxReconnectAttempts()),
            duration(table, "gateway", "connect_timeout", d.connectTimeout()));
    }

    private static RestConfig parseRest(TomlTable table) {
        RestConfig d = RestConfig.DEFAULTS;

        String baseUrl = string(table, "rest", "base_url");
        if (baseUrl != null && baseUrl.isBlank()) {
            throw new ConfigException("'rest.base_url' must not be blank.");
        }
        String userAgent = string(table, "rest", "user_agent");

        return new RestConfig(
            baseUrl != null ? baseUrl : d.baseUrl(),
            userAgent != null && !userAgent.isBlank() ? userAgent : d.userAgent(),
            (int) positive(table, "rest", "max_attempts", d.maxAttempts()),
            (int) positiveOrZero(table, "rest", "max_rate_limit_retries", d.maxRateLimitRetries()),
            duration(table, "rest", "request_timeout", d.requestTimeout()),
            duration(table, "rest", "transient_backoff_unit", d.transientBackoffUnit()));
    }

    private static boolean bool(TomlTable table, String section, String key, boolean fallback) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (!table.isBoolean(key)) {
            throw new ConfigException("'" + section + "." + key + "' must be true or false.");
        }
        return table.getBoolean(key);
    }

    private static String string(TomlTable table, String section, String key) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isString(key)) {
            throw new ConfigException("'" + section + "." + key + "' must be a string.");
        }
        return table.getString(key);
    }

    private static long positive(TomlTable table, String section, String key, long fallback) {
        long value = positiveOrZero(table, section, key, fallback);
        if (value == 0) {
            throw new ConfigException("'" + section + "." + key + "' must be positive.");
        }
        return value;
    }

    private static long positiveOrZero(TomlTable table, String section, String key, long fallback) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (!table.isLong(key)) {
            throw new ConfigException("'" + section + "." + key + "' must be an integer.");
        }
        long value = table.getLong(key);
        if (value < 0) {
            throw new ConfigException("'" + section + "." + key + "' must not be negative.");
        }
        return value;
    }

    private static Duration duration(TomlTable table, String section, String key, Duration fallback) {
        String raw = string(table, section, key);
        if (raw == null) {
            return fallback;
        }
        try {
            // ISO-8601, e.g. "PT60S", "PT0.2S"
            Duration value = Duration.parse(raw);
            if (value.isNegative()) {
                throw new ConfigException("'" + section + "." + key + "' must not be negative.");
            }
            return value;
        } catch (DateTimeParseException e) {
            throw new ConfigException("'" + section + "." + key + "' has invalid duration: " + raw);
        }
    }

    private static List<Long> longs(TomlTable table, String context, String key) {
        if (!table.isArray(key)) {
            throw new ConfigException("'" + context + "' must be an array of integers.");
        }
        TomlArray array = table.getArray(key);
        List<Long> values = new ArrayList<>(array.size());
        for (Object value : array.toList()) {
            if (!(value instanceof Long l)) {
                throw new ConfigException("'" + context + "' must be an array of integers, got " + value);
            }
            values.add(l);
        }
        return values;
    }
}
