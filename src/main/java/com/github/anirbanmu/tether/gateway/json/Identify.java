package com.github.anirbanmu.tether.gateway.json;

import com.github.anirbanmu.tether.config.GatewayConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// opcode 2 identify payload - sent after hello when there is no session to resume.
// built as a map because "shard" has to be absent, not null, when not sharding.
public record Identify(String token, long intents, Properties properties, boolean compress, int largeThreshold, List<Integer> shard) {

    public static Identify create(String token, GatewayConfig config) {
        List<Integer> shard = config.isSharded() ? List.of(config.shardId(), config.shardCount()) : null;
        return new Identify(token, config.intents(), Properties.DEFAULT, config.payloadCompression(), config.largeThreshold(), shard);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("token", token);
        json.put("properties", properties.toJson());
        json.put("compress", compress);
        json.put("large_threshold", largeThreshold);
        json.put("intents", intents);
        if (shard != null) {
            json.put("shard", shard);
        }
        return json;
    }

    public record Properties(String os, String browser, String device) {
        public static final Properties DEFAULT = new Properties(
            System.getProperty("os.name", "linux").toLowerCase(Locale.ROOT), "tether", "tether");

        Map<String, Object> toJson() {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("os", os);
            json.put("browser", browser);
            json.put("device", device);
            return json;
        }
    }
}
