package com.github.anirbanmu.tether.config;

import java.time.Duration;

public record RestConfig(
    String baseUrl,
    String userAgent,
    int maxAttempts,
    int maxRateLimitRetries,
    Duration requestTimeout,
    Duration transientBackoffUnit) {

    public static final RestConfig DEFAULTS = new RestConfig(
        "https://discord.com/api/v10",
        "DiscordBot (https://github.com/anirbanmu/tether, 1.0.0)",
        3,
        10,
        Duration.ofSeconds(10),
        Duration.ofSeconds(1));
}
