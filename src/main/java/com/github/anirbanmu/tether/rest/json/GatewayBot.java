package com.github.anirbanmu.tether.rest.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// GET /gateway/bot
@CompiledJson
public record GatewayBot(String url, int shards, @JsonAttribute(name = "session_start_limit") SessionStartLimit sessionStartLimit) {

    @CompiledJson
    public record SessionStartLimit(
        int total,
        int remaining,
        @JsonAttribute(name = "reset_after") long resetAfter,
        @JsonAttribute(name = "max_concurrency") int maxConcurrency) {
    }
}
