package com.github.anirbanmu.tether.gateway.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 6 resume payload - replays everything after seq on a new socket
@CompiledJson
public record Resume(String token, @JsonAttribute(name = "session_id") String sessionId, int seq) {
}
