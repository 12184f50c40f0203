package com.github.anirbanmu.tether.rest;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class Responses {
    private Responses() {
    }

    // json response; headers are name/value pairs
    static RestResponse json(int status, String body, String... headers) {
        Map<String, List<String>> map = new HashMap<>();
        map.put("Content-Type", List.of("application/json"));
        for (int i = 0; i < headers.length; i += 2) {
            map.put(headers[i], List.of(headers[i + 1]));
        }
        return new RestResponse(status, map, body.getBytes(StandardCharsets.UTF_8));
    }

    static RestResponse empty(int status) {
        return new RestResponse(status, Map.of(), new byte[0]);
    }
}
