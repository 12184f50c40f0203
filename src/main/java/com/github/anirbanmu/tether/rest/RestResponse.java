package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.util.Json;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public final class RestResponse {
    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public RestResponse(int status, Map<String, List<String>> headers, byte[] body) {
        this.status = status;
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.headers.putAll(headers);
        this.body = body == null ? new byte[0] : body;
    }

    public int status() {
        return status;
    }

    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public byte[] body() {
        return body;
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isJson() {
        String type = header("Content-Type");
        return type != null && type.toLowerCase(Locale.ROOT).startsWith("application/json");
    }

    // decoded JSON (Map/List/...) for json responses, the raw text otherwise, null when empty
    public Object decoded() throws IOException {
        if (body.length == 0) {
            return null;
        }
        return isJson() ? Json.parse(body) : text();
    }

    @Override
    public String toString() {
        return "RestResponse[status=" + status + ", bytes=" + body.length + "]";
    }
}
