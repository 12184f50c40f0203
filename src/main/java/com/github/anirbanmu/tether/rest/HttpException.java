package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.TetherException;
import com.github.anirbanmu.tether.util.Json;
import java.io.IOException;
import java.util.Map;

// a non-2xx response the executor gave up on. subclasses cover the statuses callers
// usually branch on, everything else is a plain HttpException
public class HttpException extends TetherException {
    private final transient RestResponse response;
    private final int errorCode;
    private final String errorMessage;

    public HttpException(RestResponse response) {
        this(response, null);
    }

    HttpException(RestResponse response, String detail) {
        super(describe(response, detail));
        this.response = response;
        Map<String, Object> error = errorBody(response);
        Object code = error.get("code");
        this.errorCode = code instanceof Number n ? n.intValue() : 0;
        Object message = error.get("message");
        this.errorMessage = message instanceof String s ? s : null;
    }

    public int status() {
        return response.status();
    }

    public RestResponse response() {
        return response;
    }

    // discord's json error code, 0 when the body had none
    public int errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    private static String describe(RestResponse response, String detail) {
        String text = response.text();
        if (text.length() > 200) {
            text = text.substring(0, 200) + "...";
        }
        String prefix = "HTTP " + response.status() + (detail == null ? "" : " (" + detail + ")");
        return text.isEmpty() ? prefix : prefix + ": " + text;
    }

    private static Map<String, Object> errorBody(RestResponse response) {
        try {
            return Json.asObject(response.decoded());
        } catch (IOException e) {
            return Map.of();
        }
    }
}
