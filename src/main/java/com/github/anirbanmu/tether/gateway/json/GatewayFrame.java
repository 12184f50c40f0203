package com.github.anirbanmu.tether.gateway.json;

import com.github.anirbanmu.tether.util.Json;
import java.util.Map;

// one decoded gateway payload: {"op": .., "s": .., "t": .., "d": ..}
// d varies by opcode (object, boolean, number or null) so it stays untyped here
public record GatewayFrame(int op, Integer sequence, String type, Object data) {

    public static GatewayFrame fromJson(Map<String, Object> json) {
        Object op = json.get("op");
        if (!(op instanceof Number n)) {
            throw new IllegalArgumentException("Gateway payload has no numeric 'op': " + op);
        }
        Object s = json.get("s");
        Object t = json.get("t");
        return new GatewayFrame(
            n.intValue(),
            s instanceof Number seq ? seq.intValue() : null,
            t instanceof String type ? type : null,
            json.get("d"));
    }

    public Map<String, Object> dataObject() {
        return Json.asObject(data);
    }

    public boolean dataFlag() {
        return Boolean.TRUE.equals(data);
    }
}
