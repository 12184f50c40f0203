package com.github.anirbanmu.tether.gateway.json;

import java.util.Map;

// what the session hands to its consumer: an op 0 event, e.g. MESSAGE_CREATE
public record GatewayDispatch(String type, Map<String, Object> data, int sequence) {
}
