package com.github.anirbanmu.tether.rest;

import java.net.URI;
import java.util.Map;

// fully resolved outbound call; body is null for bodyless requests
public record RestRequest(String method, URI uri, Map<String, String> headers, byte[] body) {
}
