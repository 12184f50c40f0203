package com.github.anirbanmu.tether.rest;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class RouteTest {

    @Test
    void fillsAndEncodesPlaceholders() {
        Route route = Route.of("PATCH", "/webhooks/{webhook_id}/{webhook_token}/messages/{message_id}",
            Map.of("webhook_id", 123L, "webhook_token", "a b/c", "message_id", "9"));

        assertEquals("/webhooks/123/a%20b%2Fc/messages/9", route.path());
        assertEquals("PATCH/webhooks/{webhook_id}/{webhook_token}/messages/{message_id}", route.routeKey());
    }

    @Test
    void majorKeyOnlyUsesMajorParameters() {
        Route first = Route.of("GET", "/channels/{channel_id}/messages/{message_id}", Map.of("channel_id", "1", "message_id", "10"));
        Route second = Route.of("GET", "/channels/{channel_id}/messages/{message_id}", Map.of("channel_id", "1", "message_id", "11"));
        Route other = Route.of("GET", "/channels/{channel_id}/messages/{message_id}", Map.of("channel_id", "2", "message_id", "10"));

        assertEquals(first.majorKey(), second.majorKey());
        assertNotEquals(first.majorKey(), other.majorKey());
        assertEquals("1/None/None/None", first.majorKey());
    }

    @Test
    void missingParameterIsRejected() {
        Route route = Route.of("GET", "/guilds/{guild_id}");
        assertThrows(IllegalArgumentException.class, route::path);
    }

    @Test
    void templateWithoutPlaceholders() {
        Route route = Route.of("GET", "/gateway/bot");
        assertEquals("/gateway/bot", route.path());
        assertEquals("None/None/None/None", route.majorKey());
    }
}
