package com.github.anirbanmu.tether.rest.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record InteractionResponse(int type, @JsonAttribute(nullable = true) MessageData data) {
    public static final int TYPE_PONG = 1;
    public static final int TYPE_CHANNEL_MESSAGE_WITH_SOURCE = 4;
    public static final int TYPE_DEFERRED_CHANNEL_MESSAGE_WITH_SOURCE = 5;
    public static final int TYPE_DEFERRED_UPDATE_MESSAGE = 6;
    public static final int TYPE_UPDATE_MESSAGE = 7;

    public static InteractionResponse pong() {
        return new InteractionResponse(TYPE_PONG, null);
    }

    public static InteractionResponse message(String content) {
        return new InteractionResponse(TYPE_CHANNEL_MESSAGE_WITH_SOURCE, MessageData.content(content));
    }

    public static InteractionResponse ephemeral(String content) {
        return new InteractionResponse(TYPE_CHANNEL_MESSAGE_WITH_SOURCE, MessageData.ephemeral(content));
    }

    public static InteractionResponse deferred() {
        return new InteractionResponse(TYPE_DEFERRED_CHANNEL_MESSAGE_WITH_SOURCE, null);
    }
}
