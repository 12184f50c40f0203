package com.github.anirbanmu.tether.rest.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// message body shared by interaction responses, followups and plain channel messages
@CompiledJson
public record MessageData(@JsonAttribute(nullable = true) String content, @JsonAttribute(nullable = true) Integer flags, @JsonAttribute(nullable = true) Boolean tts) {
    public static final int FLAG_EPHEMERAL = 64;

    public static MessageData content(String content) {
        return new MessageData(content, null, null);
    }

    public static MessageData ephemeral(String content) {
        return new MessageData(content, FLAG_EPHEMERAL, null);
    }
}
