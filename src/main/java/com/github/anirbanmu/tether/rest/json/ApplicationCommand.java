package com.github.anirbanmu.tether.rest.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// body element for the bulk command overwrite endpoints
@CompiledJson
public record ApplicationCommand(
    String name,
    String description,
    int type,
    @JsonAttribute(nullable = true) List<Option> options,
    @JsonAttribute(name = "default_member_permissions", nullable = true) String defaultMemberPermissions,
    @JsonAttribute(nullable = true) List<Integer> contexts) {

    public static final int TYPE_CHAT_INPUT = 1;
    public static final int TYPE_USER = 2;
    public static final int TYPE_MESSAGE = 3;

    public static ApplicationCommand slash(String name, String description, List<Option> options) {
        return new ApplicationCommand(name, description, TYPE_CHAT_INPUT, options, null, null);
    }

    @CompiledJson
    public record Option(
        String name,
        String description,
        int type,
        boolean required,
        @JsonAttribute(nullable = true) List<Choice> choices,
        @JsonAttribute(nullable = true) Boolean autocomplete) {

        public static final int TYPE_SUB_COMMAND = 1;
        public static final int TYPE_SUB_COMMAND_GROUP = 2;
        public static final int TYPE_STRING = 3;
        public static final int TYPE_INTEGER = 4;
        public static final int TYPE_BOOLEAN = 5;
        public static final int TYPE_USER = 6;
        public static final int TYPE_CHANNEL = 7;
        public static final int TYPE_ROLE = 8;
    }

    @CompiledJson
    public record Choice(String name, String value) {
    }
}
