package com.github.anirbanmu.tether.gateway.json;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// opcode 8 payload. either a username prefix query or a list of user ids, never both
public record RequestGuildMembers(String guildId, int limit, boolean presences, String nonce, List<String> userIds, String query) {

    public static RequestGuildMembers byQuery(String guildId, String query, int limit) {
        return new RequestGuildMembers(guildId, limit, false, null, null, query == null ? "" : query);
    }

    public static RequestGuildMembers byUserIds(String guildId, List<String> userIds) {
        return new RequestGuildMembers(guildId, 0, false, null, List.copyOf(userIds), null);
    }

    public RequestGuildMembers withPresences(boolean presences) {
        return new RequestGuildMembers(guildId, limit, presences, nonce, userIds, query);
    }

    public RequestGuildMembers withNonce(String nonce) {
        return new RequestGuildMembers(guildId, limit, presences, nonce, userIds, query);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("guild_id", guildId);
        json.put("limit", limit);
        if (presences) {
            json.put("presences", true);
        }
        if (nonce != null) {
            json.put("nonce", nonce);
        }
        if (userIds != null && !userIds.isEmpty()) {
            json.put("user_ids", userIds);
        }
        if (query != null || userIds == null || userIds.isEmpty()) {
            json.put("query", query == null ? "" : query);
        }
        return json;
    }
}
