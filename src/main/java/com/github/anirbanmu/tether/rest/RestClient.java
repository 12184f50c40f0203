package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.log.Log;
import com.github.anirbanmu.tether.rest.json.ApplicationCommand;
import com.github.anirbanmu.tether.rest.json.GatewayBot;
import com.github.anirbanmu.tether.rest.json.InteractionResponse;
import com.github.anirbanmu.tether.util.Json;
import java.io.IOException;
import java.util.List;
import java.util.Map;

// discord endpoints a bot uses. calls return the decoded body (Map/List, null for 204s)
// unless a typed record exists. followups are webhook calls keyed by application id and
// interaction token, so each interaction gets its own bucket
public class RestClient implements AutoCloseable {
    private final RequestExecutor executor;
    private final String applicationId;

    public RestClient(RequestExecutor executor, String applicationId) {
        this.executor = executor;
        this.applicationId = applicationId;
    }

    public RequestExecutor executor() {
        return executor;
    }

    public GatewayBot getGatewayBot() {
        RestResponse response = executor.execute(Route.of("GET", "/gateway/bot"), null);
        try {
            GatewayBot bot = Json.parse(GatewayBot.class, response.body());
            Log.info("rest.gateway_bot", "url", bot.url(), "shards", bot.shards(),
                "session_starts_left", bot.sessionStartLimit() == null ? null : bot.sessionStartLimit().remaining());
            return bot;
        } catch (IOException e) {
            throw new RestTransportException("Malformed /gateway/bot response", e);
        }
    }

    public Object bulkUpsertGlobalCommands(List<ApplicationCommand> commands) {
        Log.info("rest.upsert_global_commands", "count", commands.size());
        return executor.request("PUT", "/applications/{application_id}/commands",
            Map.of("application_id", requireApplicationId()), commands);
    }

    public Object bulkUpsertGuildCommands(String guildId, List<ApplicationCommand> commands) {
        Log.info("rest.upsert_guild_commands", "guild", guildId, "count", commands.size());
        return executor.request("PUT", "/applications/{application_id}/guilds/{guild_id}/commands",
            Map.of("application_id", requireApplicationId(), "guild_id", guildId), commands);
    }

    public Object createInteractionResponse(String interactionId, String interactionToken, InteractionResponse response) {
        return executor.request("POST", "/interactions/{interaction_id}/{webhook_token}/callback",
            Map.of("interaction_id", interactionId, "webhook_token", interactionToken), response);
    }

    public Object getOriginalInteractionResponse(String interactionToken) {
        return executor.request("GET", "/webhooks/{webhook_id}/{webhook_token}/messages/@original",
            webhook(interactionToken), null);
    }

    public Object editOriginalInteractionResponse(String interactionToken, Object message) {
        return executor.request("PATCH", "/webhooks/{webhook_id}/{webhook_token}/messages/@original",
            webhook(interactionToken), message);
    }

    public void deleteOriginalInteractionResponse(String interactionToken) {
        executor.request("DELETE", "/webhooks/{webhook_id}/{webhook_token}/messages/@original",
            webhook(interactionToken), null);
    }

    public Object createFollowupMessage(String interactionToken, Object message) {
        return executor.request("POST", "/webhooks/{webhook_id}/{webhook_token}",
            webhook(interactionToken), message);
    }

    public Object getFollowupMessage(String interactionToken, String messageId) {
        return executor.request("GET", "/webhooks/{webhook_id}/{webhook_token}/messages/{message_id}",
            webhook(interactionToken, messageId), null);
    }

    public Object editFollowupMessage(String interactionToken, String messageId, Object message) {
        return executor.request("PATCH", "/webhooks/{webhook_id}/{webhook_token}/messages/{message_id}",
            webhook(interactionToken, messageId), message);
    }

    public void deleteFollowupMessage(String interactionToken, String messageId) {
        executor.request("DELETE", "/webhooks/{webhook_id}/{webhook_token}/messages/{message_id}",
            webhook(interactionToken, messageId), null);
    }

    public Object createMessage(String channelId, Object message) {
        return executor.request("POST", "/channels/{channel_id}/messages",
            Map.of("channel_id", channelId), message);
    }

    public Object editMessage(String channelId, String messageId, Object message) {
        return executor.request("PATCH", "/channels/{channel_id}/messages/{message_id}",
            Map.of("channel_id", channelId, "message_id", messageId), message);
    }

    @Override
    public void close() {
        executor.close();
    }

    private Map<String, Object> webhook(String interactionToken) {
        return Map.of("webhook_id", requireApplicationId(), "webhook_token", interactionToken);
    }

    private Map<String, Object> webhook(String interactionToken, String messageId) {
        return Map.of("webhook_id", requireApplicationId(), "webhook_token", interactionToken, "message_id", messageId);
    }

    private String requireApplicationId() {
        if (applicationId == null || applicationId.isEmpty()) {
            throw new IllegalStateException("application id is required for this endpoint");
        }
        return applicationId;
    }
}
