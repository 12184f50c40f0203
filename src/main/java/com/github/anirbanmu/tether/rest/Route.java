package com.github.anirbanmu.tether.rest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// method, path template (e.g. /channels/{channel_id}/messages) and placeholder values.
// major parameters (channel, guild, webhook id/token) split a template into separate
// rate-limit scopes, the rest only fill the path
public record Route(String method, String template, Map<String, ?> params) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    public Route {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static Route of(String method, String template) {
        return new Route(method, template, Map.of());
    }

    public static Route of(String method, String template, Map<String, ?> params) {
        return new Route(method, template, params);
    }

    // identifies the template across all major parameter values
    public String routeKey() {
        return method + template;
    }

    public String majorKey() {
        return param("channel_id") + "/" + param("guild_id") + "/" + param("webhook_id") + "/" + param("webhook_token");
    }

    public String path() {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 32);
        while (m.find()) {
            Object value = params.get(m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("Route " + template + " is missing parameter '" + m.group(1) + "'");
            }
            String encoded = URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8).replace("+", "%20");
            m.appendReplacement(sb, Matcher.quoteReplacement(encoded));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private String param(String name) {
        Object value = params.get(name);
        return value == null ? "None" : String.valueOf(value);
    }
}
