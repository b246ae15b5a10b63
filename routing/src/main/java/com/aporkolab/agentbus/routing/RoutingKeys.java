package com.aporkolab.agentbus.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dot-delimited routing-key templates with {@code {name}} placeholders.
 */
public final class RoutingKeys {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private RoutingKeys() {
    }

    /**
     * Substitute every placeholder in {@code template}. Extra parameters are ignored.
     *
     * @throws MissingParameterException naming the first placeholder without a value
     */
    public static String format(String template, Map<String, ?> params) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (params == null || !params.containsKey(name) || params.get(name) == null) {
                throw new MissingParameterException(name, template);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(params.get(name))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static List<String> placeholders(String template) {
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Structural match: equal segment counts, literal segments equal, placeholder segments match anything.
     */
    public static boolean matches(String pattern, String routingKey) {
        if (pattern == null || routingKey == null) {
            return false;
        }
        String[] patternParts = pattern.split("\\.", -1);
        String[] keyParts = routingKey.split("\\.", -1);

        if (patternParts.length != keyParts.length) {
            return false;
        }

        for (int i = 0; i < patternParts.length; i++) {
            if (isPlaceholder(patternParts[i])) {
                continue;
            }
            if (!patternParts[i].equals(keyParts[i])) {
                return false;
            }
        }
        return true;
    }

    static boolean isPlaceholder(String segment) {
        return segment.length() > 1 && segment.startsWith("{") && segment.endsWith("}");
    }
}
