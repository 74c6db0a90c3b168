package io.limitgraph.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.limitgraph.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int DEFAULT_EXCERPT_CHARS = 160;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "private_key"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{32,}$");
    private static final Pattern IDENTIFIER = Pattern.compile(
            "^([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}|[0-9a-fA-F]+)$");
    private static final Pattern PROVIDER_KEY = Pattern.compile("\\b(sk-[A-Za-z0-9]{20,}|AKIA[0-9A-Z]{16}|ghp_[A-Za-z0-9]{36})\\b");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey()) && !entry.getValue().isContainerNode()) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            String replaced = PROVIDER_KEY.matcher(text).replaceAll(MASK);
            return replaced.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(replaced);
        }
        return input;
    }

    /**
     * JSON-pointer style paths of values that look like credentials.
     */
    public static List<String> findSecrets(JsonNode input) {
        List<String> out = new ArrayList<>();
        collect(input, "", out);
        return out;
    }

    /**
     * Masked, compact, length-bounded rendering suitable for a log line.
     */
    public static String excerpt(JsonNode input) {
        String text = Jsons.toCompactJson(masked(input));
        if (text.length() <= DEFAULT_EXCERPT_CHARS) {
            return text;
        }
        return text.substring(0, DEFAULT_EXCERPT_CHARS) + "...";
    }

    private static void collect(JsonNode node, String path, List<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String child = path + "/" + entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(entry.getKey()) && value.isTextual() && !value.asText("").isBlank()) {
                    out.add(child);
                } else {
                    collect(value, child, out);
                }
            }
            return;
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), path + "/" + i, out);
            }
            return;
        }
        if (node.isTextual() && (likelySecretValue(node.asText("")) || PROVIDER_KEY.matcher(node.asText("")).find())) {
            out.add(path.isEmpty() ? "/" : path);
        }
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 32) {
            return false;
        }
        // Long opaque strings without spaces are treated as tokens; UUIDs and hex digests are not.
        return OPAQUE_TOKEN.matcher(v).matches() && !IDENTIFIER.matcher(v).matches() && hasMixedClasses(v);
    }

    private static boolean hasMixedClasses(String v) {
        boolean digit = false;
        boolean letter = false;
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            digit |= Character.isDigit(ch);
            letter |= Character.isLetter(ch);
        }
        return digit && letter;
    }
}
