package com.veriheal.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for reading JSON out of free-form model output.
 */
final class JsonResponses {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private JsonResponses() { }

    /**
     * Contents of the first fenced block, else the text from the first '{' to
     * the last '}', else the trimmed text.
     */
    static String extractJson(String text) {
        if (text == null) return "";
        Matcher m = FENCED.matcher(text);
        if (m.find()) return m.group(1).trim();
        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start >= 0 && end > start) return text.substring(start, end + 1);
        return text.trim();
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return value.asText();
    }

    static double doubleOr(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : fallback;
    }
}
