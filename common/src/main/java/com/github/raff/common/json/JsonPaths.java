package com.github.raff.common.json;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Dotted-path lookups over a Jackson tree. Every lookup takes several candidate
 * paths and returns the first one that resolves to a usable value, which is how
 * platform payloads with drifting field names are read.
 */
public final class JsonPaths {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private JsonPaths() {
    }

    /** Node at {@code path} ("data.items.0.id"), or null when any segment is missing or null. */
    public static JsonNode at(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || current.isNull() || current.isMissingNode()) return null;
            if (current.isArray() && isIndex(segment)) {
                current = current.get(Integer.parseInt(segment));
            } else {
                current = current.get(segment);
            }
        }
        return (current == null || current.isNull() || current.isMissingNode()) ? null : current;
    }

    /** First textual or numeric scalar among the candidate paths, as a string. Blank strings are skipped. */
    public static String firstText(JsonNode root, String... paths) {
        for (String path : paths) {
            JsonNode node = at(root, path);
            if (node == null) continue;
            if (node.isTextual()) {
                String text = node.asText();
                if (!text.isBlank()) return text;
            } else if (node.isNumber()) {
                return node.isIntegralNumber() ? node.bigIntegerValue().toString() : node.decimalValue().toPlainString();
            }
        }
        return null;
    }

    /** First path that is present at all (numeric, textual or otherwise); used to tell "missing" from "unparseable". */
    public static JsonNode firstPresent(JsonNode root, String... paths) {
        for (String path : paths) {
            JsonNode node = at(root, path);
            if (node != null) return node;
        }
        return null;
    }

    /** Decimal from a numeric or numeric-string node; null when absent or unparseable. */
    public static BigDecimal decimal(JsonNode node) {
        if (node == null) return null;
        if (node.isNumber()) return node.decimalValue();
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Instant from ISO-8601, "yyyy-MM-dd HH:mm:ss" (UTC) or epoch seconds; null when absent or unparseable. */
    public static Instant instant(JsonNode node) {
        if (node == null) return null;
        if (node.isNumber()) return Instant.ofEpochSecond(node.asLong());
        if (!node.isTextual()) return null;
        String text = node.asText().trim();
        if (text.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }
}
