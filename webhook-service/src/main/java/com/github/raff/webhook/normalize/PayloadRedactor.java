package com.github.raff.webhook.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Produces the payload snapshot persisted in the ledger and audit log: customer
 * and consignee blocks are dropped and credential-like keys are masked at any depth.
 */
@Component
@RequiredArgsConstructor
public class PayloadRedactor {

    static final String MASK = "***";

    private static final List<String[]> REMOVED_PATHS = List.of(
            new String[]{"customer"},
            new String[]{"consignee"},
            new String[]{"data", "customer"},
            new String[]{"data", "consignee"},
            new String[]{"order", "customer"},
            new String[]{"order", "consignee"}
    );

    private static final Set<String> MASKED_KEYS = Set.of(
            "authorization", "access_token", "refresh_token", "token", "secret", "signature", "password");

    private final ObjectMapper objectMapper;

    public String redact(JsonNode payload) {
        if (payload == null) return null;
        JsonNode copy = payload.deepCopy();
        for (String[] path : REMOVED_PATHS) {
            remove(copy, path);
        }
        mask(copy);
        try {
            return objectMapper.writeValueAsString(copy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize redacted payload", e);
        }
    }

    private static void remove(JsonNode root, String[] path) {
        JsonNode current = root;
        for (int i = 0; i < path.length - 1; i++) {
            current = current.get(path[i]);
            if (current == null || !current.isObject()) return;
        }
        if (current.isObject()) {
            ((ObjectNode) current).remove(path[path.length - 1]);
        }
    }

    private static void mask(JsonNode node) {
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            List<String> toMask = new ArrayList<>();
            for (Map.Entry<String, JsonNode> field : (Iterable<Map.Entry<String, JsonNode>>) obj::fields) {
                if (MASKED_KEYS.contains(field.getKey().toLowerCase(Locale.ROOT))) {
                    toMask.add(field.getKey());
                } else {
                    mask(field.getValue());
                }
            }
            toMask.forEach(key -> obj.put(key, MASK));
        } else if (node.isArray()) {
            node.forEach(PayloadRedactor::mask);
        }
    }
}
