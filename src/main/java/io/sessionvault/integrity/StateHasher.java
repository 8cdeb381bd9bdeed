package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.util.Hashing;
import io.sessionvault.util.Jsons;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Canonical SHA-256 over arbitrary state. The value is first turned into a JSON tree
 * (timestamps as ISO-8601 strings), then object keys are sorted and every array is
 * normalized and sorted by its elements' canonical text, so the digest depends on
 * content only and not on key or element order.
 */
public final class StateHasher {
    private StateHasher() {
    }

    public static String hash(Object state) {
        JsonNode tree = state instanceof JsonNode ? (JsonNode) state : Jsons.compactMapper().valueToTree(state);
        return Hashing.sha256Hex(canonicalText(tree));
    }

    public static String canonicalText(JsonNode node) {
        return Jsons.toCompactJson(canonicalize(node));
    }

    public static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            TreeSet<String> names = new TreeSet<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(canonicalize(element));
            }
            elements.sort(Comparator.comparing(Jsons::toCompactJson));
            ArrayNode array = JsonNodeFactory.instance.arrayNode(elements.size());
            array.addAll(elements);
            return array;
        }
        return node;
    }
}
