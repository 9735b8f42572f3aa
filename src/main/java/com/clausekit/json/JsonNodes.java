package com.clausekit.json;

import java.util.ArrayDeque;
import java.util.Deque;

public final class JsonNodes {
    private JsonNodes() {
    }

    /**
     * Same result as {@code a.equals(b)}, compared with an explicit stack so that arbitrarily deep
     * trees can be compared.
     */
    public static boolean structurallyEqual(JsonNode a, JsonNode b) {
        Deque<JsonNode[]> pending = new ArrayDeque<>();
        pending.push(new JsonNode[] {a, b});

        while (!pending.isEmpty()) {
            JsonNode[] pair = pending.pop();
            JsonNode left = pair[0];
            JsonNode right = pair[1];
            if (left == right) {
                continue;
            }
            if (left instanceof JsonNode.JsonArray leftArr && right instanceof JsonNode.JsonArray rightArr) {
                if (leftArr.elements().size() != rightArr.elements().size()) {
                    return false;
                }
                for (int i = 0; i < leftArr.elements().size(); i++) {
                    pending.push(new JsonNode[] {leftArr.elements().get(i), rightArr.elements().get(i)});
                }
            } else if (left instanceof JsonNode.JsonObject leftObj && right instanceof JsonNode.JsonObject rightObj) {
                if (leftObj.fields().size() != rightObj.fields().size()) {
                    return false;
                }
                for (var entry : leftObj.fields().keyValuesView()) {
                    JsonNode other = rightObj.fields().get(entry.getOne());
                    if (other == null) {
                        return false;
                    }
                    pending.push(new JsonNode[] {entry.getTwo(), other});
                }
            } else if (left instanceof JsonNode.JsonArray || left instanceof JsonNode.JsonObject
                || right instanceof JsonNode.JsonArray || right instanceof JsonNode.JsonObject) {
                return false;
            } else if (!left.equals(right)) {
                return false;
            }
        }
        return true;
    }
}
