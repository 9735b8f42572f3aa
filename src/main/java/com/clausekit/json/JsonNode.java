package com.clausekit.json;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Immutable JSON value. Query documents and the clauses embedded in them are trees of these nodes;
 * every "modification" produces a new tree that shares unchanged subtrees with the old one.
 */
public sealed interface JsonNode {
    record JsonObject(ImmutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(Maps.immutable.empty());
        }

        public JsonObject with(String key, JsonNode value) {
            return new JsonObject(fields.newWithKeyValue(key, value));
        }
    }

    record JsonArray(ImmutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.immutable.empty());
        }

        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.immutable.of(elements));
        }

        public JsonArray with(JsonNode element) {
            return new JsonArray(elements.newWith(element));
        }

        public JsonArray withElementAt(int index, JsonNode element) {
            var newElements = elements.toList();
            newElements.set(index, element);
            return new JsonArray(newElements.toImmutable());
        }
    }

    record JsonString(String value) implements JsonNode {}

    // Numbers keep their primitive form instead of BigDecimal
    sealed interface JsonNumber extends JsonNode {
        String toJsonString();
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public String toJsonString() {
                // Fast path for whole numbers (common case)
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return Long.toString((long) value);
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}
    record JsonNull() implements JsonNode {}

    static JsonString of(String value) {
        return new JsonString(value);
    }

    static JsonNumber of(long value) {
        return JsonNumber.of(value);
    }
}
