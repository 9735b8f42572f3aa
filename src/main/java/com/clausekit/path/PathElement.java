package com.clausekit.path;

import com.clausekit.json.JsonNode;

import java.util.Optional;

public sealed interface PathElement {

    /**
     * Looks this element up in {@code container}. An absent member or out-of-range index yields
     * {@link Optional#empty()}; a container of the wrong shape is an error.
     */
    Optional<JsonNode> lookup(JsonNode container);

    /**
     * Returns a copy of {@code container} holding {@code value} at this element.
     */
    JsonNode replace(JsonNode container, JsonNode value);

    record Field(String name) implements PathElement {
        @Override
        public Optional<JsonNode> lookup(JsonNode container) {
            if (container instanceof JsonNode.JsonObject obj) {
                return Optional.ofNullable(obj.fields().get(name));
            }
            throw new KeyPathException("Cannot look up field \"" + name + "\" in a non-object: " + container);
        }

        @Override
        public JsonNode replace(JsonNode container, JsonNode value) {
            if (container instanceof JsonNode.JsonObject obj) {
                return obj.with(name, value);
            }
            throw new KeyPathException("Cannot set field \"" + name + "\" in a non-object: " + container);
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }

    record Index(int index) implements PathElement {
        @Override
        public Optional<JsonNode> lookup(JsonNode container) {
            if (container instanceof JsonNode.JsonArray arr) {
                int resolved = resolve(arr);
                return resolved >= 0 && resolved < arr.elements().size()
                    ? Optional.of(arr.elements().get(resolved))
                    : Optional.empty();
            }
            throw new KeyPathException("Cannot look up index " + index + " in a non-array: " + container);
        }

        @Override
        public JsonNode replace(JsonNode container, JsonNode value) {
            if (container instanceof JsonNode.JsonArray arr) {
                int resolved = resolve(arr);
                if (resolved < 0 || resolved >= arr.elements().size()) {
                    throw new KeyPathException("Index " + index + " out of bounds for array of size " + arr.elements().size());
                }
                return arr.withElementAt(resolved, value);
            }
            throw new KeyPathException("Cannot set index " + index + " in a non-array: " + container);
        }

        // negative indices count from the end
        private int resolve(JsonNode.JsonArray arr) {
            return index < 0 ? arr.elements().size() + index : index;
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }
}
