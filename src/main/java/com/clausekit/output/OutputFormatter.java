package com.clausekit.output;

import com.clausekit.json.JsonNode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.tuple.Pair;

public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(JsonNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        if (prettyPrint) {
            formatPretty(node, 0, sb);
        } else {
            formatCompact(node, sb);
        }

        return sb.toString();
    }

    private void formatPretty(JsonNode node, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (node instanceof JsonNode.JsonObject obj) {
            if (obj.fields().isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{\n");

            boolean first = true;
            for (var entry : entries(obj)) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr)
                  .append("  \"")
                  .append(escapeString(entry.getOne()))
                  .append("\": ");
                formatPretty(entry.getTwo(), indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("}");
        } else if (node instanceof JsonNode.JsonArray arr) {
            if (arr.elements().isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[\n");

            boolean first = true;
            for (JsonNode element : arr.elements()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private void formatCompact(JsonNode node, StringBuilder sb) {
        if (node instanceof JsonNode.JsonObject obj) {
            sb.append("{");

            boolean first = true;
            for (var entry : entries(obj)) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"")
                  .append(escapeString(entry.getOne()))
                  .append("\":");
                formatCompact(entry.getTwo(), sb);
            }

            sb.append("}");
        } else if (node instanceof JsonNode.JsonArray arr) {
            sb.append("[");

            boolean first = true;
            for (JsonNode element : arr.elements()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                formatCompact(element, sb);
            }

            sb.append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private ListIterable<Pair<String, JsonNode>> entries(JsonNode.JsonObject obj) {
        return sortKeys
            ? obj.fields().keyValuesView().toSortedListBy(Pair::getOne)
            : obj.fields().keyValuesView().toList();
    }

    private void formatScalar(JsonNode node, StringBuilder sb) {
        if (node instanceof JsonNode.JsonString s) {
            sb.append("\"").append(escapeString(s.value())).append("\"");
        } else if (node instanceof JsonNode.JsonNumber n) {
            sb.append(n.toJsonString());
        } else if (node instanceof JsonNode.JsonBoolean b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
