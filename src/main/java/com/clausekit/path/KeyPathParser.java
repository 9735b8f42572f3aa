package com.clausekit.path;

import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses the textual form of a key path: {@code .} for the document root, {@code .name} for an
 * object member and {@code [n]} (or {@code .[n]}) for an array element, chained left to right,
 * e.g. {@code .query.joins[0].condition}.
 */
public class KeyPathParser {
    public KeyPath parse(String pathString) {
        if (pathString == null || pathString.isBlank()) {
            throw new IllegalArgumentException("Empty key path");
        }

        String trimmed = pathString.trim();
        if (trimmed.equals(".")) {
            return KeyPath.root();
        }
        if (!trimmed.startsWith(".")) {
            throw new IllegalArgumentException("Key path must start with '.': " + pathString);
        }

        var elements = Lists.mutable.<PathElement>empty();
        int i = 0;
        while (i < trimmed.length()) {
            char c = trimmed.charAt(i);
            if (c == '.' && i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '[') {
                i++;
            } else if (c == '.') {
                int end = findFieldEnd(trimmed, i + 1);
                String field = trimmed.substring(i + 1, end);
                if (field.isEmpty()) {
                    throw new IllegalArgumentException("Empty field name in key path: " + pathString);
                }
                elements.add(new PathElement.Field(field));
                i = end;
            } else if (c == '[') {
                int close = trimmed.indexOf(']', i);
                if (close == -1) {
                    throw new IllegalArgumentException("Unterminated index in key path: " + pathString);
                }
                String indexStr = trimmed.substring(i + 1, close).trim();
                try {
                    elements.add(new PathElement.Index(Integer.parseInt(indexStr)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid array index: " + indexStr, e);
                }
                i = close + 1;
            } else {
                throw new IllegalArgumentException("Unsupported key path: " + pathString);
            }
        }

        return new KeyPath(elements.toImmutable());
    }

    private int findFieldEnd(String path, int start) {
        int i = start;
        while (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
            i++;
        }
        return i;
    }
}
