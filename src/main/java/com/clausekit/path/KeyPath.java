package com.clausekit.path;

import com.clausekit.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ordered sequence of keys locating a position within a query document, e.g. {@code .query.filter}.
 * <p>
 * Lookups never fabricate structure: every element except the last must already exist. Updates
 * rebuild only the objects and arrays along the path; everything else is shared with the input.
 */
public record KeyPath(ImmutableList<PathElement> elements) {
    private static final KeyPath ROOT = new KeyPath(Lists.immutable.empty());

    public static KeyPath root() {
        return ROOT;
    }

    public static KeyPath parse(String path) {
        return new KeyPathParser().parse(path);
    }

    /**
     * Builds a path from field names ({@link String}) and array indices ({@link Integer}).
     */
    public static KeyPath of(Object... keys) {
        var elements = Lists.mutable.<PathElement>empty();
        for (Object key : keys) {
            if (key instanceof String name) {
                elements.add(new PathElement.Field(name));
            } else if (key instanceof Integer index) {
                elements.add(new PathElement.Index(index));
            } else {
                throw new IllegalArgumentException("Unsupported key path element: " + key);
            }
        }
        return new KeyPath(elements.toImmutable());
    }

    public boolean isRoot() {
        return elements.isEmpty();
    }

    public KeyPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no parent");
        }
        return new KeyPath(elements.take(elements.size() - 1));
    }

    public PathElement last() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no elements");
        }
        return elements.getLast();
    }

    public KeyPath child(PathElement element) {
        return new KeyPath(elements.newWith(element));
    }

    /**
     * Returns the node at this path, failing if any element is missing.
     */
    public JsonNode get(JsonNode root) {
        JsonNode current = root;
        for (int i = 0; i < elements.size(); i++) {
            current = step(current, i);
        }
        return current;
    }

    /**
     * Returns the node at this path, or empty if only the final element is missing.
     */
    public Optional<JsonNode> find(JsonNode root) {
        if (isRoot()) {
            return Optional.of(root);
        }
        return last().lookup(parent().get(root));
    }

    /**
     * Replaces the node at this path with {@code fn} applied to it. The node must exist.
     */
    public JsonNode update(JsonNode root, UnaryOperator<JsonNode> fn) {
        return updateIn(root, 0, fn);
    }

    /**
     * Stores {@code value} at this path, adding the final object member if it is missing.
     */
    public JsonNode assoc(JsonNode root, JsonNode value) {
        if (isRoot()) {
            return value;
        }
        PathElement last = last();
        return parent().update(root, container -> {
            try {
                return last.replace(container, value);
            } catch (KeyPathException e) {
                throw new KeyPathException(this, e.getMessage());
            }
        });
    }

    private JsonNode updateIn(JsonNode node, int depth, UnaryOperator<JsonNode> fn) {
        if (depth == elements.size()) {
            return fn.apply(node);
        }
        JsonNode child = step(node, depth);
        JsonNode updated = updateIn(child, depth + 1, fn);
        return updated == child ? node : elements.get(depth).replace(node, updated);
    }

    private JsonNode step(JsonNode node, int depth) {
        Optional<JsonNode> found;
        try {
            found = elements.get(depth).lookup(node);
        } catch (KeyPathException e) {
            throw new KeyPathException(this, e.getMessage());
        }
        return found.orElseThrow(() -> new KeyPathException(this, "No value at " + prefix(depth + 1)));
    }

    private String prefix(int length) {
        return new KeyPath(elements.take(length)).toString();
    }

    @Override
    public String toString() {
        return isRoot() ? "." : elements.makeString("");
    }
}
