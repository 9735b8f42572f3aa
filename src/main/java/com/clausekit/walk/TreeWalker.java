package com.clausekit.walk;

import com.clausekit.clause.ClauseSelector;
import com.clausekit.clause.Clauses;
import com.clausekit.clause.Tag;
import com.clausekit.json.JsonNode;
import com.clausekit.path.KeyPath;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.SetIterable;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.UnaryOperator;

/**
 * Depth-first, post-order traversal of a document. Every array element and every object value is
 * visited, whatever the tag of the enclosing clause; a node is visited only after all of its
 * descendants. Traversal keeps its own stack, so deeply nested documents do not exhaust the call stack.
 */
public class TreeWalker {

    /**
     * Returns every clause in {@code root} accepted by {@code selector}, in post-order: children before
     * their ancestors, array siblings left to right. Matches nested inside other matches are included.
     */
    public ImmutableList<JsonNode> collect(ClauseSelector selector, JsonNode root) {
        MutableList<JsonNode> instances = Lists.mutable.empty();
        postwalk(root, node -> {
            if (Clauses.matches(selector, node)) {
                instances.add(node);
            }
            return node;
        });
        return instances.toImmutable();
    }

    public ImmutableList<JsonNode> collect(Tag tag, JsonNode root) {
        return collect(ClauseSelector.of(tag), root);
    }

    public ImmutableList<JsonNode> collect(SetIterable<Tag> tags, JsonNode root) {
        return collect(ClauseSelector.anyOf(tags), root);
    }

    /**
     * Replaces every clause accepted by {@code selector} with {@code f(clause)} in a single bottom-up pass.
     * A clause is tested after its own arguments have been rewritten. The value returned by {@code f}
     * is not examined again, so a replacement that itself matches is left for a later call.
     */
    public JsonNode rewrite(ClauseSelector selector, JsonNode root, UnaryOperator<JsonNode> f) {
        return postwalk(root, node -> Clauses.matches(selector, node) ? f.apply(node) : node);
    }

    public JsonNode rewrite(Tag tag, JsonNode root, UnaryOperator<JsonNode> f) {
        return rewrite(ClauseSelector.of(tag), root, f);
    }

    public JsonNode rewrite(SetIterable<Tag> tags, JsonNode root, UnaryOperator<JsonNode> f) {
        return rewrite(ClauseSelector.anyOf(tags), root, f);
    }

    /**
     * Like {@link #rewrite}, restricted to the subtree at {@code path}. The rest of the document is
     * returned as is.
     *
     * @throws com.clausekit.path.KeyPathException if {@code path} does not resolve in {@code root}
     */
    public JsonNode rewriteAt(KeyPath path, ClauseSelector selector, JsonNode root, UnaryOperator<JsonNode> f) {
        return path.update(root, subtree -> rewrite(selector, subtree, f));
    }

    public JsonNode rewriteAt(KeyPath path, Tag tag, JsonNode root, UnaryOperator<JsonNode> f) {
        return rewriteAt(path, ClauseSelector.of(tag), root, f);
    }

    public JsonNode rewriteAt(KeyPath path, SetIterable<Tag> tags, JsonNode root, UnaryOperator<JsonNode> f) {
        return rewriteAt(path, ClauseSelector.anyOf(tags), root, f);
    }

    /**
     * Rebuilds {@code root} bottom-up, replacing each node with {@code visitor} applied to the node
     * with its children already rebuilt. Nodes whose children came back unchanged are passed to
     * the visitor as the original instance.
     */
    public JsonNode postwalk(JsonNode root, UnaryOperator<JsonNode> visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));

        while (true) {
            Frame top = stack.peek();
            if (top.hasNextChild()) {
                stack.push(new Frame(top.nextChild()));
                continue;
            }

            stack.pop();
            JsonNode visited = visitor.apply(top.rebuild());
            if (stack.isEmpty()) {
                return visited;
            }
            stack.peek().accept(visited);
        }
    }

    private static final class Frame {
        private final JsonNode node;
        private final ImmutableList<String> keys;
        private final ImmutableList<JsonNode> children;
        private final MutableList<JsonNode> rebuilt;
        private int next;

        Frame(JsonNode node) {
            this.node = node;
            if (node instanceof JsonNode.JsonArray arr) {
                this.keys = null;
                this.children = arr.elements();
            } else if (node instanceof JsonNode.JsonObject obj) {
                this.keys = obj.fields().keysView().toList().toImmutable();
                this.children = keys.collect(key -> obj.fields().get(key));
            } else {
                this.keys = null;
                this.children = Lists.immutable.empty();
            }
            this.rebuilt = Lists.mutable.empty();
        }

        boolean hasNextChild() {
            return next < children.size();
        }

        JsonNode nextChild() {
            return children.get(next++);
        }

        void accept(JsonNode child) {
            rebuilt.add(child);
        }

        JsonNode rebuild() {
            if (unchanged()) {
                return node;
            }
            if (keys == null) {
                return new JsonNode.JsonArray(rebuilt.toImmutable());
            }
            var fields = Maps.mutable.<String, JsonNode>empty();
            for (int i = 0; i < keys.size(); i++) {
                fields.put(keys.get(i), rebuilt.get(i));
            }
            return new JsonNode.JsonObject(fields.toImmutable());
        }

        private boolean unchanged() {
            for (int i = 0; i < children.size(); i++) {
                if (rebuilt.get(i) != children.get(i)) {
                    return false;
                }
            }
            return true;
        }
    }
}
