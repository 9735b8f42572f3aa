package com.clausekit.clause;

import com.clausekit.json.JsonNode;
import com.clausekit.walk.TreeWalker;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.SetIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Structural predicates over clauses. A clause is a JSON array whose first element is a tag-shaped
 * string, for example {@code ["=", ["field-id", 10], 20]}. Tags are compared in canonical form, so
 * {@code ["FIELD_ID", 10]} and {@code ["field-id", 10]} match the same selectors.
 */
public final class Clauses {
    private static final TreeWalker WALKER = new TreeWalker();

    private Clauses() {
    }

    public static boolean isClause(JsonNode node) {
        return node instanceof JsonNode.JsonArray arr
            && !arr.elements().isEmpty()
            && arr.elements().getFirst() instanceof JsonNode.JsonString head
            && TokenNormalizer.isIdentifier(head.value());
    }

    public static boolean matches(ClauseSelector selector, JsonNode node) {
        return isClause(node) && selector.accepts(tagOf(node));
    }

    public static boolean matches(Tag tag, JsonNode node) {
        return isClause(node) && tagOf(node).equals(tag);
    }

    public static boolean matches(SetIterable<Tag> tags, JsonNode node) {
        return isClause(node) && tags.contains(tagOf(node));
    }

    public static Tag tagOf(JsonNode clause) {
        if (!isClause(clause)) {
            throw new IllegalArgumentException("Not a clause: " + clause);
        }
        return TokenNormalizer.normalize(((JsonNode.JsonArray) clause).elements().getFirst());
    }

    public static ImmutableList<JsonNode> arguments(JsonNode clause) {
        if (!isClause(clause)) {
            throw new IllegalArgumentException("Not a clause: " + clause);
        }
        return ((JsonNode.JsonArray) clause).elements().drop(1);
    }

    public static JsonNode.JsonArray clause(Tag tag, JsonNode... args) {
        return clause(tag, Lists.immutable.of(args));
    }

    public static JsonNode.JsonArray clause(Tag tag, ImmutableList<JsonNode> args) {
        return new JsonNode.JsonArray(Lists.immutable.<JsonNode>of(new JsonNode.JsonString(tag.name())).newWithAll(args));
    }

    /**
     * Rewrites the head of every clause in {@code root} to its canonical spelling.
     */
    public static JsonNode normalizeTags(JsonNode root) {
        return WALKER.rewrite(ClauseSelector.anyClause(), root, Clauses::withCanonicalHead);
    }

    private static JsonNode withCanonicalHead(JsonNode clause) {
        Tag tag = tagOf(clause);
        JsonNode.JsonArray arr = (JsonNode.JsonArray) clause;
        if (arr.elements().getFirst() instanceof JsonNode.JsonString head && head.value().equals(tag.name())) {
            return clause;
        }
        return arr.withElementAt(0, new JsonNode.JsonString(tag.name()));
    }
}
