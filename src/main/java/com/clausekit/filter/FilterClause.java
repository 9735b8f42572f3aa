package com.clausekit.filter;

import com.clausekit.clause.Clauses;
import com.clausekit.clause.Tag;
import com.clausekit.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Boolean shape of the root of a filter. {@code and}, {@code or} and single-argument {@code not}
 * clauses become compound variants; anything else is an opaque {@link Leaf} that carries the node as
 * received. Arguments stay JSON, so a term is classified one level at a time however deep it is.
 */
public sealed interface FilterClause {

    JsonNode toJson();

    /**
     * Number of and/or/not clauses and leaves reachable through the boolean skeleton of this term.
     */
    default int size() {
        int size = 0;
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(toJson());
        while (!pending.isEmpty()) {
            size++;
            FilterClause term = of(pending.pop());
            if (term instanceof Junction junction) {
                junction.args().forEach(pending::push);
            } else if (term instanceof Not not) {
                pending.push(not.arg());
            }
        }
        return size;
    }

    sealed interface Junction extends FilterClause {
        Tag tag();

        ImmutableList<JsonNode> args();

        Junction withArgs(ImmutableList<JsonNode> args);

        @Override
        default JsonNode toJson() {
            return Clauses.clause(tag(), args());
        }
    }

    record And(ImmutableList<JsonNode> args) implements Junction {
        @Override
        public Tag tag() {
            return Tag.AND;
        }

        @Override
        public Junction withArgs(ImmutableList<JsonNode> args) {
            return new And(args);
        }
    }

    record Or(ImmutableList<JsonNode> args) implements Junction {
        @Override
        public Tag tag() {
            return Tag.OR;
        }

        @Override
        public Junction withArgs(ImmutableList<JsonNode> args) {
            return new Or(args);
        }
    }

    record Not(JsonNode arg) implements FilterClause {
        @Override
        public JsonNode toJson() {
            return Clauses.clause(Tag.NOT, arg);
        }
    }

    record Leaf(JsonNode node) implements FilterClause {
        @Override
        public JsonNode toJson() {
            return node;
        }
    }

    static FilterClause of(JsonNode node) {
        if (Clauses.matches(Tag.AND, node)) {
            return new And(Clauses.arguments(node));
        }
        if (Clauses.matches(Tag.OR, node)) {
            return new Or(Clauses.arguments(node));
        }
        if (isNegation(node)) {
            return new Not(Clauses.arguments(node).getFirst());
        }
        return new Leaf(node);
    }

    static boolean isNegation(JsonNode node) {
        return Clauses.matches(Tag.NOT, node) && Clauses.arguments(node).size() == 1;
    }

    static FilterClause and(JsonNode... args) {
        return new And(Lists.immutable.of(args));
    }

    static FilterClause or(JsonNode... args) {
        return new Or(Lists.immutable.of(args));
    }
}
