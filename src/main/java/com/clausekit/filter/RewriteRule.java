package com.clausekit.filter;

import com.clausekit.clause.Clauses;
import com.clausekit.json.JsonNode;
import com.clausekit.json.JsonNodes;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Rewrite rules for compound filters, in precedence order. Each rule either rewrites the root of
 * a term or does not apply to it.
 */
enum RewriteRule {
    /** {@code ["and", x]} becomes {@code x}; likewise for {@code or}. */
    SINGLETON_UNWRAP {
        @Override
        Optional<FilterClause> apply(FilterClause clause) {
            if (clause instanceof FilterClause.Junction junction && junction.args().size() == 1) {
                return Optional.of(FilterClause.of(junction.args().getFirst()));
            }
            return Optional.empty();
        }
    },

    /** {@code ["and", a, ["and", b, c]]} becomes {@code ["and", a, b, c]}; likewise for {@code or}. */
    FLATTEN {
        @Override
        Optional<FilterClause> apply(FilterClause clause) {
            if (clause instanceof FilterClause.Junction junction
                && junction.args().anySatisfy(arg -> Clauses.matches(junction.tag(), arg))) {
                return Optional.of(junction.withArgs(junction.args().flatCollect(arg ->
                    Clauses.matches(junction.tag(), arg) ? Clauses.arguments(arg) : Lists.immutable.of(arg))));
            }
            return Optional.empty();
        }
    },

    /** Removes structurally equal arguments of {@code and}/{@code or}, keeping the first of each. */
    DEDUPLICATE {
        @Override
        Optional<FilterClause> apply(FilterClause clause) {
            if (clause instanceof FilterClause.Junction junction) {
                MutableList<JsonNode> distinct = Lists.mutable.empty();
                for (JsonNode arg : junction.args()) {
                    if (distinct.noneSatisfy(kept -> JsonNodes.structurallyEqual(kept, arg))) {
                        distinct.add(arg);
                    }
                }
                if (distinct.size() != junction.args().size()) {
                    return Optional.of(junction.withArgs(distinct.toImmutable()));
                }
            }
            return Optional.empty();
        }
    },

    /** {@code ["not", ["not", x]]} becomes {@code x}. */
    DOUBLE_NEGATION {
        @Override
        Optional<FilterClause> apply(FilterClause clause) {
            if (clause instanceof FilterClause.Not not && FilterClause.isNegation(not.arg())) {
                return Optional.of(FilterClause.of(Clauses.arguments(not.arg()).getFirst()));
            }
            return Optional.empty();
        }
    };

    abstract Optional<FilterClause> apply(FilterClause clause);
}
