package com.clausekit.filter;

import com.clausekit.clause.Clauses;
import com.clausekit.clause.Tag;
import com.clausekit.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;

/**
 * Combines filter clauses into a single clause without piling up redundant {@code and}s.
 */
public class FilterCombiner {
    private final FilterSimplifier simplifier;

    public FilterCombiner() {
        this(new FilterSimplifier());
    }

    public FilterCombiner(FilterSimplifier simplifier) {
        this.simplifier = simplifier;
    }

    /**
     * Wraps the present clauses in an {@code and} and simplifies the result. Java {@code null} and JSON
     * {@code null} count as absent.
     */
    public JsonNode combine(JsonNode... clauses) {
        return combine(Arrays.asList(clauses));
    }

    public JsonNode combine(Iterable<? extends JsonNode> clauses) {
        MutableList<JsonNode> present = Lists.mutable.empty();
        for (JsonNode clause : clauses) {
            if (!isAbsent(clause)) {
                present.add(clause);
            }
        }
        return simplifier.simplify(Clauses.clause(Tag.AND, present.toImmutable()));
    }

    static boolean isAbsent(JsonNode clause) {
        return clause == null || clause instanceof JsonNode.JsonNull;
    }
}
