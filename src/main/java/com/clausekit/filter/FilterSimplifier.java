package com.clausekit.filter;

import com.clausekit.json.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Simplifies compound {@code and}, {@code or} and {@code not} filters, combining or eliminating them
 * where possible. This also repairs degenerate compounds such as an {@code and} with a single argument.
 * <p>
 * The rules of {@link RewriteRule} are tried in order against the whole term; the first one that
 * applies produces a new term and matching restarts from the first rule. The result is the term no
 * rule applies to. Leaf clauses are never looked into.
 */
public class FilterSimplifier {
    private static final Logger log = LoggerFactory.getLogger(FilterSimplifier.class);

    public JsonNode simplify(JsonNode filterClause) {
        FilterClause term = FilterClause.of(filterClause);
        FilterClause simplified = simplify(term);
        return simplified == term ? filterClause : simplified.toJson();
    }

    public FilterClause simplify(FilterClause filterClause) {
        // every rule removes at least one clause from the skeleton
        int limit = filterClause.size();
        FilterClause current = filterClause;

        for (int steps = 0; ; steps++) {
            Optional<FilterClause> rewritten = Optional.empty();
            for (RewriteRule rule : RewriteRule.values()) {
                rewritten = rule.apply(current);
                if (rewritten.isPresent()) {
                    log.debug("{} rewrote {} to {}", rule, kind(current), kind(rewritten.get()));
                    break;
                }
            }
            if (rewritten.isEmpty()) {
                return current;
            }
            if (steps >= limit) {
                throw new IllegalStateException("Filter did not reach a fixed point after " + limit + " rewrites");
            }
            current = rewritten.get();
        }
    }

    private static String kind(FilterClause clause) {
        return clause.getClass().getSimpleName();
    }
}
