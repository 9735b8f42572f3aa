package com.clausekit.filter;

import com.clausekit.json.JsonNode;
import com.clausekit.path.KeyPath;

/**
 * Adds filter clauses to query documents.
 */
public class QueryUpdater {
    public static final KeyPath DEFAULT_FILTER_PATH = KeyPath.of("query", "filter");

    private final FilterCombiner combiner;

    public QueryUpdater() {
        this(new FilterCombiner());
    }

    public QueryUpdater(FilterCombiner combiner) {
        this.combiner = combiner;
    }

    public JsonNode addFilterClause(JsonNode query, JsonNode newClause) {
        return addFilterClause(query, DEFAULT_FILTER_PATH, newClause);
    }

    /**
     * Combines {@code newClause} with the filter at {@code path} and returns the updated document. The
     * input document is returned unchanged if {@code newClause} is absent.
     *
     * @throws com.clausekit.path.KeyPathException if the container of {@code path} does not exist
     */
    public JsonNode addFilterClause(JsonNode query, KeyPath path, JsonNode newClause) {
        if (FilterCombiner.isAbsent(newClause)) {
            return query;
        }
        JsonNode existing = path.find(query).orElse(null);
        return path.assoc(query, combiner.combine(existing, newClause));
    }
}
