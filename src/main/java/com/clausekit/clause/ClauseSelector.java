package com.clausekit.clause;

import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.SetIterable;
import org.eclipse.collections.impl.factory.Sets;

@FunctionalInterface
public interface ClauseSelector {

    boolean accepts(Tag tag);

    static ClauseSelector of(Tag tag) {
        return new Single(tag);
    }

    static ClauseSelector of(String tag) {
        return new Single(Tag.of(tag));
    }

    static ClauseSelector anyOf(SetIterable<Tag> tags) {
        return new AnyOf(Sets.immutable.ofAll(tags));
    }

    static ClauseSelector anyOf(String... tags) {
        var canonical = Sets.mutable.<Tag>empty();
        for (String tag : tags) {
            canonical.add(Tag.of(tag));
        }
        return new AnyOf(canonical.toImmutable());
    }

    static ClauseSelector anyClause() {
        return tag -> true;
    }

    record Single(Tag tag) implements ClauseSelector {
        @Override
        public boolean accepts(Tag candidate) {
            return tag.equals(candidate);
        }
    }

    record AnyOf(ImmutableSet<Tag> tags) implements ClauseSelector {
        @Override
        public boolean accepts(Tag candidate) {
            return tags.contains(candidate);
        }
    }
}
