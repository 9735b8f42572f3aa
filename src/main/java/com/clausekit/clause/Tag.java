package com.clausekit.clause;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Canonical clause tag: lower case, hyphen separated. Frequently used tags are shared through a
 * size-bounded pool; equality is by name.
 */
public final class Tag implements Comparable<Tag> {
    static final long POOL_SIZE = 10_000;

    private static final Cache<String, Tag> POOL = Caffeine.newBuilder()
        .maximumSize(POOL_SIZE)
        .executor(Runnable::run)
        .build();

    public static final Tag AND = of("and");
    public static final Tag OR = of("or");
    public static final Tag NOT = of("not");

    private final String name;

    private Tag(String name) {
        this.name = name;
    }

    public static Tag of(String token) {
        return TokenNormalizer.normalize(token);
    }

    // callers must pass an already canonical name
    static Tag intern(String canonicalName) {
        return POOL.get(canonicalName, Tag::new);
    }

    static long pooledCount() {
        POOL.cleanUp();
        return POOL.estimatedSize();
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Tag other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public int compareTo(Tag other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
