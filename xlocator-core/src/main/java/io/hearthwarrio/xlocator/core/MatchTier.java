package io.hearthwarrio.xlocator.core;

/**
 * Classification tiers. Every rule of an earlier tier is tried before any rule of a later one.
 */
public enum MatchTier {
    EXACT,
    SUFFIX,
    SUBSTRING
}
