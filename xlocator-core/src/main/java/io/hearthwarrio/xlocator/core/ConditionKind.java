package io.hearthwarrio.xlocator.core;

/**
 * Discriminator of {@link PredicateCondition} variants.
 */
public enum ConditionKind {
    ATTRIBUTE,
    POSITION
}
