package io.hearthwarrio.xlocator.core;

/**
 * One condition inside a bracketed predicate.
 * <p>
 * The set of variants is closed. Consumers switch over {@link #kind()} with a switch expression so that a new
 * variant fails compilation wherever conditions are consumed.
 */
public sealed interface PredicateCondition permits AttributeCondition, PositionCondition {

    ConditionKind kind();
}
