package io.hearthwarrio.xlocator.core;

import java.util.List;

/**
 * Ordered conditions of one bracketed predicate. Conditions are implicitly conjoined.
 */
public final class ComplexPredicate {

    private final List<PredicateCondition> conditions;

    public ComplexPredicate(List<? extends PredicateCondition> conditions) {
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * @return conditions in encounter order (immutable)
     */
    public List<PredicateCondition> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public String toString() {
        return "ComplexPredicate" + conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexPredicate)) return false;
        return conditions.equals(((ComplexPredicate) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }
}
