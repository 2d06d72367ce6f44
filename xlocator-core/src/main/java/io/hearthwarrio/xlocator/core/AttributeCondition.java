package io.hearthwarrio.xlocator.core;

import java.util.Objects;

/**
 * {@code @name op 'value'} or bare {@code name op value} test.
 */
public final class AttributeCondition implements PredicateCondition {

    private final String name;
    private final ComparisonOperator operator;
    private final String value;

    public AttributeCondition(String name, ComparisonOperator operator, String value) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = value == null ? "" : value;
    }

    @Override
    public ConditionKind kind() {
        return ConditionKind.ATTRIBUTE;
    }

    public String getName() {
        return name;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "@" + name + operator.symbol() + "'" + value + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeCondition)) return false;
        AttributeCondition that = (AttributeCondition) o;
        return name.equals(that.name) &&
                operator == that.operator &&
                value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operator, value);
    }
}
