package io.hearthwarrio.xlocator.core;

/**
 * {@code [N]} positional test, one-based.
 */
public final class PositionCondition implements PredicateCondition {

    private final int position;

    public PositionCondition(int position) {
        this.position = position;
    }

    @Override
    public ConditionKind kind() {
        return ConditionKind.POSITION;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "[" + position + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionCondition)) return false;
        return position == ((PositionCondition) o).position;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(position);
    }
}
