package io.hearthwarrio.xlocator.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code /}-separated segment of a path expression.
 */
public final class PathStep {

    public static final String DEFAULT_AXIS = "child";
    public static final String DESCENDANT_OR_SELF_AXIS = "descendant-or-self";
    public static final String WILDCARD = "*";

    private final String axis;
    private final String tag;
    private final ComplexPredicate predicate;
    private final boolean absolute;

    public PathStep(String axis, String tag, ComplexPredicate predicate, boolean absolute) {
        this.axis = axis == null || axis.isEmpty() ? DEFAULT_AXIS : axis;
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.predicate = predicate;
        this.absolute = absolute;
    }

    /**
     * The step {@code //} stands for: {@code descendant-or-self::*}, absolute, without predicate.
     */
    public static PathStep descendantOrSelf() {
        return new PathStep(DESCENDANT_OR_SELF_AXIS, WILDCARD, null, true);
    }

    public String getAxis() {
        return axis;
    }

    /**
     * Node test: tag name or {@code "*"}.
     */
    public String getTag() {
        return tag;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(tag);
    }

    public Optional<ComplexPredicate> getPredicate() {
        return Optional.ofNullable(predicate);
    }

    public boolean isAbsolute() {
        return absolute;
    }

    @Override
    public String toString() {
        return "PathStep{" +
                "axis='" + axis + '\'' +
                ", tag='" + tag + '\'' +
                ", predicate=" + predicate +
                ", absolute=" + absolute +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathStep)) return false;
        PathStep that = (PathStep) o;
        return absolute == that.absolute &&
                axis.equals(that.axis) &&
                tag.equals(that.tag) &&
                Objects.equals(predicate, that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, tag, predicate, absolute);
    }
}
