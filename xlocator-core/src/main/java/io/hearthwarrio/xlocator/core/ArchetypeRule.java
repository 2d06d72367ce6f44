package io.hearthwarrio.xlocator.core;

/**
 * One row of the classification table used by {@link HeuristicWidgetClassifier}.
 * <p>
 * Rules are evaluated by {@link #tier()}, then {@link #order()}, then {@link #id()}; the first matching rule decides
 * the archetype. Projects add their own rules to recognize custom widget tags without replacing the classifier.
 */
public interface ArchetypeRule {

    /**
     * Stable identifier, used for ordering ties, deduplication and diagnostics.
     *
     * @return rule identifier
     */
    default String id() {
        return getClass().getSimpleName();
    }

    MatchTier tier();

    /**
     * Position inside the tier. Lower values run earlier.
     *
     * @return order value
     */
    default int order() {
        return 0;
    }

    /**
     * @param tagLower tag name, already lowercased with {@link java.util.Locale#ROOT}
     * @return true when this rule applies
     */
    boolean matches(String tagLower);

    /**
     * @return archetype label assigned when this rule matches
     */
    String archetype();
}
