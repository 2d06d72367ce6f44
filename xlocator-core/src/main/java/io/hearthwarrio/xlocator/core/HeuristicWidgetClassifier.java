package io.hearthwarrio.xlocator.core;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Classifier that walks an ordered {@link ArchetypeRule} table and returns the archetype of the first match.
 * <p>
 * With the default table, a tag resolves through exact matches first, then suffixes, then substrings, and falls
 * back to {@link WidgetArchetype#WIDGET}. Matching is case-insensitive.
 * <p>
 * The table can be replaced at runtime via {@link #withRules(List)}; the swap is a single volatile write.
 */
public final class HeuristicWidgetClassifier implements WidgetClassifier {

    private final String fallback;

    private volatile List<ArchetypeRule> rules;

    /**
     * Creates a classifier with {@link ArchetypeRules#defaults()} and the {@code QWidget} fallback.
     */
    public HeuristicWidgetClassifier() {
        this(ArchetypeRules.defaults(), WidgetArchetype.WIDGET.label());
    }

    /**
     * Creates a classifier with a custom table and the {@code QWidget} fallback.
     *
     * @param rules rule table (may be null/empty)
     */
    public HeuristicWidgetClassifier(List<? extends ArchetypeRule> rules) {
        this(rules, WidgetArchetype.WIDGET.label());
    }

    /**
     * Creates a classifier with a custom table and fallback label.
     *
     * @param rules    rule table (may be null/empty)
     * @param fallback label returned when no rule matches
     */
    public HeuristicWidgetClassifier(List<? extends ArchetypeRule> rules, String fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.rules = ArchetypeRules.normalize(rules);
    }

    /**
     * Returns the configured rules in evaluation order.
     *
     * @return ordered rules list
     */
    public List<ArchetypeRule> getRules() {
        return rules;
    }

    public String getFallback() {
        return fallback;
    }

    /**
     * Replaces the rule table. The list is normalized via {@link ArchetypeRules#normalize(List)}.
     *
     * @param rules rule table (may be null/empty)
     * @return this classifier
     */
    public HeuristicWidgetClassifier withRules(List<? extends ArchetypeRule> rules) {
        this.rules = ArchetypeRules.normalize(rules);
        return this;
    }

    @Override
    public String classify(String tag) {
        if (tag == null) {
            return fallback;
        }
        String lower = tag.toLowerCase(Locale.ROOT);
        for (ArchetypeRule r : rules) {
            if (r.matches(lower)) {
                return r.archetype();
            }
        }
        return fallback;
    }
}
