package io.hearthwarrio.xlocator.core;

import io.hearthwarrio.xlocator.core.heuristics.TagMatchRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Default classification table and normalization of rule collections.
 */
public final class ArchetypeRules {

    /**
     * Gap between consecutive default orders, so custom rules can be placed between two defaults.
     */
    public static final int ORDER_STEP = 10;

    private static final List<ArchetypeRule> DEFAULTS = buildDefaults();

    private ArchetypeRules() {
    }

    /**
     * Returns the built-in table.
     * <ul>
     *   <li>exact: button, container, form, textfield</li>
     *   <li>suffix: button, checkbox, radiobutton, combobox, slider, label, view, field</li>
     *   <li>substring: button, field, text, container, panel, form</li>
     * </ul>
     * The {@code radiobutton} suffix rule never fires: the {@code button} suffix rule runs first.
     *
     * @return immutable, normalized list
     */
    public static List<ArchetypeRule> defaults() {
        return DEFAULTS;
    }

    /**
     * Normalizes a rule list:
     * <ul>
     *   <li>removes null entries</li>
     *   <li>orders by {@link ArchetypeRule#tier()}, {@link ArchetypeRule#order()}, then {@link ArchetypeRule#id()}</li>
     *   <li>deduplicates by {@link ArchetypeRule#id()} (first one wins)</li>
     * </ul>
     *
     * @param rules input list (may be null)
     * @return normalized immutable list
     */
    public static List<ArchetypeRule> normalize(List<? extends ArchetypeRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }

        List<ArchetypeRule> cleaned = new ArrayList<>();
        for (ArchetypeRule r : rules) {
            if (r != null) {
                cleaned.add(r);
            }
        }
        cleaned.sort(Comparator.comparing(ArchetypeRule::tier)
                .thenComparingInt(ArchetypeRule::order)
                .thenComparing(ArchetypeRule::id));

        Map<String, ArchetypeRule> byId = new LinkedHashMap<>();
        for (ArchetypeRule r : cleaned) {
            byId.putIfAbsent(r.id(), r);
        }

        return List.copyOf(byId.values());
    }

    /**
     * Returns the defaults followed by {@code extra}, normalized.
     *
     * @param extra project-specific rules (may be null)
     * @return combined table
     */
    public static List<ArchetypeRule> defaultsWith(List<? extends ArchetypeRule> extra) {
        List<ArchetypeRule> all = new ArrayList<>(DEFAULTS);
        if (extra != null) {
            all.addAll(extra);
        }
        return normalize(all);
    }

    private static List<ArchetypeRule> buildDefaults() {
        List<ArchetypeRule> rules = new ArrayList<>();

        add(rules, MatchTier.EXACT, "button", WidgetArchetype.PUSH_BUTTON);
        add(rules, MatchTier.EXACT, "container", WidgetArchetype.SCROLL_VIEW);
        add(rules, MatchTier.EXACT, "form", WidgetArchetype.MODULE);
        add(rules, MatchTier.EXACT, "textfield", WidgetArchetype.TEXT_FIELD);

        add(rules, MatchTier.SUFFIX, "button", WidgetArchetype.PUSH_BUTTON);
        add(rules, MatchTier.SUFFIX, "checkbox", WidgetArchetype.CHECK_BOX);
        add(rules, MatchTier.SUFFIX, "radiobutton", WidgetArchetype.RADIO_BUTTON);
        add(rules, MatchTier.SUFFIX, "combobox", WidgetArchetype.COMBO_BOX);
        add(rules, MatchTier.SUFFIX, "slider", WidgetArchetype.SLIDER);
        add(rules, MatchTier.SUFFIX, "label", WidgetArchetype.LABEL);
        add(rules, MatchTier.SUFFIX, "view", WidgetArchetype.SCROLL_VIEW);
        add(rules, MatchTier.SUFFIX, "field", WidgetArchetype.TEXT_FIELD);

        add(rules, MatchTier.SUBSTRING, "button", WidgetArchetype.PUSH_BUTTON);
        add(rules, MatchTier.SUBSTRING, "field", WidgetArchetype.TEXT_FIELD);
        add(rules, MatchTier.SUBSTRING, "text", WidgetArchetype.TEXT_FIELD);
        add(rules, MatchTier.SUBSTRING, "container", WidgetArchetype.SCROLL_VIEW);
        add(rules, MatchTier.SUBSTRING, "panel", WidgetArchetype.SCROLL_VIEW);
        add(rules, MatchTier.SUBSTRING, "form", WidgetArchetype.MODULE);

        return normalize(rules);
    }

    private static void add(List<ArchetypeRule> rules, MatchTier tier, String needle, WidgetArchetype archetype) {
        int order = countTier(rules, tier) * ORDER_STEP;
        String id = tier.name().toLowerCase(Locale.ROOT) + ":" + needle;
        rules.add(new TagMatchRule(id, tier, order, needle, archetype.label()));
    }

    private static int countTier(List<ArchetypeRule> rules, MatchTier tier) {
        int n = 0;
        for (ArchetypeRule r : rules) {
            if (r.tier() == tier) {
                n++;
            }
        }
        return n;
    }
}
