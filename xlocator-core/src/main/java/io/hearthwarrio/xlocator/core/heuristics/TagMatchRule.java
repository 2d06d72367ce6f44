package io.hearthwarrio.xlocator.core.heuristics;

import io.hearthwarrio.xlocator.core.ArchetypeRule;
import io.hearthwarrio.xlocator.core.MatchTier;

import java.util.Locale;
import java.util.Objects;

/**
 * Generic rule that matches a tag against a needle, the comparison depending on the tier.
 * <ul>
 *   <li>{@link MatchTier#EXACT}: whole tag equals the needle</li>
 *   <li>{@link MatchTier#SUFFIX}: tag ends with the needle</li>
 *   <li>{@link MatchTier#SUBSTRING}: tag contains the needle</li>
 * </ul>
 * Matching is case-insensitive.
 * <p>
 * Typical use cases:
 * <ul>
 *   <li>project-specific widget tags ("spinbox", "datepicker")</li>
 *   <li>component-library prefixes ("mat-", "q-")</li>
 *   <li>overriding a default by giving a custom rule a lower order in the same tier</li>
 * </ul>
 */
public final class TagMatchRule implements ArchetypeRule {

    private final String id;
    private final MatchTier tier;
    private final int order;
    private final String needleLower;
    private final String archetype;

    /**
     * Creates a rule.
     *
     * @param id        identifier (used for ordering ties and deduplication)
     * @param tier      tier, which also selects the comparison
     * @param order     order inside the tier (lower runs earlier)
     * @param needle    text to compare against (case-insensitive, must not be blank)
     * @param archetype label assigned on match
     */
    public TagMatchRule(String id, MatchTier tier, int order, String needle, String archetype) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.tier = Objects.requireNonNull(tier, "tier must not be null");
        this.order = order;
        this.needleLower = normalizeNeedle(needle);
        this.archetype = Objects.requireNonNull(archetype, "archetype must not be null");
    }

    /**
     * Convenience factory using {@code tier:needle} as the identifier.
     */
    public static TagMatchRule of(MatchTier tier, int order, String needle, String archetype) {
        return new TagMatchRule(
                tier.name().toLowerCase(Locale.ROOT) + ":" + normalizeNeedle(needle),
                tier, order, needle, archetype);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public MatchTier tier() {
        return tier;
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public String archetype() {
        return archetype;
    }

    public String needle() {
        return needleLower;
    }

    @Override
    public boolean matches(String tagLower) {
        if (tagLower == null) {
            return false;
        }
        return switch (tier) {
            case EXACT -> tagLower.equals(needleLower);
            case SUFFIX -> tagLower.endsWith(needleLower);
            case SUBSTRING -> tagLower.contains(needleLower);
        };
    }

    @Override
    public String toString() {
        return "TagMatchRule{" +
                "id='" + id + '\'' +
                ", tier=" + tier +
                ", order=" + order +
                ", needle='" + needleLower + '\'' +
                ", archetype='" + archetype + '\'' +
                '}';
    }

    private static String normalizeNeedle(String needle) {
        if (needle == null || needle.isBlank()) {
            throw new IllegalArgumentException("needle must not be null or blank");
        }
        return needle.trim().toLowerCase(Locale.ROOT);
    }
}
