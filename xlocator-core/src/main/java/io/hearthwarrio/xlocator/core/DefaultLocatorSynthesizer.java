package io.hearthwarrio.xlocator.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds deterministic locator records from parsed steps.
 * <p>
 * Identifier of step {@code i}: {@code [parent_]token_archetype[_name_value...]}, canonicalized, where
 * {@code token} is the tag ({@code any} for {@code *}) and each attribute condition contributes
 * {@code _name_value} in encounter order. Position conditions only reach the metadata, as {@code occurrence}.
 * <p>
 * Metadata order: {@code archetype}, attribute values, {@code occurrence}, {@code visible}.
 */
public final class DefaultLocatorSynthesizer implements LocatorSynthesizer {

    public static final String ARCHETYPE_KEY = "archetype";
    public static final String OCCURRENCE_KEY = "occurrence";
    public static final String VISIBLE_KEY = "visible";
    public static final String WILDCARD_TOKEN = "any";

    private final WidgetClassifier classifier;

    public DefaultLocatorSynthesizer() {
        this(new HeuristicWidgetClassifier());
    }

    public DefaultLocatorSynthesizer(WidgetClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public WidgetClassifier getClassifier() {
        return classifier;
    }

    @Override
    public List<LocatorRecord> convert(List<PathStep> steps) {
        Objects.requireNonNull(steps, "steps must not be null");

        List<LocatorRecord> out = new ArrayList<>(steps.size());
        String parent = "";

        for (PathStep step : steps) {
            String archetype = classifier.classify(step.getTag());
            String identifier = identifier(parent, step, archetype);
            Map<String, Object> metadata = metadata(step, archetype);

            out.add(new LocatorRecord(identifier, metadata, parent));
            parent = identifier;
        }

        return List.copyOf(out);
    }

    private String identifier(String parent, PathStep step, String archetype) {
        String token = step.isWildcard() ? WILDCARD_TOKEN : step.getTag();

        StringBuilder raw = new StringBuilder();
        if (!parent.isEmpty()) {
            raw.append(parent).append('_');
        }
        raw.append(token).append('_').append(archetype);

        for (PredicateCondition c : conditions(step)) {
            raw.append(switch (c.kind()) {
                case ATTRIBUTE -> identifierPart((AttributeCondition) c);
                case POSITION -> "";
            });
        }

        return Identifiers.canonicalize(raw.toString());
    }

    private Map<String, Object> metadata(PathStep step, String archetype) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ARCHETYPE_KEY, archetype);

        for (PredicateCondition c : conditions(step)) {
            Map.Entry<String, Object> entry = switch (c.kind()) {
                case ATTRIBUTE -> attributeEntry((AttributeCondition) c);
                case POSITION -> occurrenceEntry((PositionCondition) c);
            };
            if (entry != null) {
                if (OCCURRENCE_KEY.equals(entry.getKey())) {
                    meta.remove(OCCURRENCE_KEY);
                }
                meta.put(entry.getKey(), entry.getValue());
            }
        }

        // an attribute named "visible" must not pin the flag ahead of later entries
        meta.remove(VISIBLE_KEY);
        meta.put(VISIBLE_KEY, 1);
        return meta;
    }

    private static String identifierPart(AttributeCondition a) {
        return "_" + a.getName() + "_" + a.getValue();
    }

    private static Map.Entry<String, Object> attributeEntry(AttributeCondition a) {
        return Map.entry(a.getName(), a.getValue());
    }

    /**
     * {@code [1]} is the default occurrence and is not recorded.
     */
    private static Map.Entry<String, Object> occurrenceEntry(PositionCondition p) {
        if (p.getPosition() <= 1) {
            return null;
        }
        return Map.entry(OCCURRENCE_KEY, p.getPosition());
    }

    private static List<PredicateCondition> conditions(PathStep step) {
        return step.getPredicate().map(ComplexPredicate::getConditions).orElse(List.of());
    }
}
