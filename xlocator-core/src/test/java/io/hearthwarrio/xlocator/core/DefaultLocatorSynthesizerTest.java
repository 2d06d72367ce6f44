package io.hearthwarrio.xlocator.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultLocatorSynthesizerTest {
    private final LocatorSynthesizer synthesizer = new DefaultLocatorSynthesizer();

    private static PathStep step(String tag, PredicateCondition... conditions) {
        ComplexPredicate predicate = conditions.length == 0 ? null : new ComplexPredicate(List.of(conditions));
        return new PathStep(null, tag, predicate, false);
    }

    @Test
    void emptyStepsYieldNoRecords() {
        assertTrue(synthesizer.convert(List.of()).isEmpty());
    }

    @Test
    void singleStepRecord() {
        LocatorRecord r = synthesizer.convert(List.of(step("button"))).get(0);

        assertEquals("button_PushButtonQT", r.getIdentifier());
        assertEquals(Map.of("archetype", "PushButtonQT", "visible", 1), r.getMetadata());
        assertEquals("", r.getContainer());
        assertFalse(r.hasContainer());
    }

    @Test
    void attributeConditionReachesIdentifierAndMetadata() {
        LocatorRecord r = synthesizer.convert(List.of(
                step("row", new AttributeCondition("id", ComparisonOperator.EQ, "x"))
        )).get(0);

        assertTrue(r.getIdentifier().endsWith("_id_x"));
        assertEquals("x", r.getMetadata().get("id"));
    }

    @Test
    void positionConditionOnlyReachesMetadata() {
        LocatorRecord r = synthesizer.convert(List.of(step("row", new PositionCondition(3)))).get(0);

        assertEquals("row_QWidget", r.getIdentifier());
        assertEquals(3, r.getMetadata().get("occurrence"));
    }

    @Test
    void firstPositionIsNotRecorded() {
        LocatorRecord r = synthesizer.convert(List.of(step("row", new PositionCondition(1)))).get(0);
        assertFalse(r.getMetadata().containsKey("occurrence"));
    }

    @Test
    void metadataKeepsInsertionOrder() {
        LocatorRecord r = synthesizer.convert(List.of(step("item",
                new AttributeCondition("name", ComparisonOperator.EQ, "n"),
                new PositionCondition(4),
                new AttributeCondition("id", ComparisonOperator.EQ, "7")
        ))).get(0);

        assertEquals(List.of("archetype", "name", "occurrence", "id", "visible"), new ArrayList<>(r.getMetadata().keySet()));
        assertEquals("item_QWidget_name_n_id_7", r.getIdentifier());
    }

    @Test
    void wildcardUsesAnyToken() {
        LocatorRecord r = synthesizer.convert(List.of(PathStep.descendantOrSelf())).get(0);
        assertEquals("any_QWidget", r.getIdentifier());
    }

    @Test
    void attributeValuesAreCanonicalizedInIdentifierButNotInMetadata() {
        LocatorRecord r = synthesizer.convert(List.of(
                step("textfield", new AttributeCondition("placeholder", ComparisonOperator.EQ, "e-mail address"))
        )).get(0);

        assertEquals("textfield_TextFieldQT_placeholder_e_mail_address", r.getIdentifier());
        assertEquals("e-mail address", r.getMetadata().get("placeholder"));
    }

    @Test
    void recordsFormAChain() {
        List<LocatorRecord> records = synthesizer.convert(List.of(step("form"), step("panel"), step("okbutton")));

        assertEquals("", records.get(0).getContainer());
        for (int i = 1; i < records.size(); i++) {
            assertEquals(records.get(i - 1).getIdentifier(), records.get(i).getContainer());
        }
        assertEquals("form_ModuleQT_panel_ScrollViewQT_okbutton_PushButtonQT", records.get(2).getIdentifier());
    }

    @Test
    void usesInjectedClassifier() {
        LocatorSynthesizer custom = new DefaultLocatorSynthesizer(tag -> "Custom");
        assertEquals("button_Custom", custom.convert(List.of(step("button"))).get(0).getIdentifier());
    }

    @Test
    void metadataIsUnmodifiable() {
        LocatorRecord r = synthesizer.convert(List.of(step("button"))).get(0);
        assertThrows(UnsupportedOperationException.class, () -> r.getMetadata().put("x", "y"));
    }

    @Test
    void visibleStaysLastWhenAnAttributeSharesItsName() {
        List<PathStep> steps = new XPathParser().parse(new XPathLexer().tokenize("button[@visible='no' and @id='x']"));
        LocatorRecord r = synthesizer.convert(steps).get(0);

        assertEquals(List.of("archetype", "id", "visible"), new ArrayList<>(r.getMetadata().keySet()));
        assertEquals(1, r.getMetadata().get("visible"));
        assertEquals("button_PushButtonQT_visible_no_id_x", r.getIdentifier());
    }

    @Test
    void occurrenceFollowsAnAttributeOfTheSameName() {
        LocatorRecord r = synthesizer.convert(List.of(step("row",
                new AttributeCondition("occurrence", ComparisonOperator.EQ, "x"),
                new AttributeCondition("id", ComparisonOperator.EQ, "y"),
                new PositionCondition(2)
        ))).get(0);

        assertEquals(List.of("archetype", "id", "occurrence", "visible"), new ArrayList<>(r.getMetadata().keySet()));
        assertEquals(2, r.getMetadata().get("occurrence"));
    }
}
