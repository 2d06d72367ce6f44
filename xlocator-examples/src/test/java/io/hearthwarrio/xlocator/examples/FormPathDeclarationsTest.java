package io.hearthwarrio.xlocator.examples;

import io.hearthwarrio.xlocator.core.LocatorRecord;
import io.hearthwarrio.xlocator.core.SyntaxErrorKind;
import io.hearthwarrio.xlocator.core.XPathSyntaxException;
import io.hearthwarrio.xlocator.declarations.ConversionLogDetail;
import io.hearthwarrio.xlocator.declarations.XPathLocators;
import io.hearthwarrio.xlocator.testkit.LocatorAssertions;
import io.hearthwarrio.xlocator.testkit.TestLocators;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormPathDeclarationsTest {

    private final XPathLocators locators = TestLocators.stdout(ConversionLogDetail.FULL);

    @Test
    void emptyPath_producesNothing() {
        assertTrue(locators.locators("").isEmpty());
        assertEquals("", locators.declarations(""));
    }

    @Test
    void singleButton() {
        String expected = ""
                + "button_PushButtonQT = {\n"
                + "    \"archetype\": \"PushButtonQT\",\n"
                + "    \"visible\": 1\n"
                + "}\n";

        assertEquals(expected, locators.declarations("button"));
    }

    @Test
    void descendantButton_getsSyntheticAncestor() {
        List<LocatorRecord> records = locators.locators("//button[@name='submit']");

        LocatorAssertions.assertChain(records);
        LocatorAssertions.assertIdentifiers(records,
                "any_QWidget",
                "any_QWidget_button_PushButtonQT_name_submit");
        assertEquals("submit", records.get(1).getMetadata().get("name"));
    }

    @Test
    void loginForm_chainsContainers() {
        List<LocatorRecord> records =
                locators.locators("/form/textfield[@name='username']/button[@name='submit']");

        LocatorAssertions.assertChain(records);
        LocatorAssertions.assertCanonicalIdentifiers(records);
        LocatorAssertions.assertIdentifiers(records,
                "form_ModuleQT",
                "form_ModuleQT_textfield_TextFieldQT_name_username",
                "form_ModuleQT_textfield_TextFieldQT_name_username_button_PushButtonQT_name_submit");

        String py = locators.declarations("/form/textfield[@name='username']/button[@name='submit']");
        assertTrue(py.contains("    \"container\": form_ModuleQT_textfield_TextFieldQT_name_username\n"));
    }

    @Test
    void positionalRow_recordsOccurrenceOnly() {
        LocatorRecord row = locators.locators("row[2]").get(0);

        assertEquals("row_QWidget", row.getIdentifier());
        assertEquals(Map.of("archetype", "QWidget", "occurrence", 2, "visible", 1), row.getMetadata());
    }

    @Test
    void unterminatedLiteral_isRejected() {
        XPathSyntaxException ex = assertThrows(XPathSyntaxException.class,
                () -> locators.declarations("book[@id='1"));

        assertEquals(SyntaxErrorKind.UNTERMINATED_LITERAL, ex.kind());
        assertTrue(ex.getMessage().contains("Unterminated string literal"));
    }
}
