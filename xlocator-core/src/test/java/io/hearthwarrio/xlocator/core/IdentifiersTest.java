package io.hearthwarrio.xlocator.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifiersTest {

    @Test
    void replacesAndCollapsesNonAlphanumerics() {
        assertEquals("a_b_c", Identifiers.canonicalize("a--b__ c"));
    }

    @Test
    void trimsLeadingAndTrailingUnderscores() {
        assertEquals("user_name", Identifiers.canonicalize("__user.name!!"));
    }

    @Test
    void nonAsciiLettersAreReplaced() {
        assertEquals("caf_ok", Identifiers.canonicalize("café ok"));
    }

    @Test
    void onlySeparatorsYieldEmpty() {
        assertEquals("", Identifiers.canonicalize("-_- "));
        assertEquals("", Identifiers.canonicalize(null));
    }
}
