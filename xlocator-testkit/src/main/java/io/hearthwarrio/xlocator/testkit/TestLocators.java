package io.hearthwarrio.xlocator.testkit;

import io.hearthwarrio.xlocator.core.ArchetypeRule;
import io.hearthwarrio.xlocator.declarations.ConversionLogDetail;
import io.hearthwarrio.xlocator.declarations.XPathLocators;

import java.util.Objects;

/**
 * Convenience factory methods for creating {@link XPathLocators} instances in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestLocators {

    private TestLocators() {
        // utility class
    }

    /**
     * Creates a plain facade with the default rule table and without logging.
     */
    public static XPathLocators plain() {
        return new XPathLocators();
    }

    /**
     * Creates a facade with stdout conversion logging enabled.
     */
    public static XPathLocators stdout(ConversionLogDetail detail) {
        Objects.requireNonNull(detail, "detail must not be null");
        return new XPathLocators()
                .withLoggingToStdOut(detail);
    }

    /**
     * Creates a facade whose classifier knows project-specific rules on top of the defaults.
     */
    public static XPathLocators withRules(ArchetypeRule... extra) {
        return new XPathLocators()
                .withExtraArchetypeRules(extra);
    }
}
