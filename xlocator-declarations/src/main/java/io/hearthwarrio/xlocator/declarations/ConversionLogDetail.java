package io.hearthwarrio.xlocator.declarations;

/**
 * Controls how much conversion output is passed to a {@link ConversionLogger}.
 */
public enum ConversionLogDetail {

    /**
     * Only the path expression and the number of steps.
     */
    NONE,

    /**
     * Path expression plus the generated identifiers.
     */
    IDENTIFIERS_ONLY,

    /**
     * Identifiers plus the rendered declarations.
     */
    FULL
}
