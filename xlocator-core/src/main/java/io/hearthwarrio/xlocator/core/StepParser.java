package io.hearthwarrio.xlocator.core;

import java.util.List;

/**
 * Second pipeline stage: tokens to path steps.
 */
@FunctionalInterface
public interface StepParser {

    /**
     * Parses a token sequence into path steps.
     *
     * @param tokens tokens terminated by exactly one {@link TokenType#END} token
     * @return steps in source order (immutable)
     * @throws XPathSyntaxException on malformed input
     */
    List<PathStep> parse(List<Token> tokens);
}
