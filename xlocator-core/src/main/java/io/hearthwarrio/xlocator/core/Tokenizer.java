package io.hearthwarrio.xlocator.core;

import java.util.List;

/**
 * First pipeline stage: raw path text to tokens.
 */
@FunctionalInterface
public interface Tokenizer {

    /**
     * Tokenizes a path expression.
     *
     * @param text path expression (must not be null)
     * @return tokens in source order, terminated by exactly one {@link TokenType#END} token
     * @throws XPathSyntaxException if a quoted literal is not terminated
     */
    List<Token> tokenize(String text);
}
