package io.hearthwarrio.xlocator.core;

/**
 * Lexical categories produced by {@link XPathLexer}.
 */
public enum TokenType {
    /**
     * Element name, number or keyword ({@code and}, {@code or}).
     */
    TAG,
    /**
     * The {@code @} marker that starts an attribute test.
     */
    ATTRIBUTE,
    /**
     * Axis name; the trailing {@code ::} is not part of the text.
     */
    AXIS,
    /**
     * {@code [} or {@code ]}.
     */
    PREDICATE,
    OPERATOR,
    /**
     * Quoted literal; the text is the raw content between the quotes.
     */
    LITERAL,
    WILDCARD,
    /**
     * Namespace prefix. Never produced by {@link XPathLexer}, which keeps {@code ns:name} in one tag token.
     */
    NAMESPACE,
    /**
     * {@code /} or the merged {@code //} shorthand.
     */
    SLASH,
    END
}
