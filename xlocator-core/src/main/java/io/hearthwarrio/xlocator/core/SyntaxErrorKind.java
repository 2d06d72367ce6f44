package io.hearthwarrio.xlocator.core;

/**
 * Failure categories of lexing and parsing.
 */
public enum SyntaxErrorKind {
    UNTERMINATED_LITERAL("Unterminated string literal"),
    EXPECTED_NODE_TEST("Expected tag or '*'"),
    EXPECTED_CLOSING_BRACKET("Expected closing ']'"),
    UNEXPECTED_PREDICATE_TOKEN("Unexpected token in predicate"),
    UNEXPECTED_TOKEN("Unexpected token");

    private final String description;

    SyntaxErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
