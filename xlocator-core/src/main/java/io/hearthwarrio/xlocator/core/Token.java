package io.hearthwarrio.xlocator.core;

import java.util.Objects;

/**
 * One lexical unit of a path expression.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int offset;

    public Token(TokenType type, String text, int offset) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.text = text == null ? "" : text;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Exact source text of the token (literal tokens: content between the quotes, escapes kept).
     */
    public String getText() {
        return text;
    }

    /**
     * Zero-based position in the source text where the token begins.
     */
    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType t, String expectedText) {
        return type == t && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token that = (Token) o;
        return offset == that.offset &&
                type == that.type &&
                text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, offset);
    }
}
