package io.hearthwarrio.xlocator.core;

import java.util.Objects;

/**
 * Thrown when a path expression cannot be tokenized or parsed.
 * <p>
 * Carries the failure category and the source offset of the token (or opening quote) that triggered it.
 */
public class XPathSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;
    private final int offset;
    private final String expected;

    public XPathSyntaxException(SyntaxErrorKind kind, int offset) {
        this(kind, offset, "");
    }

    public XPathSyntaxException(SyntaxErrorKind kind, int offset, String expected) {
        super(buildMessage(kind, offset, expected));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.offset = offset;
        this.expected = expected == null ? "" : expected;
    }

    public SyntaxErrorKind kind() {
        return kind;
    }

    public int offset() {
        return offset;
    }

    /**
     * What the parser required at {@link #offset()}; empty when not applicable.
     */
    public String expected() {
        return expected;
    }

    private static String buildMessage(SyntaxErrorKind kind, int offset, String expected) {
        String base = kind == null ? "Syntax error" : kind.description();
        if (expected == null || expected.isEmpty()) {
            return base + " at offset " + offset;
        }
        return base + " at offset " + offset + " (expected " + expected + ")";
    }
}
