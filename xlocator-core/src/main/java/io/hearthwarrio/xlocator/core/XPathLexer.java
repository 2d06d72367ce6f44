package io.hearthwarrio.xlocator.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass scanner for the supported XPath subset.
 * <p>
 * Rules, in priority order at each position:
 * <ol>
 *   <li>whitespace is skipped</li>
 *   <li>{@code /} and {@code //} (merged into one token)</li>
 *   <li>{@code @ [ ] *}</li>
 *   <li>quoted literals, {@code \} escaping the next character</li>
 *   <li>operators {@code = != < > <= >=}</li>
 *   <li>axis names followed by {@code ::}</li>
 *   <li>anything else up to whitespace or a reserved symbol becomes a {@link TokenType#TAG}</li>
 * </ol>
 * The lexer is stateless; one instance can be shared.
 */
public final class XPathLexer implements Tokenizer {

    private static final String RESERVED = "/[]@=!<>*";

    @Override
    public List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");

        List<Token> tokens = new ArrayList<>();
        int len = text.length();
        int pos = 0;

        while (pos < len) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            switch (c) {
                case '/':
                    if (pos + 1 < len && text.charAt(pos + 1) == '/') {
                        tokens.add(new Token(TokenType.SLASH, "//", pos));
                        pos += 2;
                    } else {
                        tokens.add(new Token(TokenType.SLASH, "/", pos));
                        pos++;
                    }
                    continue;
                case '@':
                    tokens.add(new Token(TokenType.ATTRIBUTE, "@", pos++));
                    continue;
                case '[':
                case ']':
                    tokens.add(new Token(TokenType.PREDICATE, String.valueOf(c), pos++));
                    continue;
                case '*':
                    tokens.add(new Token(TokenType.WILDCARD, "*", pos++));
                    continue;
                case '\'':
                case '"':
                    pos = scanLiteral(text, pos, tokens);
                    continue;
                case '=':
                case '!':
                case '<':
                case '>':
                    pos = scanOperator(text, pos, tokens);
                    continue;
                default:
                    break;
            }

            int afterAxis = scanAxis(text, pos, tokens);
            if (afterAxis > pos) {
                pos = afterAxis;
                continue;
            }

            int start = pos;
            while (pos < len && !isTagTerminator(text.charAt(pos))) {
                pos++;
            }
            tokens.add(new Token(TokenType.TAG, text.substring(start, pos), start));
        }

        tokens.add(new Token(TokenType.END, "", len));
        return tokens;
    }

    private int scanLiteral(String text, int quotePos, List<Token> tokens) {
        char quote = text.charAt(quotePos);
        int len = text.length();
        int start = quotePos + 1;
        int pos = start;

        while (pos < len && text.charAt(pos) != quote) {
            if (text.charAt(pos) == '\\' && pos + 1 < len) {
                pos++;
            }
            pos++;
        }
        if (pos >= len) {
            throw new XPathSyntaxException(SyntaxErrorKind.UNTERMINATED_LITERAL, quotePos, "closing " + quote);
        }

        tokens.add(new Token(TokenType.LITERAL, text.substring(start, pos), start));
        return pos + 1;
    }

    private int scanOperator(String text, int pos, List<Token> tokens) {
        int start = pos;
        StringBuilder op = new StringBuilder(2).append(text.charAt(pos++));
        if (pos < text.length() && text.charAt(pos) == '=') {
            op.append('=');
            pos++;
        }
        tokens.add(new Token(TokenType.OPERATOR, op.toString(), start));
        return pos;
    }

    /**
     * Returns the position after {@code name::} when an axis starts at {@code pos}, otherwise {@code pos}.
     */
    private int scanAxis(String text, int pos, List<Token> tokens) {
        int len = text.length();
        int end = pos;
        while (end < len) {
            char ch = text.charAt(end);
            if (Character.isWhitespace(ch) || ch == ':' || RESERVED.indexOf(ch) >= 0) {
                break;
            }
            end++;
        }
        if (end == pos || end + 1 >= len || text.charAt(end) != ':' || text.charAt(end + 1) != ':') {
            return pos;
        }
        tokens.add(new Token(TokenType.AXIS, text.substring(pos, end), pos));
        return end + 2;
    }

    private static boolean isTagTerminator(char ch) {
        return Character.isWhitespace(ch) || RESERVED.indexOf(ch) >= 0;
    }
}
