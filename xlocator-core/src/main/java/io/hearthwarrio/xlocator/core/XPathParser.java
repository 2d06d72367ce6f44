package io.hearthwarrio.xlocator.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser for the supported XPath subset.
 * <p>
 * Grammar (informal):
 * <pre>
 * path      := ( '/' | '//' | step )*
 * step      := AXIS? ( '*' | TAG ) ( '[' predicate ']' )? NAMESPACE?
 * predicate := ( TAG OP (LITERAL | TAG) | '@' TAG OP LITERAL | NUMBER | 'and' | 'or' )*
 * </pre>
 * A {@code //} separator (or two consecutive {@code /} tokens) yields a synthetic
 * {@code descendant-or-self::*} step. Lookahead never exceeds two tokens.
 * <p>
 * The parser keeps no state between calls; one instance can be shared.
 */
public final class XPathParser implements StepParser {

    private static final String OPEN = "[";
    private static final String CLOSE = "]";
    private static final String DESCENDANT_SHORTHAND = "//";

    @Override
    public List<PathStep> parse(List<Token> tokens) {
        Cursor cursor = new Cursor(tokens);
        List<PathStep> steps = new ArrayList<>();

        while (!cursor.atEnd()) {
            boolean absolute = false;
            if (cursor.check(TokenType.SLASH)) {
                Token slash = cursor.advance();
                absolute = true;
                if (DESCENDANT_SHORTHAND.equals(slash.getText())) {
                    steps.add(PathStep.descendantOrSelf());
                    continue;
                }
                if (cursor.match(TokenType.SLASH)) {
                    steps.add(PathStep.descendantOrSelf());
                    continue;
                }
            }
            steps.add(parseStep(cursor, absolute));
        }

        return List.copyOf(steps);
    }

    private PathStep parseStep(Cursor cursor, boolean absolute) {
        String axis = cursor.match(TokenType.AXIS) ? cursor.previous().getText() : PathStep.DEFAULT_AXIS;

        String tag;
        if (cursor.match(TokenType.WILDCARD)) {
            tag = PathStep.WILDCARD;
        } else if (cursor.match(TokenType.TAG)) {
            tag = cursor.previous().getText();
        } else {
            throw new XPathSyntaxException(SyntaxErrorKind.EXPECTED_NODE_TEST, cursor.current().getOffset(), "tag or '*'");
        }

        ComplexPredicate predicate = null;
        if (cursor.current().is(TokenType.PREDICATE, OPEN)) {
            cursor.advance();
            predicate = parsePredicate(cursor);
            if (!cursor.current().is(TokenType.PREDICATE, CLOSE)) {
                throw new XPathSyntaxException(SyntaxErrorKind.EXPECTED_CLOSING_BRACKET, cursor.current().getOffset(), "']'");
            }
            cursor.advance();
        }

        if (cursor.match(TokenType.NAMESPACE)) {
            tag = cursor.previous().getText() + ":" + tag;
        }

        return new PathStep(axis, tag, predicate, absolute);
    }

    /**
     * Parses conditions up to, not including, the closing bracket.
     */
    private ComplexPredicate parsePredicate(Cursor cursor) {
        List<PredicateCondition> conditions = new ArrayList<>();

        while (true) {
            Token t = cursor.current();
            if (t.is(TokenType.PREDICATE, CLOSE)) {
                break;
            }
            if (t.getType() == TokenType.END) {
                throw new XPathSyntaxException(SyntaxErrorKind.EXPECTED_CLOSING_BRACKET, t.getOffset(), "']'");
            }

            if (isBareComparison(cursor)) {
                String name = cursor.advance().getText();
                ComparisonOperator op = operator(cursor.advance());
                String raw = cursor.advance().getText();
                conditions.add(new AttributeCondition(name, op, raw));
                continue;
            }

            if (cursor.match(TokenType.ATTRIBUTE)) {
                String name = cursor.consume(TokenType.TAG, "attribute name").getText();
                ComparisonOperator op = operator(cursor.consume(TokenType.OPERATOR, "comparison operator"));
                String value = unescape(cursor.consume(TokenType.LITERAL, "quoted literal").getText());
                conditions.add(new AttributeCondition(name, op, value));
            } else if (startsWithDigit(t)) {
                Token number = cursor.consume(TokenType.TAG, "position");
                conditions.add(new PositionCondition(position(number)));
            } else if (t.getType() == TokenType.TAG && ("and".equals(t.getText()) || "or".equals(t.getText()))) {
                // connectives carry no condition, everything is ANDed
                cursor.advance();
            } else {
                throw new XPathSyntaxException(SyntaxErrorKind.UNEXPECTED_PREDICATE_TOKEN, t.getOffset());
            }
        }

        return new ComplexPredicate(conditions);
    }

    private boolean isBareComparison(Cursor cursor) {
        if (!cursor.check(TokenType.TAG) || cursor.peek(1).getType() != TokenType.OPERATOR) {
            return false;
        }
        TokenType valueType = cursor.peek(2).getType();
        return valueType == TokenType.LITERAL || valueType == TokenType.TAG;
    }

    private ComparisonOperator operator(Token t) {
        return ComparisonOperator.fromSymbol(t.getText())
                .orElseThrow(() -> new XPathSyntaxException(
                        SyntaxErrorKind.UNEXPECTED_TOKEN, t.getOffset(), "one of = != < > <= >="));
    }

    private static boolean startsWithDigit(Token t) {
        String text = t.getText();
        return !text.isEmpty() && isAsciiDigit(text.charAt(0));
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int position(Token number) {
        String text = number.getText();
        for (int i = 0; i < text.length(); i++) {
            if (!isAsciiDigit(text.charAt(i))) {
                throw new XPathSyntaxException(SyntaxErrorKind.UNEXPECTED_PREDICATE_TOKEN, number.getOffset(), "integer position");
            }
        }
        try {
            return Integer.parseInt(number.getText());
        } catch (NumberFormatException e) {
            throw new XPathSyntaxException(SyntaxErrorKind.UNEXPECTED_PREDICATE_TOKEN, number.getOffset(), "integer position");
        }
    }

    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                sb.append(raw.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Read position over one token list. Never moves past the end marker.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;

        Cursor(List<Token> tokens) {
            Objects.requireNonNull(tokens, "tokens must not be null");
            if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.END) {
                throw new IllegalArgumentException("token sequence must end with an END token");
            }
            this.tokens = tokens;
        }

        boolean atEnd() {
            return current().getType() == TokenType.END;
        }

        Token current() {
            return tokens.get(pos);
        }

        Token previous() {
            return tokens.get(pos - 1);
        }

        Token peek(int n) {
            return tokens.get(Math.min(pos + n, tokens.size() - 1));
        }

        boolean check(TokenType type) {
            return !atEnd() && current().getType() == type;
        }

        boolean match(TokenType type) {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        Token advance() {
            if (!atEnd()) {
                pos++;
            }
            return previous();
        }

        Token consume(TokenType type, String expected) {
            if (check(type)) {
                return advance();
            }
            throw new XPathSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN, current().getOffset(), expected);
        }
    }
}
