package io.hearthwarrio.xlocator.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XPathLexerTest {
    private final Tokenizer lexer = new XPathLexer();

    @Test
    void emptyInputYieldsOnlyEndMarker() {
        List<Token> tokens = lexer.tokenize("");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.END, tokens.get(0).getType());
        assertEquals(0, tokens.get(0).getOffset());
    }

    @Test
    void whitespaceOnlyInputYieldsOnlyEndMarker() {
        List<Token> tokens = lexer.tokenize("  \t ");
        assertEquals(List.of(TokenType.END), types(tokens));
        assertEquals(4, tokens.get(0).getOffset());
    }

    @Test
    void mergesDoubleSlashIntoOneToken() {
        List<Token> tokens = lexer.tokenize("//button");
        assertEquals(List.of(TokenType.SLASH, TokenType.TAG, TokenType.END), types(tokens));
        assertEquals("//", tokens.get(0).getText());
        assertEquals("button", tokens.get(1).getText());
        assertEquals(2, tokens.get(1).getOffset());
    }

    @Test
    void tokenizesAttributePredicate() {
        List<Token> tokens = lexer.tokenize("/form[@name='login']");
        assertEquals(List.of(
                TokenType.SLASH, TokenType.TAG, TokenType.PREDICATE, TokenType.ATTRIBUTE,
                TokenType.TAG, TokenType.OPERATOR, TokenType.LITERAL, TokenType.PREDICATE, TokenType.END
        ), types(tokens));

        Token literal = tokens.get(6);
        assertEquals("login", literal.getText());
        assertEquals(13, literal.getOffset());
        assertEquals("]", tokens.get(7).getText());
    }

    @Test
    void literalKeepsEscapesAndAcceptsBothQuotes() {
        List<Token> tokens = lexer.tokenize("a[@t=\"it\\\"s\"][@u='x']");
        List<String> literals = new ArrayList<>();
        for (Token t : tokens) {
            if (t.getType() == TokenType.LITERAL) {
                literals.add(t.getText());
            }
        }
        assertEquals(List.of("it\\\"s", "x"), literals);
    }

    @Test
    void scansOneAndTwoCharacterOperators() {
        List<Token> tokens = lexer.tokenize("a[b<=1 and c!=2 and d>3 and e=4]");
        List<String> ops = new ArrayList<>();
        for (Token t : tokens) {
            if (t.getType() == TokenType.OPERATOR) {
                ops.add(t.getText());
            }
        }
        assertEquals(List.of("<=", "!=", ">", "="), ops);
    }

    @Test
    void recognizesAxisAndDropsColons() {
        List<Token> tokens = lexer.tokenize("descendant::panel");
        assertEquals(List.of(TokenType.AXIS, TokenType.TAG, TokenType.END), types(tokens));
        assertEquals("descendant", tokens.get(0).getText());
        assertEquals("panel", tokens.get(1).getText());
        assertEquals(12, tokens.get(1).getOffset());
    }

    @Test
    void singleColonStaysInsideTag() {
        List<Token> tokens = lexer.tokenize("qt:button");
        assertEquals(List.of(TokenType.TAG, TokenType.END), types(tokens));
        assertEquals("qt:button", tokens.get(0).getText());
    }

    @Test
    void wildcardAndNumbers() {
        List<Token> tokens = lexer.tokenize("*[2]");
        assertEquals(List.of(TokenType.WILDCARD, TokenType.PREDICATE, TokenType.TAG, TokenType.PREDICATE, TokenType.END),
                types(tokens));
        assertEquals("2", tokens.get(2).getText());
    }

    @Test
    void failsOnUnterminatedLiteralWithOpeningOffset() {
        XPathSyntaxException ex = assertThrows(
                XPathSyntaxException.class,
                () -> lexer.tokenize("book[@id='1")
        );
        assertEquals(SyntaxErrorKind.UNTERMINATED_LITERAL, ex.kind());
        assertEquals(9, ex.offset());
        assertTrue(ex.getMessage().contains("Unterminated"));
    }

    @Test
    void escapedClosingQuoteDoesNotTerminate() {
        XPathSyntaxException ex = assertThrows(
                XPathSyntaxException.class,
                () -> lexer.tokenize("a[@x='abc\\']")
        );
        assertEquals(SyntaxErrorKind.UNTERMINATED_LITERAL, ex.kind());
    }

    @Test
    void alwaysEndsWithExactlyOneEndMarker() {
        List<Token> tokens = lexer.tokenize("/form/textfield[@name='username']/button");
        long ends = tokens.stream().filter(t -> t.getType() == TokenType.END).count();
        assertEquals(1, ends);
        assertEquals(TokenType.END, tokens.get(tokens.size() - 1).getType());
    }

    @Test
    void rejectsNullInput() {
        assertThrows(NullPointerException.class, () -> lexer.tokenize(null));
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens) {
            out.add(t.getType());
        }
        return out;
    }
}
