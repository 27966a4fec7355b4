package org.nd.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Token riconosciuti")
    class RecognizedTokens {

        @Test
        @DisplayName("Formula completa con posizioni dei token")
        void tokenizesFullFormula() {
            List<Token> tokens = FormulaLexer.tokenize("P -> (Q ∧ ¬R)");

            assertAll("Sequenza di token",
                    () -> assertEquals(List.of(
                            TokenType.PROPOSITION, TokenType.IMPLIES, TokenType.LEFT_PAREN,
                            TokenType.PROPOSITION, TokenType.AND, TokenType.NOT,
                            TokenType.PROPOSITION, TokenType.RIGHT_PAREN, TokenType.EOF), types(tokens)),
                    () -> assertEquals(new Token(TokenType.PROPOSITION, "P", 0), tokens.get(0)),
                    () -> assertEquals(new Token(TokenType.IMPLIES, "->", 2), tokens.get(1)),
                    () -> assertEquals(new Token(TokenType.NOT, "¬", 10), tokens.get(5)),
                    () -> assertEquals(Token.eof(13), tokens.get(8))
            );
        }

        @Test
        @DisplayName("Simboli alternativi per implicazione e negazione")
        void alternativeSymbols() {
            List<Token> tokens = FormulaLexer.tokenize("~P → ¬Q");

            assertEquals(List.of(TokenType.NOT, TokenType.PROPOSITION, TokenType.IMPLIES,
                    TokenType.NOT, TokenType.PROPOSITION, TokenType.EOF), types(tokens));
            assertEquals("→", tokens.get(2).value());
        }

        @Test
        @DisplayName("Disgiunzione e spazi bianchi di ogni tipo")
        void disjunctionAndWhitespace() {
            List<Token> tokens = FormulaLexer.tokenize(" P\t∨\nQ ");

            assertEquals(List.of(TokenType.PROPOSITION, TokenType.OR, TokenType.PROPOSITION, TokenType.EOF),
                    types(tokens));
        }

        @Test
        @DisplayName("Spazi Unicode ignorati")
        void unicodeWhitespace() {
            List<Token> tokens = FormulaLexer.tokenize("P\u2003∧\u3000Q\u00A0");

            assertAll(
                    () -> assertEquals(List.of(TokenType.PROPOSITION, TokenType.AND, TokenType.PROPOSITION, TokenType.EOF),
                            types(tokens)),
                    () -> assertEquals(2, tokens.get(1).position())
            );
        }

        @Test
        @DisplayName("Testo vuoto produce solo EOF")
        void emptyInput() {
            assertEquals(List.of(Token.eof(0)), FormulaLexer.tokenize(""));
        }

        @Test
        @DisplayName("Lettere adiacenti sono proposizioni distinte")
        void adjacentLettersAreSeparatePropositions() {
            List<Token> tokens = FormulaLexer.tokenize("PQ");

            assertAll(
                    () -> assertEquals(List.of(TokenType.PROPOSITION, TokenType.PROPOSITION, TokenType.EOF), types(tokens)),
                    () -> assertEquals("P", tokens.get(0).value()),
                    () -> assertEquals("Q", tokens.get(1).value())
            );
        }

        @Test
        @DisplayName("La sequenza termina con un solo EOF")
        void exactlyOneEof() {
            List<Token> tokens = FormulaLexer.tokenize("(P)");

            assertEquals(1, tokens.stream().filter(t -> t.type() == TokenType.EOF).count());
            assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
        }
    }

    @Nested
    @DisplayName("Errori lessicali")
    class LexicalErrors {

        @Test
        @DisplayName("Trattino non seguito da '>'")
        void loneDash() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("P - Q"));

            assertAll(
                    () -> assertEquals(LexException.Kind.INVALID_OPERATOR_SEQUENCE, e.getKind()),
                    () -> assertEquals(2, e.getPosition()),
                    () -> assertEquals("-", e.getCharacter())
            );
        }

        @Test
        @DisplayName("Trattino in fondo alla formula")
        void trailingDash() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("P -"));
            assertEquals(LexException.Kind.INVALID_OPERATOR_SEQUENCE, e.getKind());
        }

        @Test
        @DisplayName("Lettera minuscola")
        void lowercaseLetter() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("p"));

            assertAll(
                    () -> assertEquals(LexException.Kind.UNRECOGNIZED_CHARACTER, e.getKind()),
                    () -> assertEquals(0, e.getPosition()),
                    () -> assertEquals("p", e.getCharacter())
            );
        }

        @Test
        @DisplayName("Simbolo fuori dall'alfabeto")
        void unknownSymbol() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("P & Q"));

            assertAll(
                    () -> assertEquals(LexException.Kind.UNRECOGNIZED_CHARACTER, e.getKind()),
                    () -> assertEquals(2, e.getPosition()),
                    () -> assertTrue(e.getMessage().contains("&"))
            );
        }

        @Test
        @DisplayName("Testo null rifiutato")
        void nullSource() {
            assertThrows(IllegalArgumentException.class, () -> FormulaLexer.tokenize(null));
        }
    }
}
