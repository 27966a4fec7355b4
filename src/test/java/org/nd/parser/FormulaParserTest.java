package org.nd.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.nd.formula.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.nd.formula.Formula.and;
import static org.nd.formula.Formula.atom;
import static org.nd.formula.Formula.implies;
import static org.nd.formula.Formula.not;
import static org.nd.formula.Formula.or;

class FormulaParserTest {

    private static final Formula P = atom("P");
    private static final Formula Q = atom("Q");
    private static final Formula R = atom("R");
    private static final Formula S = atom("S");

    private static Formula parse(String text) {
        return FormulaReader.parseFormula(text);
    }

    @Nested
    @DisplayName("Precedenze e associatività")
    class PrecedenceAndAssociativity {

        @Test
        @DisplayName("La congiunzione lega più della disgiunzione")
        void conjunctionBindsTighterThanDisjunction() {
            assertEquals(or(P, and(Q, R)), parse("P ∨ Q ∧ R"));
        }

        @Test
        @DisplayName("L'implicazione associa a destra")
        void implicationIsRightAssociative() {
            assertEquals(implies(P, implies(Q, R)), parse("P -> Q -> R"));
        }

        @Test
        @DisplayName("Doppia negazione annidata")
        void doubleNegationNests() {
            assertEquals(not(not(P)), parse("~~P"));
        }

        @Test
        @DisplayName("Congiunzione e disgiunzione associano a sinistra")
        void chainsAreLeftAssociative() {
            assertAll(
                    () -> assertEquals(and(and(P, Q), R), parse("P ∧ Q ∧ R")),
                    () -> assertEquals(or(or(P, Q), R), parse("P ∨ Q ∨ R"))
            );
        }

        @Test
        @DisplayName("L'implicazione lega meno di tutti gli altri connettivi")
        void implicationIsLoosest() {
            assertEquals(implies(and(P, Q), or(R, S)), parse("P ∧ Q → R ∨ S"));
        }

        @Test
        @DisplayName("La negazione si applica al solo operando immediato")
        void negationBindsTightest() {
            assertAll(
                    () -> assertEquals(and(not(P), Q), parse("~P ∧ Q")),
                    () -> assertEquals(not(and(P, Q)), parse("¬(P ∧ Q)"))
            );
        }

        @Test
        @DisplayName("Le parentesi modificano il raggruppamento senza lasciare traccia")
        void parenthesesRegroup() {
            assertAll(
                    () -> assertEquals(implies(implies(P, Q), R), parse("(P -> Q) -> R")),
                    () -> assertEquals(P, parse("((P))")),
                    () -> assertEquals(and(P, or(Q, R)), parse("P ∧ (Q ∨ R)"))
            );
        }

        @Test
        @DisplayName("Letture ripetute producono alberi uguali")
        void repeatedParsesAreEqual() {
            String text = "~(P ∧ Q) -> (R ∨ ~~S) -> P";
            assertEquals(parse(text), parse(text));
        }
    }

    @Nested
    @DisplayName("Errori sintattici")
    class SyntaxErrors {

        private ParseException parseError(String text) {
            return assertThrows(ParseException.class, () -> parse(text));
        }

        @Test
        @DisplayName("Parentesi non chiusa a fine formula")
        void missingCloseParenAtEnd() {
            ParseException e = parseError("(P ∧ Q");

            assertAll(
                    () -> assertEquals(ParseException.Kind.MISSING_CLOSE_PAREN, e.getKind()),
                    () -> assertEquals(TokenType.EOF, e.getOffendingToken().type())
            );
        }

        @Test
        @DisplayName("Token estraneo al posto della parentesi chiusa")
        void missingCloseParenBeforeToken() {
            ParseException e = parseError("(P Q)");

            assertAll(
                    () -> assertEquals(ParseException.Kind.MISSING_CLOSE_PAREN, e.getKind()),
                    () -> assertEquals(new Token(TokenType.PROPOSITION, "Q", 3), e.getOffendingToken())
            );
        }

        @Test
        @DisplayName("Token residui dopo una formula completa")
        void trailingInput() {
            ParseException e = parseError("P Q");

            assertAll(
                    () -> assertEquals(ParseException.Kind.TRAILING_INPUT, e.getKind()),
                    () -> assertEquals("Q", e.getOffendingToken().value()),
                    () -> assertEquals(2, e.getPosition())
            );
        }

        @Test
        @DisplayName("Parentesi chiusa in eccesso")
        void extraCloseParen() {
            ParseException e = parseError("P)");
            assertEquals(ParseException.Kind.TRAILING_INPUT, e.getKind());
        }

        @Test
        @DisplayName("Formula vuota")
        void emptyFormula() {
            ParseException e = parseError("");

            assertAll(
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind()),
                    () -> assertEquals(TokenType.EOF, e.getOffendingToken().type())
            );
        }

        @Test
        @DisplayName("Operando mancante dopo un connettivo")
        void missingOperand() {
            assertAll(
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, parseError("P ∧").getKind()),
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, parseError("P -> ").getKind()),
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, parseError("~").getKind())
            );
        }

        @Test
        @DisplayName("Connettivo in posizione iniziale")
        void leadingConnective() {
            ParseException e = parseError("∧ P");

            assertAll(
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind()),
                    () -> assertEquals(TokenType.AND, e.getOffendingToken().type())
            );
        }

        @Test
        @DisplayName("Parentesi vuote")
        void emptyParentheses() {
            ParseException e = parseError("()");

            assertAll(
                    () -> assertEquals(ParseException.Kind.UNEXPECTED_TOKEN, e.getKind()),
                    () -> assertEquals(TokenType.RIGHT_PAREN, e.getOffendingToken().type())
            );
        }

        @Test
        @DisplayName("Negazioni annidate oltre il limite")
        void deepNegationChain() {
            ParseException e = parseError("~".repeat(20000) + "P");

            assertAll(
                    () -> assertEquals(ParseException.Kind.NESTING_TOO_DEEP, e.getKind()),
                    () -> assertEquals(FormulaParser.MAX_NESTING_DEPTH, e.getPosition())
            );
        }

        @Test
        @DisplayName("Parentesi e catene di implicazioni oltre il limite")
        void deepGroupsAndImplications() {
            assertAll(
                    () -> assertEquals(ParseException.Kind.NESTING_TOO_DEEP,
                            parseError("(".repeat(5000) + "P" + ")".repeat(5000)).getKind()),
                    () -> assertEquals(ParseException.Kind.NESTING_TOO_DEEP,
                            parseError("P -> ".repeat(5000) + "P").getKind())
            );
        }

        @Test
        @DisplayName("Annidamento entro il limite accettato")
        void nestingWithinLimit() {
            Formula formula = parse("~".repeat(100) + "(".repeat(50) + "P" + ")".repeat(50));
            assertEquals(101, formula.size());
        }

        @Test
        @DisplayName("Gli errori lessicali precedono quelli sintattici")
        void lexicalErrorsSurface() {
            assertThrows(LexException.class, () -> parse("P ∧ q"));
        }
    }

    @Nested
    @DisplayName("Sequenze di token fornite dal chiamante")
    class CallerSuppliedTokens {

        @Test
        @DisplayName("Sequenza costruita a mano")
        void handBuiltSequence() {
            List<Token> tokens = List.of(
                    new Token(TokenType.NOT, "~", 0),
                    new Token(TokenType.PROPOSITION, "P", 1),
                    Token.eof(2));

            assertEquals(not(P), FormulaParser.parse(tokens));
        }

        @Test
        @DisplayName("Sequenza senza EOF rifiutata")
        void sequenceWithoutEof() {
            List<Token> tokens = List.of(new Token(TokenType.PROPOSITION, "P", 0));
            assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(tokens));
        }

        @Test
        @DisplayName("Sequenza vuota rifiutata")
        void emptySequence() {
            assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(List.of()));
        }

        @Test
        @DisplayName("EOF intermedio seguito da altri token rifiutato")
        void earlyEofRejected() {
            List<Token> tokens = List.of(
                    new Token(TokenType.PROPOSITION, "P", 0),
                    Token.eof(1),
                    new Token(TokenType.PROPOSITION, "Q", 2),
                    Token.eof(3));

            assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(tokens));
        }

        @Test
        @DisplayName("Proposizioni che non sono una sola lettera maiuscola rifiutate")
        void invalidPropositionValues() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(
                            List.of(new Token(TokenType.PROPOSITION, "pq", 0), Token.eof(2)))),
                    () -> assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(
                            List.of(new Token(TokenType.PROPOSITION, "", 0), Token.eof(0)))),
                    () -> assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(
                            List.of(new Token(TokenType.PROPOSITION, "PQ", 0), Token.eof(2))))
            );
        }
    }
}
