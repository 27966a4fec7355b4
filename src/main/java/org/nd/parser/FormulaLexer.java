package org.nd.parser;

import org.antlr.v4.runtime.CharStreams;
import org.nd.antlr.PropositionalFormulaLexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * LEXER FORMULE - Conversione testo -> sequenza di token
 *
 * Utilizza il lexer ANTLR generato dalla grammatica PropositionalFormula e
 * converte ogni token nel modello {@link Token} del progetto.
 *
 * ALFABETO:
 * - Proposizioni: singola lettera maiuscola ASCII (A-Z)
 * - Negazione: ~ oppure ¬
 * - Congiunzione: ∧
 * - Disgiunzione: ∨
 * - Implicazione: -> oppure →
 * - Parentesi: ( )
 * - Spazi bianchi ignorati
 *
 * La grammatica contiene due regole di chiusura (DASH e UNRECOGNIZED) che rendono
 * il lexer totale: qui vengono trasformate nelle corrispondenti {@link LexException}.
 * La sequenza restituita termina sempre con un unico token EOF.
 */
public final class FormulaLexer {

    private static final Logger LOGGER = Logger.getLogger(FormulaLexer.class.getName());

    private FormulaLexer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Scompone il testo sorgente in token.
     *
     * @param source testo della formula (non null)
     * @return sequenza non modificabile di token terminata da EOF
     * @throws LexException al primo carattere non appartenente all'alfabeto
     */
    public static List<Token> tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();

        List<Token> tokens = new ArrayList<>();
        while (true) {
            org.antlr.v4.runtime.Token antlrToken = lexer.nextToken();
            int position = antlrToken.getStartIndex();

            switch (antlrToken.getType()) {
                case PropositionalFormulaLexer.DASH ->
                        throw new LexException(LexException.Kind.INVALID_OPERATOR_SEQUENCE, antlrToken.getText(), position);
                case PropositionalFormulaLexer.UNRECOGNIZED ->
                        throw new LexException(LexException.Kind.UNRECOGNIZED_CHARACTER, antlrToken.getText(), position);
                case org.antlr.v4.runtime.Token.EOF -> {
                    tokens.add(Token.eof(position));
                    LOGGER.finest("Tokenizzazione completata: " + tokens.size() + " token");
                    return Collections.unmodifiableList(tokens);
                }
                default -> tokens.add(new Token(TokenType.fromAntlrType(antlrToken.getType()),
                        antlrToken.getText(), position));
            }
        }
    }
}
