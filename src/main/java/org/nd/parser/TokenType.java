package org.nd.parser;

import org.nd.antlr.PropositionalFormulaLexer;

/**
 * Tipi di token del linguaggio delle formule, con il tipo ANTLR corrispondente
 * nella grammatica PropositionalFormula.
 */
public enum TokenType {
    PROPOSITION(PropositionalFormulaLexer.PROPOSITION),   // P, Q, R, ...
    IMPLIES(PropositionalFormulaLexer.IMPLIES),           // -> oppure →
    AND(PropositionalFormulaLexer.AND),                   // ∧
    OR(PropositionalFormulaLexer.OR),                     // ∨
    NOT(PropositionalFormulaLexer.NOT),                   // ~ oppure ¬
    LEFT_PAREN(PropositionalFormulaLexer.LEFT_PAREN),     // (
    RIGHT_PAREN(PropositionalFormulaLexer.RIGHT_PAREN),   // )
    EOF(org.antlr.v4.runtime.Token.EOF);                  // fine input

    private final int antlrType;

    TokenType(int antlrType) {
        this.antlrType = antlrType;
    }

    int antlrType() {
        return antlrType;
    }

    /**
     * Converte un tipo di token ANTLR nel tipo del progetto.
     *
     * @param antlrType tipo prodotto dal lexer generato
     * @return tipo corrispondente, oppure null per i token di errore (DASH, UNRECOGNIZED)
     */
    static TokenType fromAntlrType(int antlrType) {
        for (TokenType type : values()) {
            if (type.antlrType == antlrType) {
                return type;
            }
        }
        return null;
    }
}
