package org.nd.formula;

/**
 * Connettivi binari supportati, con il simbolo usato nella rappresentazione testuale.
 */
public enum Connective {
    AND("∧"),       // Congiunzione: A ∧ B
    OR("∨"),        // Disgiunzione: A ∨ B
    IMPLIES("→");   // Implicazione: A → B

    private final String symbol;

    Connective(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
