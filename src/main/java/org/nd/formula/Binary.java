package org.nd.formula;

/**
 * Nodo binario: congiunzione, disgiunzione o implicazione.
 * L'ordine degli operandi è significativo anche per i connettivi commutativi.
 *
 * @param connective connettivo del nodo
 * @param left operando sinistro (antecedente per l'implicazione)
 * @param right operando destro (conseguente per l'implicazione)
 */
public record Binary(Connective connective, Formula left, Formula right) implements Formula {

    public Binary {
        if (connective == null) {
            throw new IllegalArgumentException("Connettivo non può essere null");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi per " + connective + " non possono essere null");
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective.symbol() + " " + right + ")";
    }
}
