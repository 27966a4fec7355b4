package org.nd.formula;

/**
 * Negazione di una sottoformula.
 *
 * @param inner formula negata (non null)
 */
public record Not(Formula inner) implements Formula {

    public Not {
        if (inner == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    /**
     * Verifica la forma ¬¬A.
     *
     * @return true se l'operando è a sua volta una negazione
     */
    public boolean isDoubleNegation() {
        return inner instanceof Not;
    }

    @Override
    public String toString() {
        return "¬" + inner;
    }
}
