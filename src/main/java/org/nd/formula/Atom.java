package org.nd.formula;

/**
 * Lettera proposizionale.
 *
 * @param name nome della variabile proposizionale (non null, non vuoto)
 */
public record Atom(String name) implements Formula {

    public Atom {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome della proposizione non può essere null o vuoto");
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
