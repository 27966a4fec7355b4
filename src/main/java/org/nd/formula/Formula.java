package org.nd.formula;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Tipo somma chiuso con tre varianti:
 * - {@link Atom}: lettera proposizionale (P, Q, R, ...)
 * - {@link Not}: negazione di una sottoformula
 * - {@link Binary}: connettivo binario (∧, ∨, →) con operandi ordinati
 *
 * UGUAGLIANZA STRUTTURALE:
 * Le varianti sono record, quindi equals/hashCode confrontano ricorsivamente
 * variante e campi. Due formule sono uguali se e solo se hanno la stessa forma
 * e gli stessi atomi nelle stesse posizioni (sinistra/destra non commutano).
 *
 * RAPPRESENTAZIONE TESTUALE:
 * toString() produce la forma usata nella lista dei passi: negazione come "¬A",
 * ogni nodo binario interamente parentesizzato, ad esempio "((P ∧ Q) → ¬R)".
 */
public sealed interface Formula permits Atom, Not, Binary {

    /**
     * Doppio dispatch sulle varianti: ogni visitor deve gestire tutti i casi.
     *
     * @param visitor visitor da applicare
     * @param <R> tipo del risultato
     * @return risultato prodotto dal visitor
     */
    <R> R accept(FormulaVisitor<R> visitor);

    //region COSTRUTTORI DI COMODO

    static Formula atom(String name) {
        return new Atom(name);
    }

    static Formula not(Formula inner) {
        return new Not(inner);
    }

    static Formula and(Formula left, Formula right) {
        return new Binary(Connective.AND, left, right);
    }

    static Formula or(Formula left, Formula right) {
        return new Binary(Connective.OR, left, right);
    }

    static Formula implies(Formula left, Formula right) {
        return new Binary(Connective.IMPLIES, left, right);
    }

    //endregion

    //region ISPEZIONE STRUTTURALE

    /**
     * Verifica se la formula è un nodo binario con il connettivo indicato.
     *
     * @param connective connettivo atteso
     * @return true se la formula è della forma (A op B)
     */
    default boolean isBinary(Connective connective) {
        return this instanceof Binary binary && binary.connective() == connective;
    }

    /**
     * Conta i nodi dell'albero (atomi e connettivi).
     *
     * @return numero totale di nodi
     */
    default int size() {
        return accept(new FormulaVisitor<Integer>() {
            @Override
            public Integer visitAtom(Atom atom) {
                return 1;
            }

            @Override
            public Integer visitNot(Not not) {
                return 1 + not.inner().accept(this);
            }

            @Override
            public Integer visitBinary(Binary binary) {
                return 1 + binary.left().accept(this) + binary.right().accept(this);
            }
        });
    }

    //endregion
}
