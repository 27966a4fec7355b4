package org.nd.formula;

/**
 * Visitor sulle tre varianti di {@link Formula}.
 *
 * @param <R> tipo del risultato
 */
public interface FormulaVisitor<R> {

    R visitAtom(Atom atom);

    R visitNot(Not not);

    R visitBinary(Binary binary);
}
