package org.nd.parser;

import org.nd.formula.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * Punto di ingresso unico per la lettura di formule da testo:
 * Lexing -> Parsing -> Visitor.
 */
public final class FormulaReader {

    private static final Logger LOGGER = Logger.getLogger(FormulaReader.class.getName());

    private FormulaReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo di una formula nel suo albero sintattico.
     *
     * @param text formula in notazione infissa, ad esempio "P ∧ Q -> ~R"
     * @return albero della formula
     * @throws LexException se il testo contiene caratteri fuori dall'alfabeto
     * @throws ParseException se la formula è sintatticamente errata
     */
    public static Formula parseFormula(String text) {
        List<Token> tokens = FormulaLexer.tokenize(text);
        Formula formula = FormulaParser.parse(tokens);

        LOGGER.fine(() -> String.format("Formula letta: %s [token=%d, nodi=%d]",
                formula, tokens.size(), formula.size()));
        return formula;
    }
}
