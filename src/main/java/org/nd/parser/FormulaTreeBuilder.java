package org.nd.parser;

import org.nd.antlr.PropositionalFormulaBaseVisitor;
import org.nd.antlr.PropositionalFormulaParser.AndContext;
import org.nd.antlr.PropositionalFormulaParser.AtomContext;
import org.nd.antlr.PropositionalFormulaParser.FormulaContext;
import org.nd.antlr.PropositionalFormulaParser.GroupContext;
import org.nd.antlr.PropositionalFormulaParser.ImpliesContext;
import org.nd.antlr.PropositionalFormulaParser.NotContext;
import org.nd.antlr.PropositionalFormulaParser.OrContext;
import org.nd.antlr.PropositionalFormulaParser.UnaryContext;
import org.nd.formula.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO - Visitor da albero sintattico ANTLR a {@link Formula}
 *
 * Ogni metodo visit gestisce un livello della scala di precedenze della grammatica.
 * Conversione bottom-up senza alcuna trasformazione semantica: la formula prodotta
 * rispecchia esattamente il testo (nessuna normalizzazione, nessuna semplificazione).
 *
 * ASSOCIATIVITÀ:
 * - Congiunzione e disgiunzione: piegatura a sinistra, A ∧ B ∧ C = (A ∧ B) ∧ C
 * - Implicazione: ricorsione a destra, A → B → C = A → (B → C)
 * - Negazione: annidata, ¬¬A = ¬(¬A)
 */
class FormulaTreeBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    //endregion

    //region IMPLICAZIONI (PRECEDENZA PIÙ BASSA)

    /**
     * Gestisce implicazioni (→) associative a destra.
     *
     * @param ctx contesto implicazione dalla grammatica
     * @return antecedente da solo, oppure nodo IMPLIES con conseguente ricorsivo
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        // Caso base: nessun operatore IMPLIES presente
        if (ctx.IMPLIES() == null) {
            return visit(ctx.disjunction());
        }

        Formula antecedent = visit(ctx.disjunction());
        Formula consequent = visit(ctx.implication());   // ricorsivo per associatività destra
        return Formula.implies(antecedent, consequent);
    }

    //endregion

    //region DISGIUNZIONI E CONGIUNZIONI

    @Override
    public Formula visitOr(OrContext ctx) {
        // Caso ottimizzato: singola congiunzione senza OR
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }

        LOGGER.finest("Elaborazione disgiunzione con " + ctx.conjunction().size() + " operandi");

        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        List<UnaryContext> operands = ctx.unary();
        if (operands.size() == 1) {
            return visit(operands.get(0));
        }

        LOGGER.finest("Elaborazione congiunzione con " + operands.size() + " operandi");

        Formula result = visit(operands.get(0));
        for (UnaryContext operand : operands.subList(1, operands.size())) {
            result = Formula.and(result, visit(operand));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.unary()));
    }

    /**
     * Parentesi trasparenti: non lasciano traccia nell'albero.
     */
    @Override
    public Formula visitGroup(GroupContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Formula visitAtom(AtomContext ctx) {
        return Formula.atom(ctx.PROPOSITION().getText());
    }

    //endregion
}
