package org.nd.script;

import org.nd.formula.Formula;
import org.nd.proof.RuleName;

import java.util.List;

/**
 * Direttiva eseguibile di uno script di prova, applicata allo stato in ordine di lettura.
 */
public sealed interface Directive permits Directive.Assume, Directive.Apply {

    /**
     * @return riga dello script da cui proviene la direttiva
     */
    int lineNumber();

    /**
     * ASSUME|formula: aggiunge un'assunzione alla prova.
     */
    record Assume(int lineNumber, Formula formula) implements Directive {
        @Override
        public String toString() {
            return "ASSUME " + formula;
        }
    }

    /**
     * APPLY|regola|id,id[|formula]: invoca il motore delle regole.
     */
    record Apply(int lineNumber, RuleName rule, List<Integer> stepIds, Formula secondaryFormula) implements Directive {
        public Apply {
            stepIds = List.copyOf(stepIds);
        }

        @Override
        public String toString() {
            return "APPLY " + rule + " " + stepIds + (secondaryFormula != null ? " con " + secondaryFormula : "");
        }
    }
}
