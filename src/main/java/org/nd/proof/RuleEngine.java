package org.nd.proof;

import org.nd.formula.Binary;
import org.nd.formula.Connective;
import org.nd.formula.Formula;
import org.nd.formula.Not;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * MOTORE DELLE REGOLE - Transizione pura tra stati della prova
 *
 * Dato uno stato, il nome di una regola, gli id dei passi selezionati e l'eventuale
 * formula secondaria, produce un nuovo stato con un passo in più oppure fallisce con
 * una {@link RuleException}. Lo stato in ingresso non viene mai modificato: a parità
 * di argomenti il risultato (o l'errore) è sempre lo stesso.
 *
 * REGOLE SUPPORTATE:
 * - MP: da (A → B) e A deriva B
 * - CI: da A e B deriva (A ∧ B), nell'ordine di selezione
 * - CE_LEFT / CE_RIGHT: da (A ∧ B) deriva A oppure B
 * - DN: da ¬¬A deriva A
 * - DI_LEFT / DI_RIGHT: da A e una formula B fornita deriva (A ∨ B) oppure (B ∨ A)
 * - DS: da (A ∨ B) e ¬A deriva B (simmetricamente da ¬B deriva A)
 * - II: da un'assunzione A e una conclusione B deriva (A → B) e scarica A
 *
 * Per le regole a due passi l'ordine di selezione non conta, salvo CI: entrambi gli
 * ordinamenti vengono provati prima di rifiutare l'applicazione. Il confronto tra
 * formule è l'uguaglianza strutturale esatta degli alberi.
 *
 * LIMITI NOTI:
 * L'assunzione scaricata da II è scelta con un'euristica (passo ASSUME, altrimenti
 * l'id minore) e la profondità non viene usata per verificare che la sottoprova sia
 * contigua o correttamente annidata.
 */
public final class RuleEngine {

    private static final Logger LOGGER = Logger.getLogger(RuleEngine.class.getName());

    /**
     * Applica una regola che non richiede formula secondaria.
     *
     * @see #applyRule(ProofState, RuleName, List, Formula)
     */
    public ProofState applyRule(ProofState state, RuleName rule, List<Integer> selectedStepIds) {
        return applyRule(state, rule, selectedStepIds, null);
    }

    /**
     * METODO PRINCIPALE - Valida e applica una regola allo stato della prova.
     *
     * @param state stato corrente (non modificato)
     * @param rule regola da applicare
     * @param selectedStepIds id dei passi selezionati, nell'ordine di selezione
     * @param secondaryFormula formula da aggiungere per DI_LEFT/DI_RIGHT, ignorata altrove
     * @return nuovo stato con il passo derivato in coda e nextId incrementato
     * @throws RuleException se la regola non è applicabile ai passi selezionati
     */
    public ProofState applyRule(ProofState state, RuleName rule, List<Integer> selectedStepIds,
                                Formula secondaryFormula) {
        if (state == null || rule == null || selectedStepIds == null) {
            throw new IllegalArgumentException("Stato, regola e passi selezionati non possono essere null");
        }

        LOGGER.fine(() -> "Applicazione " + rule + " ai passi " + selectedStepIds);

        ProofState result = switch (rule) {
            case MP -> applyModusPonens(state, selectedStepIds);
            case CI -> applyConjunctionIntroduction(state, selectedStepIds);
            case CE_LEFT, CE_RIGHT -> applyConjunctionElimination(state, rule, selectedStepIds);
            case DN -> applyDoubleNegation(state, selectedStepIds);
            case DI_LEFT, DI_RIGHT -> applyDisjunctionIntroduction(state, rule, selectedStepIds, secondaryFormula);
            case DS -> applyDisjunctiveSyllogism(state, selectedStepIds);
            case II -> applyImplicationIntroduction(state, selectedStepIds);
            case ASSUME -> throw new RuleException(RuleException.Kind.UNSUPPORTED_RULE, rule,
                    "le assunzioni vengono aggiunte dal chiamante, non derivate da una regola");
        };

        ProofStep added = result.currentSteps().get(result.currentSteps().size() - 1);
        LOGGER.info(() -> "Passo " + added.id() + " accettato: " + added.formula()
                + " [" + rule + " " + added.justification() + "]");
        return result;
    }

    //region MODUS PONENS

    private ProofState applyModusPonens(ProofState state, List<Integer> ids) {
        List<ProofStep> selected = resolveSteps(state, RuleName.MP, ids);
        ProofStep first = selected.get(0);
        ProofStep second = selected.get(1);

        // Entrambi gli ordinamenti: (A → B, A) oppure (A, A → B)
        for (ProofStep[] pair : new ProofStep[][]{{first, second}, {second, first}}) {
            ProofStep implication = pair[0];
            ProofStep antecedent = pair[1];
            if (implication.formula() instanceof Binary binary
                    && binary.connective() == Connective.IMPLIES
                    && binary.left().equals(antecedent.formula())) {
                return derive(state, binary.right(), RuleName.MP,
                        List.of(implication.id(), antecedent.id()), maxDepth(selected));
            }
        }

        throw mismatch(RuleName.MP, "i passi selezionati devono avere la forma (A → B) e A");
    }

    //endregion

    //region CONGIUNZIONE

    private ProofState applyConjunctionIntroduction(ProofState state, List<Integer> ids) {
        List<ProofStep> selected = resolveSteps(state, RuleName.CI, ids);
        Formula conjunction = Formula.and(selected.get(0).formula(), selected.get(1).formula());
        return derive(state, conjunction, RuleName.CI, ids, maxDepth(selected));
    }

    private ProofState applyConjunctionElimination(ProofState state, RuleName rule, List<Integer> ids) {
        ProofStep premise = resolveSteps(state, rule, ids).get(0);

        if (premise.formula() instanceof Binary binary && binary.connective() == Connective.AND) {
            Formula conjunct = rule == RuleName.CE_LEFT ? binary.left() : binary.right();
            return derive(state, conjunct, rule, ids, premise.depth());
        }

        throw mismatch(rule, "il passo selezionato deve essere una congiunzione (A ∧ B)");
    }

    //endregion

    //region NEGAZIONE

    private ProofState applyDoubleNegation(ProofState state, List<Integer> ids) {
        ProofStep premise = resolveSteps(state, RuleName.DN, ids).get(0);

        if (premise.formula() instanceof Not outer && outer.inner() instanceof Not inner) {
            return derive(state, inner.inner(), RuleName.DN, ids, premise.depth());
        }

        throw mismatch(RuleName.DN, "il passo selezionato deve essere una doppia negazione (¬¬A)");
    }

    //endregion

    //region DISGIUNZIONE

    private ProofState applyDisjunctionIntroduction(ProofState state, RuleName rule, List<Integer> ids,
                                                    Formula secondaryFormula) {
        checkArity(rule, ids);
        if (secondaryFormula == null) {
            throw new RuleException(RuleException.Kind.MISSING_SECONDARY_FORMULA, rule,
                    "è richiesta la formula da aggiungere come disgiunto");
        }
        ProofStep premise = resolveSteps(state, rule, ids).get(0);

        Formula disjunction = rule == RuleName.DI_LEFT
                ? Formula.or(premise.formula(), secondaryFormula)
                : Formula.or(secondaryFormula, premise.formula());
        return derive(state, disjunction, rule, ids, premise.depth());
    }

    private ProofState applyDisjunctiveSyllogism(ProofState state, List<Integer> ids) {
        List<ProofStep> selected = resolveSteps(state, RuleName.DS, ids);
        ProofStep first = selected.get(0);
        ProofStep second = selected.get(1);

        for (ProofStep[] pair : new ProofStep[][]{{first, second}, {second, first}}) {
            Formula conclusion = eliminateDisjunct(pair[0].formula(), pair[1].formula());
            if (conclusion != null) {
                return derive(state, conclusion, RuleName.DS,
                        List.of(pair[0].id(), pair[1].id()), maxDepth(selected));
            }
        }

        throw mismatch(RuleName.DS, "i passi selezionati devono avere la forma (A ∨ B) e ¬A oppure ¬B");
    }

    /**
     * Da (A ∨ B) e ¬X restituisce il disgiunto che non coincide con X.
     *
     * @return disgiunto rimanente, oppure null se le formule non hanno la forma richiesta
     */
    private Formula eliminateDisjunct(Formula disjunction, Formula negation) {
        if (!(disjunction instanceof Binary binary) || binary.connective() != Connective.OR) {
            return null;
        }
        if (!(negation instanceof Not not)) {
            return null;
        }
        if (binary.left().equals(not.inner())) {
            return binary.right();
        }
        if (binary.right().equals(not.inner())) {
            return binary.left();
        }
        return null;
    }

    //endregion

    //region INTRODUZIONE DELL'IMPLICAZIONE

    /**
     * Scarica un'assunzione producendo (assunzione → conclusione) a profondità 0.
     *
     * SCELTA DELL'ASSUNZIONE:
     * 1. se esattamente uno dei due passi è ASSUME, è quello l'assunzione
     * 2. altrimenti (entrambi o nessuno) l'assunzione è il passo con id minore
     */
    private ProofState applyImplicationIntroduction(ProofState state, List<Integer> ids) {
        List<ProofStep> selected = resolveSteps(state, RuleName.II, ids);
        ProofStep stepA = selected.get(0);
        ProofStep stepB = selected.get(1);

        ProofStep assumption;
        ProofStep conclusion;
        if (stepA.isAssumption() != stepB.isAssumption()) {
            assumption = stepA.isAssumption() ? stepA : stepB;
            conclusion = stepA.isAssumption() ? stepB : stepA;
        } else if (stepA.id() < stepB.id()) {
            assumption = stepA;
            conclusion = stepB;
        } else {
            assumption = stepB;
            conclusion = stepA;
        }

        LOGGER.finest(() -> "Assunzione scaricata: passo " + assumption.id() + ", conclusione: passo " + conclusion.id());

        ProofStep implication = ProofStep.derived(state.nextId(),
                Formula.implies(assumption.formula(), conclusion.formula()),
                RuleName.II, List.of(assumption.id(), conclusion.id()), 0);
        return state.dischargeAndAppend(assumption.id(), implication);
    }

    //endregion

    //region SUPPORTO

    /**
     * Verifica l'arità e risolve gli id selezionati nei passi corrispondenti.
     */
    private List<ProofStep> resolveSteps(ProofState state, RuleName rule, List<Integer> ids) {
        checkArity(rule, ids);

        List<ProofStep> steps = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            if (id == null) {
                throw new RuleException(RuleException.Kind.STEP_NOT_FOUND, rule, "id di passo mancante");
            }
            ProofStep step = state.findStep(id).orElseThrow(() -> new RuleException(
                    RuleException.Kind.STEP_NOT_FOUND, rule, "il passo " + id + " non esiste"));
            steps.add(step);
        }
        return steps;
    }

    private void checkArity(RuleName rule, List<Integer> ids) {
        if (ids.size() != rule.arity()) {
            throw new RuleException(RuleException.Kind.ARITY_MISMATCH, rule,
                    rule.description() + " richiede esattamente " + rule.arity()
                            + (rule.arity() == 1 ? " passo" : " passi") + ", selezionati " + ids.size());
        }
    }

    private ProofState derive(ProofState state, Formula formula, RuleName rule, List<Integer> justification, int depth) {
        return state.append(ProofStep.derived(state.nextId(), formula, rule, justification, depth));
    }

    private int maxDepth(List<ProofStep> steps) {
        return steps.stream().mapToInt(ProofStep::depth).max().orElse(0);
    }

    private RuleException mismatch(RuleName rule, String expectation) {
        LOGGER.fine(() -> "Regola " + rule + " rifiutata: " + expectation);
        return new RuleException(RuleException.Kind.PATTERN_MISMATCH, rule, expectation);
    }

    //endregion
}
