package org.nd.proof;

import org.nd.formula.Formula;

import java.util.List;

/**
 * Riga della prova: formula derivata, regola usata e passi citati come giustificazione.
 *
 * @param id identificativo univoco nella prova, assegnato in ordine crescente
 * @param formula formula della riga
 * @param rule regola che ha prodotto la riga (ASSUME per premesse e assunzioni)
 * @param justification id dei passi citati, nell'ordine registrato dalla regola
 * @param depth profondità di annidamento delle assunzioni
 * @param discharged true se l'assunzione è stata scaricata da un'introduzione dell'implicazione
 */
public record ProofStep(int id, Formula formula, RuleName rule, List<Integer> justification,
                        int depth, boolean discharged) {

    public ProofStep {
        if (formula == null) {
            throw new IllegalArgumentException("Formula del passo " + id + " non può essere null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Regola del passo " + id + " non può essere null");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità negativa per il passo " + id + ": " + depth);
        }
        justification = List.copyOf(justification);
    }

    /**
     * Crea un passo ASSUME (premessa o assunzione) a profondità 0 senza giustificazione.
     */
    public static ProofStep assumption(int id, Formula formula) {
        return new ProofStep(id, formula, RuleName.ASSUME, List.of(), 0, false);
    }

    /**
     * Crea un passo derivato da una regola, non scaricato.
     */
    public static ProofStep derived(int id, Formula formula, RuleName rule, List<Integer> justification, int depth) {
        return new ProofStep(id, formula, rule, justification, depth, false);
    }

    /**
     * @return copia del passo marcata come scaricata; formula, regola e giustificazione invariate
     */
    public ProofStep discharge() {
        return new ProofStep(id, formula, rule, justification, depth, true);
    }

    public boolean isAssumption() {
        return rule == RuleName.ASSUME;
    }
}
