package org.nd.proof;

import org.nd.formula.Formula;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * STATO DELLA PROVA - Valore immutabile
 *
 * Contiene le premesse iniziali, la formula obiettivo, la lista ordinata dei passi
 * accettati e il prossimo id da assegnare. Ogni transizione (regola applicata,
 * assunzione aggiunta, reset) restituisce un nuovo stato: lo stato di partenza non
 * viene mai modificato, quindi può essere condiviso liberamente tra thread.
 *
 * INVARIANTI:
 * - nextId è maggiore di ogni id presente in currentSteps
 * - gli id dei passi sono univoci
 * - currentSteps cresce solo in coda; un passo esistente viene sostituito soltanto
 *   per marcarlo come scaricato
 *
 * @param premises passi ASSUME con cui la prova è stata inizializzata
 * @param goal formula da dimostrare
 * @param currentSteps passi della prova in ordine di inserimento
 * @param nextId id da assegnare al prossimo passo
 */
public record ProofState(List<ProofStep> premises, Formula goal, List<ProofStep> currentSteps, int nextId) {

    public ProofState {
        if (goal == null) {
            throw new IllegalArgumentException("Formula obiettivo non può essere null");
        }
        premises = List.copyOf(premises);
        currentSteps = List.copyOf(currentSteps);
        validateIds(currentSteps, nextId);
    }

    private static void validateIds(List<ProofStep> steps, int nextId) {
        Set<Integer> seen = new HashSet<>();
        for (ProofStep step : steps) {
            if (!seen.add(step.id())) {
                throw new IllegalArgumentException("Id di passo duplicato: " + step.id());
            }
            if (step.id() >= nextId) {
                throw new IllegalArgumentException("nextId " + nextId + " non supera l'id di passo " + step.id());
            }
        }
    }

    //region CREAZIONE E TRANSIZIONI DEL CHIAMANTE

    /**
     * Inizializza una prova: le premesse diventano passi ASSUME con id 1..n a profondità 0.
     *
     * @param premises formule assunte come premesse (anche nessuna)
     * @param goal formula da dimostrare
     * @return stato iniziale con nextId = n + 1
     */
    public static ProofState initial(List<Formula> premises, Formula goal) {
        List<ProofStep> steps = new ArrayList<>(premises.size());
        int id = 1;
        for (Formula premise : premises) {
            steps.add(ProofStep.assumption(id++, premise));
        }
        return new ProofState(steps, goal, steps, id);
    }

    /**
     * Aggiunge un'assunzione (passo ASSUME) in coda alla prova, ad esempio l'ipotesi
     * da scaricare in seguito con un'introduzione dell'implicazione.
     *
     * @param formula formula assunta
     * @return nuovo stato con un passo in più
     */
    public ProofState withAssumption(Formula formula) {
        return append(ProofStep.assumption(nextId, formula));
    }

    /**
     * Riporta la prova alle sole premesse iniziali, mantenendo l'obiettivo.
     *
     * @return nuovo stato equivalente a quello iniziale
     */
    public ProofState reset() {
        int firstFreeId = premises.stream().mapToInt(ProofStep::id).max().orElse(0) + 1;
        return new ProofState(premises, goal, premises, firstFreeId);
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return true se almeno un passo è strutturalmente uguale all'obiettivo
     */
    public boolean isGoalAchieved() {
        return currentSteps.stream().anyMatch(step -> step.formula().equals(goal));
    }

    public Optional<ProofStep> findStep(int id) {
        return currentSteps.stream().filter(step -> step.id() == id).findFirst();
    }

    //endregion

    //region TRANSIZIONI DEL MOTORE

    /**
     * Nuovo stato con il passo aggiunto in coda e nextId incrementato.
     */
    ProofState append(ProofStep step) {
        if (step.id() != nextId) {
            throw new IllegalArgumentException("Id del nuovo passo " + step.id() + " diverso da nextId " + nextId);
        }
        List<ProofStep> steps = new ArrayList<>(currentSteps);
        steps.add(step);
        return new ProofState(premises, goal, steps, nextId + 1);
    }

    /**
     * Nuovo stato in cui il passo indicato è marcato come scaricato e il passo dato
     * è aggiunto in coda.
     */
    ProofState dischargeAndAppend(int assumptionId, ProofStep step) {
        List<ProofStep> steps = new ArrayList<>(currentSteps.size());
        for (ProofStep current : currentSteps) {
            steps.add(current.id() == assumptionId ? current.discharge() : current);
        }
        return new ProofState(premises, goal, steps, nextId).append(step);
    }

    //endregion
}
