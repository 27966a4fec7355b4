package org.nd.script;

import org.nd.proof.ProofState;
import org.nd.proof.ProofStep;
import org.nd.proof.RuleException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RISULTATO DELL'ESECUZIONE - Contenitore immutabile per l'esito di uno script
 *
 * Raccoglie lo stato finale della prova e l'esito di ogni direttiva eseguita.
 * Le direttive rifiutate non modificano lo stato: compaiono solo tra gli errori.
 *
 * @param finalState stato della prova dopo l'ultima direttiva
 * @param outcomes esito di ogni direttiva, in ordine di esecuzione
 */
public record ProofReport(ProofState finalState, List<Outcome> outcomes) {

    /**
     * Esito di una direttiva: il passo aggiunto oppure l'errore del motore.
     *
     * @param directive direttiva eseguita
     * @param step passo aggiunto, null se rifiutata
     * @param failure errore del motore, null se accettata
     */
    public record Outcome(Directive directive, ProofStep step, RuleException failure) {
        public boolean isAccepted() {
            return failure == null;
        }
    }

    public ProofReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean isGoalAchieved() {
        return finalState.isGoalAchieved();
    }

    public long acceptedCount() {
        return outcomes.stream().filter(Outcome::isAccepted).count();
    }

    public List<Outcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isAccepted()).toList();
    }

    //region OUTPUT TESTUALE

    /**
     * Produce il report strutturato della prova:
     * premesse e obiettivo, lista numerata dei passi, errori, esito finale.
     *
     * @return testo del report
     */
    public String render() {
        StringBuilder sb = new StringBuilder();

        sb.append("=== PROVA ===\n");
        sb.append("Premesse: ").append(finalState.premises().isEmpty() ? "nessuna"
                : finalState.premises().stream()
                    .map(step -> step.formula().toString())
                    .collect(Collectors.joining(", "))).append("\n");
        sb.append("Obiettivo: ").append(finalState.goal()).append("\n\n");

        sb.append("=== PASSI ===\n");
        for (ProofStep step : finalState.currentSteps()) {
            sb.append(renderStep(step)).append("\n");
        }
        sb.append("\n");

        List<Outcome> failures = failures();
        if (!failures.isEmpty()) {
            sb.append("=== ERRORI ===\n");
            for (Outcome failure : failures) {
                sb.append("riga ").append(failure.directive().lineNumber()).append(" (")
                        .append(failure.directive()).append("): ")
                        .append(failure.failure().getMessage()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("=== ESITO ===\n");
        sb.append("Obiettivo raggiunto: ").append(isGoalAchieved() ? "SÌ" : "NO").append("\n");
        sb.append("Direttive accettate: ").append(acceptedCount())
                .append(", rifiutate: ").append(failures.size()).append("\n");

        return sb.toString();
    }

    private static String renderStep(ProofStep step) {
        String justification = step.justification().isEmpty() ? ""
                : " " + step.justification().stream().map(String::valueOf)
                    .collect(Collectors.joining(", ", "[", "]"));
        String discharged = step.discharged() ? " (scaricata)" : "";
        return String.format("%3d. %-30s %s%s%s", step.id(), step.formula(), step.rule(), justification, discharged);
    }

    //endregion
}
