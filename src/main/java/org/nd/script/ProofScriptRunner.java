package org.nd.script;

import org.nd.proof.ProofState;
import org.nd.proof.ProofStep;
import org.nd.proof.RuleEngine;
import org.nd.proof.RuleException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Esegue uno script di prova direttiva per direttiva.
 *
 * Una regola rifiutata non interrompe l'esecuzione: l'errore viene registrato e lo
 * stato resta quello precedente.
 */
public class ProofScriptRunner {

    private static final Logger LOGGER = Logger.getLogger(ProofScriptRunner.class.getName());

    private final RuleEngine engine;

    public ProofScriptRunner() {
        this(new RuleEngine());
    }

    public ProofScriptRunner(RuleEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("Motore delle regole non può essere null");
        }
        this.engine = engine;
    }

    /**
     * @param script script già validato
     * @return stato finale ed esiti delle direttive
     */
    public ProofReport run(ProofScript script) {
        ProofState state = ProofState.initial(script.premises(), script.goal());
        List<ProofReport.Outcome> outcomes = new ArrayList<>();

        for (Directive directive : script.directives()) {
            try {
                state = execute(state, directive);
                ProofStep added = state.currentSteps().get(state.currentSteps().size() - 1);
                outcomes.add(new ProofReport.Outcome(directive, added, null));
            } catch (RuleException e) {
                LOGGER.warning("Riga " + directive.lineNumber() + " rifiutata: " + e.getMessage());
                outcomes.add(new ProofReport.Outcome(directive, null, e));
            }
        }

        ProofReport report = new ProofReport(state, outcomes);
        LOGGER.info("Prova eseguita: " + report.acceptedCount() + "/" + outcomes.size()
                + " direttive accettate, obiettivo " + (report.isGoalAchieved() ? "raggiunto" : "non raggiunto"));
        return report;
    }

    private ProofState execute(ProofState state, Directive directive) {
        if (directive instanceof Directive.Assume assume) {
            return state.withAssumption(assume.formula());
        }
        if (directive instanceof Directive.Apply apply) {
            return engine.applyRule(state, apply.rule(), apply.stepIds(), apply.secondaryFormula());
        }
        throw new IllegalStateException("Direttiva non gestita: " + directive);
    }
}
