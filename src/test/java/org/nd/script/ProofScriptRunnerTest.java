package org.nd.script;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.nd.proof.ProofStep;
import org.nd.proof.RuleException;
import org.nd.proof.RuleName;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.nd.formula.Formula.atom;
import static org.nd.formula.Formula.implies;

class ProofScriptRunnerTest {

    private static final String CONDITIONAL_PROOF = String.join("\n",
            "PREMISE|P -> Q",
            "PREMISE|Q -> R",
            "GOAL|P -> R",
            "ASSUME|P",
            "APPLY|MP|1,3",
            "APPLY|MP|4,2",
            "APPLY|II|3,5");

    private ProofScriptRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ProofScriptRunner();
    }

    @Test
    @DisplayName("Prova condizionale completa: obiettivo raggiunto")
    void conditionalProofReachesGoal() {
        ProofReport report = runner.run(ProofScript.parse(CONDITIONAL_PROOF));
        List<ProofStep> steps = report.finalState().currentSteps();

        assertAll("Esito della prova",
                () -> assertTrue(report.isGoalAchieved()),
                () -> assertEquals(4, report.acceptedCount()),
                () -> assertTrue(report.failures().isEmpty()),
                () -> assertEquals(6, steps.size()),
                () -> assertTrue(steps.get(2).discharged()),
                () -> assertEquals(implies(atom("P"), atom("R")), steps.get(5).formula()),
                () -> assertEquals(List.of(2, 4), steps.get(4).justification())
        );
    }

    @Test
    @DisplayName("Una regola rifiutata viene registrata senza interrompere lo script")
    void rejectedRuleDoesNotStopExecution() {
        ProofScript script = ProofScript.parse(String.join("\n",
                "PREMISE|P ∧ Q",
                "GOAL|Q",
                "APPLY|DN|1",
                "APPLY|CE_RIGHT|7",
                "APPLY|CE_RIGHT|1"));

        ProofReport report = runner.run(script);

        assertAll(
                () -> assertTrue(report.isGoalAchieved()),
                () -> assertEquals(1, report.acceptedCount()),
                () -> assertEquals(2, report.failures().size()),
                () -> assertEquals(RuleException.Kind.PATTERN_MISMATCH,
                        report.failures().get(0).failure().getKind()),
                () -> assertEquals(RuleException.Kind.STEP_NOT_FOUND,
                        report.failures().get(1).failure().getKind()),
                () -> assertEquals(2, report.outcomes().get(2).step().id()),
                () -> assertEquals(3, report.finalState().nextId())
        );
    }

    @Test
    @DisplayName("Report testuale con passi, errori ed esito")
    void rendersReport() {
        ProofScript script = ProofScript.parse(CONDITIONAL_PROOF + "\nAPPLY|ASSUME|");
        String text = runner.run(script).render();

        assertAll("Sezioni del report",
                () -> assertTrue(text.contains("=== PROVA ===")),
                () -> assertTrue(text.contains("Premesse: (P → Q), (Q → R)")),
                () -> assertTrue(text.contains("Obiettivo: (P → R)")),
                () -> assertTrue(text.contains("(scaricata)")),
                () -> assertTrue(text.contains(RuleName.II + " [3, 5]")),
                () -> assertTrue(text.contains("=== ERRORI ===")),
                () -> assertTrue(text.contains("riga 8")),
                () -> assertTrue(text.contains("Obiettivo raggiunto: SÌ")),
                () -> assertTrue(text.contains("Direttive accettate: 4, rifiutate: 1"))
        );
    }

    @Test
    @DisplayName("Senza direttive l'obiettivo dipende solo dalle premesse")
    void noDirectives() {
        ProofReport report = runner.run(ProofScript.parse("PREMISE|P\nGOAL|Q"));
        String text = report.render();

        assertAll(
                () -> assertFalse(report.isGoalAchieved()),
                () -> assertFalse(text.contains("=== ERRORI ===")),
                () -> assertTrue(text.contains("Obiettivo raggiunto: NO"))
        );
    }
}
