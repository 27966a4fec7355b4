package org.nd.proof;

/**
 * Applicazione di una regola rifiutata. Lo stato della prova passato al motore
 * resta invariato: il chiamante può correggere la selezione e riprovare.
 */
public class RuleException extends RuntimeException {

    public enum Kind {
        ARITY_MISMATCH,             // numero di passi selezionati diverso da quello richiesto
        STEP_NOT_FOUND,             // id selezionato assente dalla prova
        MISSING_SECONDARY_FORMULA,  // DI senza la formula da aggiungere
        PATTERN_MISMATCH,           // i passi non hanno la forma richiesta dalla regola
        UNSUPPORTED_RULE            // regola non applicabile dal motore (ASSUME)
    }

    private final Kind kind;
    private final RuleName rule;

    public RuleException(Kind kind, RuleName rule, String message) {
        super(rule + ": " + message);
        this.kind = kind;
        this.rule = rule;
    }

    public Kind getKind() {
        return kind;
    }

    public RuleName getRule() {
        return rule;
    }
}
