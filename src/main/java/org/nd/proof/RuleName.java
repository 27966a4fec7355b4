package org.nd.proof;

/**
 * Regole di inferenza riconosciute, con il numero di passi che ciascuna richiede.
 * ASSUME etichetta solo i passi creati dal chiamante (premesse e assunzioni) e
 * non può essere applicata dal motore.
 */
public enum RuleName {
    MP(2, "Modus Ponens"),
    CI(2, "Introduzione della congiunzione"),
    CE_LEFT(1, "Eliminazione della congiunzione (sinistra)"),
    CE_RIGHT(1, "Eliminazione della congiunzione (destra)"),
    DN(1, "Eliminazione della doppia negazione"),
    DI_LEFT(1, "Introduzione della disgiunzione (sinistra)"),
    DI_RIGHT(1, "Introduzione della disgiunzione (destra)"),
    DS(2, "Sillogismo disgiuntivo"),
    II(2, "Introduzione dell'implicazione"),
    ASSUME(0, "Assunzione");

    private final int arity;
    private final String description;

    RuleName(int arity, String description) {
        this.arity = arity;
        this.description = description;
    }

    /**
     * @return numero esatto di passi da selezionare per applicare la regola
     */
    public int arity() {
        return arity;
    }

    public String description() {
        return description;
    }

    /**
     * @return true se la regola richiede una formula secondaria (disgiunto aggiunto)
     */
    public boolean requiresSecondaryFormula() {
        return this == DI_LEFT || this == DI_RIGHT;
    }
}
