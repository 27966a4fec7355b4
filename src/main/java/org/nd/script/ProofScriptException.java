package org.nd.script;

/**
 * Script di prova non valido: direttiva sconosciuta, campi mancanti, formula illeggibile.
 */
public class ProofScriptException extends RuntimeException {

    private final int lineNumber;

    public ProofScriptException(String message, int lineNumber) {
        super(lineNumber > 0 ? "riga " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public ProofScriptException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "riga " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return riga (1-based) che ha causato l'errore, 0 se l'errore riguarda l'intero script
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
