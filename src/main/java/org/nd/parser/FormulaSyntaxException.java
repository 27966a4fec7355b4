package org.nd.parser;

/**
 * Radice comune degli errori di lettura di una formula (lessicali e sintattici).
 */
public abstract class FormulaSyntaxException extends RuntimeException {

    private final int position;

    protected FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return offset nel testo sorgente in cui l'errore è stato rilevato
     */
    public int getPosition() {
        return position;
    }
}
