package org.nd.parser;

/**
 * Unità minima prodotta dal lexer.
 *
 * @param type tipo del token
 * @param value testo sorgente del token (vuoto per EOF)
 * @param position offset (in code point) del primo carattere nel testo sorgente
 */
public record Token(TokenType type, String value, int position) {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("Tipo di token non può essere null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Valore del token non può essere null");
        }
    }

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position);
    }

    /**
     * Descrizione leggibile per i messaggi di errore.
     */
    public String describe() {
        return type == TokenType.EOF ? "fine della formula" : "'" + value + "'";
    }
}
