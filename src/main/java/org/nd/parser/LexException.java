package org.nd.parser;

/**
 * Errore lessicale: un carattere non appartiene al linguaggio delle formule.
 */
public class LexException extends FormulaSyntaxException {

    public enum Kind {
        UNRECOGNIZED_CHARACTER,     // carattere fuori dall'alfabeto
        INVALID_OPERATOR_SEQUENCE   // '-' non seguito da '>'
    }

    private final Kind kind;
    private final String character;

    public LexException(Kind kind, String character, int position) {
        super(buildMessage(kind, character, position), position);
        this.kind = kind;
        this.character = character;
    }

    private static String buildMessage(Kind kind, String character, int position) {
        return switch (kind) {
            case UNRECOGNIZED_CHARACTER ->
                    "Carattere non riconosciuto '" + character + "' in posizione " + position;
            case INVALID_OPERATOR_SEQUENCE ->
                    "Operatore non valido '" + character + "' in posizione " + position + " (atteso '->')";
        };
    }

    public Kind getKind() {
        return kind;
    }

    public String getCharacter() {
        return character;
    }
}
