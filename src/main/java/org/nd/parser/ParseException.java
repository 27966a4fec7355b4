package org.nd.parser;

/**
 * Errore sintattico: la sequenza di token non forma una formula ben costruita.
 */
public class ParseException extends FormulaSyntaxException {

    public enum Kind {
        UNEXPECTED_TOKEN,       // token che non può iniziare il costrutto atteso
        MISSING_CLOSE_PAREN,    // parentesi aperta senza ')' corrispondente
        TRAILING_INPUT,         // token residui dopo una formula completa
        NESTING_TOO_DEEP        // annidamento oltre FormulaParser.MAX_NESTING_DEPTH
    }

    private final Kind kind;
    private final Token offendingToken;

    public ParseException(Kind kind, Token offendingToken) {
        super(buildMessage(kind, offendingToken), offendingToken.position());
        this.kind = kind;
        this.offendingToken = offendingToken;
    }

    private static String buildMessage(Kind kind, Token token) {
        return switch (kind) {
            case UNEXPECTED_TOKEN -> "Token inatteso " + token.describe() + " in posizione " + token.position();
            case MISSING_CLOSE_PAREN -> "Attesa ')' ma trovato " + token.describe() + " in posizione " + token.position();
            case TRAILING_INPUT -> "Token inatteso " + token.describe() + " dopo la fine della formula, in posizione "
                    + token.position();
            case NESTING_TOO_DEEP -> "Formula annidata oltre " + FormulaParser.MAX_NESTING_DEPTH
                    + " livelli, in posizione " + token.position();
        };
    }

    public Kind getKind() {
        return kind;
    }

    public Token getOffendingToken() {
        return offendingToken;
    }
}
