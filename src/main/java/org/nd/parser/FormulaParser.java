package org.nd.parser;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.nd.antlr.PropositionalFormulaParser;
import org.nd.formula.Formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * PARSER FORMULE - Sequenza di token -> albero {@link Formula}
 *
 * Discesa ricorsiva generata da ANTLR sulla scala di precedenze della grammatica
 * PropositionalFormula (dalla più forte alla più debole):
 * 1. Unario: ¬A (ricorsivo, quindi ¬¬A = ¬(¬A)), (A), proposizione
 * 2. Congiunzione: catena associativa a sinistra
 * 3. Disgiunzione: catena associativa a sinistra
 * 4. Implicazione: associativa a destra, P → Q → R = P → (Q → R)
 *
 * GESTIONE ERRORI:
 * Strategia "bail": il primo errore interrompe il parsing senza tentativi di recupero.
 * L'errore viene classificato in base ai token attesi nel punto di fallimento:
 * - ')' attesa -> MISSING_CLOSE_PAREN
 * - EOF atteso -> TRAILING_INPUT
 * - altrimenti -> UNEXPECTED_TOKEN
 *
 * LIMITE DI ANNIDAMENTO:
 * Parser e visitor sono ricorsivi: prima del parsing la profondità di annidamento
 * (negazioni, parentesi, catene di implicazioni) viene stimata e oltre
 * {@link #MAX_NESTING_DEPTH} livelli la formula è rifiutata con NESTING_TOO_DEEP.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Massima profondità di annidamento accettata.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    private static final Pattern PROPOSITION_NAME = Pattern.compile("[A-Z]");

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Costruisce l'albero della formula a partire dai token.
     *
     * @param tokens sequenza prodotta da {@link FormulaLexer#tokenize(String)}, terminata da EOF
     * @return formula corrispondente
     * @throws ParseException se la sequenza non è una formula ben costruita o è annidata
     *                        oltre {@link #MAX_NESTING_DEPTH} livelli
     * @throws IllegalArgumentException se la sequenza è vuota, non contiene esattamente un EOF
     *                                  in coda o contiene proposizioni che non sono una lettera maiuscola
     */
    public static Formula parse(List<Token> tokens) {
        validateTokenSequence(tokens);
        checkNestingDepth(tokens);

        PropositionalFormulaParser parser = new PropositionalFormulaParser(
                new CommonTokenStream(new ListTokenSource(toAntlrTokens(tokens))));
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        PropositionalFormulaParser.FormulaContext tree;
        try {
            tree = parser.formula();
        } catch (ParseCancellationException e) {
            throw classifyError(e, tokens);
        }

        Formula formula = new FormulaTreeBuilder().visit(tree);
        LOGGER.finest("Albero costruito: " + formula);
        return formula;
    }

    //region CONVERSIONE TOKEN

    private static void validateTokenSequence(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Sequenza di token non può essere null o vuota");
        }
        if (tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Sequenza di token deve terminare con EOF");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.EOF) {
                throw new IllegalArgumentException("EOF in posizione " + token.position()
                        + " seguito da altri token: la sequenza deve contenere un solo EOF finale");
            }
            if (token.type() == TokenType.PROPOSITION && !PROPOSITION_NAME.matcher(token.value()).matches()) {
                throw new IllegalArgumentException("Proposizione non valida '" + token.value()
                        + "' in posizione " + token.position() + ": attesa una lettera maiuscola");
            }
        }
    }

    /**
     * Stima la profondità di ricorsione richiesta dal parsing.
     *
     * Ogni parentesi aperta e ogni implicazione (associativa a destra) aggiunge un livello
     * che resta attivo fino alla chiusura della parentesi corrente; le negazioni consecutive
     * aggiungono un livello ciascuna fino all'operando.
     */
    private static void checkNestingDepth(List<Token> tokens) {
        Deque<Integer> openGroups = new ArrayDeque<>();
        int depth = 0;
        int pendingNegations = 0;

        for (Token token : tokens) {
            switch (token.type()) {
                case NOT -> pendingNegations++;
                case LEFT_PAREN -> {
                    openGroups.push(depth);
                    depth += pendingNegations + 1;
                    pendingNegations = 0;
                }
                case RIGHT_PAREN -> {
                    if (!openGroups.isEmpty()) {
                        depth = openGroups.pop();
                    }
                }
                case IMPLIES -> depth++;
                case PROPOSITION -> pendingNegations = 0;
                default -> {
                    // ∧, ∨ ed EOF non cambiano la profondità
                }
            }
            if (depth + pendingNegations > MAX_NESTING_DEPTH) {
                LOGGER.fine("Formula oltre il limite di annidamento su " + token.describe());
                throw new ParseException(ParseException.Kind.NESTING_TOO_DEEP, token);
            }
        }
    }

    /**
     * Converte i token del progetto in token ANTLR. L'indice di ogni token ANTLR
     * coincide con la posizione nella lista originale.
     */
    private static List<CommonToken> toAntlrTokens(List<Token> tokens) {
        List<CommonToken> antlrTokens = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            CommonToken antlrToken = new CommonToken(token.type().antlrType(), token.value());
            antlrToken.setStartIndex(token.position());
            antlrToken.setStopIndex(token.position() + token.value().length() - 1);
            antlrTokens.add(antlrToken);
            if (token.type() == TokenType.EOF) {
                break;
            }
        }
        return antlrTokens;
    }

    //endregion

    //region CLASSIFICAZIONE ERRORI

    private static ParseException classifyError(ParseCancellationException cancellation, List<Token> tokens) {
        if (!(cancellation.getCause() instanceof RecognitionException recognition)) {
            throw new IllegalStateException("Interruzione del parsing senza causa sintattica", cancellation);
        }

        Token offending = resolveToken(recognition.getOffendingToken(), tokens);
        IntervalSet expected = recognition.getExpectedTokens();

        ParseException.Kind kind;
        if (expected != null && expected.contains(PropositionalFormulaParser.RIGHT_PAREN)) {
            kind = ParseException.Kind.MISSING_CLOSE_PAREN;
        } else if (expected != null && expected.contains(org.antlr.v4.runtime.Token.EOF)) {
            kind = ParseException.Kind.TRAILING_INPUT;
        } else {
            kind = ParseException.Kind.UNEXPECTED_TOKEN;
        }

        LOGGER.fine("Errore sintattico " + kind + " su " + offending.describe());
        return new ParseException(kind, offending);
    }

    private static Token resolveToken(org.antlr.v4.runtime.Token antlrToken, List<Token> tokens) {
        if (antlrToken == null) {
            return tokens.get(tokens.size() - 1);
        }
        int index = antlrToken.getTokenIndex();
        if (index < 0 || index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    //endregion
}
