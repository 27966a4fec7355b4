package org.nd.script;

import org.nd.formula.Formula;
import org.nd.parser.FormulaReader;
import org.nd.parser.FormulaSyntaxException;
import org.nd.proof.RuleName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * SCRIPT DI PROVA - Descrizione testuale di una sessione di prova
 *
 * Una direttiva per riga, campi separati da '|'. Righe vuote e righe che iniziano
 * con '#' vengono ignorate.
 *
 * DIRETTIVE:
 * - PREMISE|formula          premessa (tutte prima della prima ASSUME/APPLY)
 * - GOAL|formula             obiettivo (esattamente uno)
 * - ASSUME|formula           aggiunge un'assunzione
 * - APPLY|regola|id,id[|f]   applica una regola; f è la formula secondaria per DI
 *
 * ESEMPIO:
 * <pre>
 * PREMISE|P -> Q
 * PREMISE|P
 * GOAL|Q
 * APPLY|MP|1,2
 * </pre>
 *
 * @param premises formule delle premesse, in ordine
 * @param goal formula obiettivo
 * @param directives direttive da eseguire, in ordine
 */
public record ProofScript(List<Formula> premises, Formula goal, List<Directive> directives) {

    private static final Logger LOGGER = Logger.getLogger(ProofScript.class.getName());

    private static final String FIELD_SEPARATOR = "\\|";
    private static final String COMMENT_PREFIX = "#";

    public ProofScript {
        if (goal == null) {
            throw new IllegalArgumentException("Formula obiettivo non può essere null");
        }
        premises = List.copyOf(premises);
        directives = List.copyOf(directives);
    }

    /**
     * Legge uno script di prova dal suo contenuto testuale.
     *
     * @param content testo dello script
     * @return script validato, con tutte le formule già analizzate
     * @throws ProofScriptException alla prima riga non valida o se manca l'obiettivo
     */
    public static ProofScript parse(String content) {
        if (content == null) {
            throw new IllegalArgumentException("Contenuto dello script non può essere null");
        }

        List<Formula> premises = new ArrayList<>();
        List<Directive> directives = new ArrayList<>();
        Formula goal = null;

        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            String[] fields = line.split(FIELD_SEPARATOR, -1);
            String keyword = fields[0].strip().toUpperCase(Locale.ROOT);

            switch (keyword) {
                case "PREMISE" -> {
                    if (!directives.isEmpty()) {
                        throw new ProofScriptException("le premesse devono precedere ASSUME e APPLY", lineNumber);
                    }
                    requireFieldCount(fields, 2, 2, keyword, lineNumber);
                    premises.add(readFormula(fields[1], lineNumber));
                }
                case "GOAL" -> {
                    if (goal != null) {
                        throw new ProofScriptException("obiettivo già definito", lineNumber);
                    }
                    requireFieldCount(fields, 2, 2, keyword, lineNumber);
                    goal = readFormula(fields[1], lineNumber);
                }
                case "ASSUME" -> {
                    requireFieldCount(fields, 2, 2, keyword, lineNumber);
                    directives.add(new Directive.Assume(lineNumber, readFormula(fields[1], lineNumber)));
                }
                case "APPLY" -> {
                    requireFieldCount(fields, 3, 4, keyword, lineNumber);
                    RuleName rule = readRule(fields[1], lineNumber);
                    List<Integer> stepIds = readStepIds(fields[2], lineNumber);
                    Formula secondary = fields.length == 4 ? readFormula(fields[3], lineNumber) : null;
                    directives.add(new Directive.Apply(lineNumber, rule, stepIds, secondary));
                }
                default -> throw new ProofScriptException("direttiva sconosciuta: " + fields[0].strip(), lineNumber);
            }
        }

        if (goal == null) {
            throw new ProofScriptException("direttiva GOAL mancante", 0);
        }

        LOGGER.fine("Script letto: " + premises.size() + " premesse, " + directives.size() + " direttive");
        return new ProofScript(premises, goal, directives);
    }

    //region LETTURA DEI CAMPI

    private static void requireFieldCount(String[] fields, int min, int max, String keyword, int lineNumber) {
        if (fields.length < min || fields.length > max) {
            String expected = min == max ? String.valueOf(min - 1) : (min - 1) + "-" + (max - 1);
            throw new ProofScriptException(keyword + " richiede " + expected + " argomenti, trovati "
                    + (fields.length - 1), lineNumber);
        }
    }

    private static Formula readFormula(String text, int lineNumber) {
        try {
            return FormulaReader.parseFormula(text.strip());
        } catch (FormulaSyntaxException e) {
            throw new ProofScriptException("formula non valida '" + text.strip() + "': " + e.getMessage(),
                    lineNumber, e);
        }
    }

    private static RuleName readRule(String text, int lineNumber) {
        try {
            return RuleName.valueOf(text.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProofScriptException("regola sconosciuta: " + text.strip(), lineNumber, e);
        }
    }

    private static List<Integer> readStepIds(String text, int lineNumber) {
        List<Integer> ids = new ArrayList<>();
        if (text.isBlank()) {
            return ids;
        }
        for (String part : text.split(",")) {
            try {
                ids.add(Integer.parseInt(part.strip()));
            } catch (NumberFormatException e) {
                throw new ProofScriptException("id di passo non valido: '" + part.strip() + "'", lineNumber, e);
            }
        }
        return ids;
    }

    //endregion
}
