package org.nd;

import org.nd.script.ProofReport;
import org.nd.script.ProofScript;
import org.nd.script.ProofScriptException;
import org.nd.script.ProofScriptRunner;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * VERIFICATORE DI PROVE IN DEDUZIONE NATURALE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: script di prova (.proof) con premesse, obiettivo e direttive
 * 2. PARSING: lettura delle formule (ANTLR) e validazione dello script
 * 3. VERIFICA: applicazione delle regole di inferenza tramite il motore delle regole
 * 4. OUTPUT: report con i passi accettati, gli errori e l'esito rispetto all'obiettivo
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): verifica di un singolo script
 * - Directory batch (-d): verifica di tutti i file .proof di una cartella
 * - Output directory personalizzabile (-o directory)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: un file .result per ogni script elaborato
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";

    static final String DEFAULT_OUTPUT_DIR = "output";
    static final String RESULT_DIR = "RESULT";
    static final String SCRIPT_EXTENSION = ".proof";
    static final String RESULT_EXTENSION = ".result";

    private static final String LOGGING_CONFIG = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue il verificatore e restituisce il codice di uscita.
     *
     * FLUSSO ESECUZIONE:
     * 1. Configurazione del logging
     * 2. Parsing e validazione parametri
     * 3. Elaborazione file singolo o directory
     *
     * @param args parametri linea di comando
     * @return 0 se l'elaborazione è terminata senza errori, 1 altrimenti
     */
    static int run(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO VERIFICATORE DI PROVE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return 1;
            }

            CheckerConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                System.out.println("Usa -h per visualizzare l'help completo.");
                return 1;
            }
            if (config == null) {
                return 0; // Help mostrato
            }

            BatchResult result = config.isFileMode
                    ? processFiles(List.of(new File(config.inputPath)), config)
                    : processDirectory(config);
            return result.errorCount == 0 ? 0 : 1;

        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di accesso ai file", e);
            System.out.println("[E] Errore critico: " + e.getMessage());
            return 1;
        } finally {
            System.out.println("---> FINE ESECUZIONE VERIFICATORE <---");
        }
    }

    /**
     * Carica la configurazione di logging dal classpath, se non ne è stata indicata
     * una tramite la proprietà di sistema standard.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE

    private static BatchResult processDirectory(CheckerConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> scripts = findAllScripts(config.inputPath);
        if (scripts.isEmpty()) {
            System.out.println("[W] Nessun file " + SCRIPT_EXTENSION + " trovato nella directory specificata.");
        }
        BatchResult result = processFiles(scripts, config);
        displayBatchSummary(result);
        return result;
    }

    /**
     * Trova tutti gli script di prova nella directory, in ordine di nome.
     */
    private static List<File> findAllScripts(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            return paths
                    .filter(path -> path.toString().toLowerCase().endsWith(SCRIPT_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
        }
    }

    /**
     * Elabora i file in sequenza. Gli errori su un singolo file non interrompono
     * l'elaborazione degli altri.
     */
    private static BatchResult processFiles(List<File> files, CheckerConfiguration config) throws IOException {
        BatchResult result = new BatchResult(files.size());
        Path resultDir = Paths.get(config.outputPath).resolve(RESULT_DIR);
        Files.createDirectories(resultDir);

        ProofScriptRunner runner = new ProofScriptRunner();
        for (File file : files) {
            System.out.println("Elaborazione: " + file.getName());
            try {
                ProofScript script = ProofScript.parse(Files.readString(file.toPath(), StandardCharsets.UTF_8));
                ProofReport report = runner.run(script);

                Path output = resultDir.resolve(getBaseFileName(file.getName()) + RESULT_EXTENSION);
                Files.writeString(output, report.render(), StandardCharsets.UTF_8);

                System.out.println("[I] Obiettivo " + (report.isGoalAchieved() ? "raggiunto" : "non raggiunto")
                        + ", report salvato: " + output);
                result.incrementSuccess();
            } catch (ProofScriptException | IOException e) {
                LOGGER.log(Level.WARNING, "Script non elaborato: " + file, e);
                System.out.println("[E] Errore nel file " + file.getName() + ": " + e.getMessage());
                result.incrementError();
            }
        }
        return result;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Script trovati: " + result.totalFiles);
        System.out.println("Script elaborati con successo: " + result.successCount);
        System.out.println("Script con errori: " + result.errorCount);
        System.out.println("=========================================\n");
    }

    private static String getBaseFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> VERIFICATORE DI PROVE IN DEDUZIONE NATURALE <<::\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar deduzione-naturale.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file>       Verifica un singolo script di prova");
        System.out.println("  -d <directory>  Verifica tutti i file " + SCRIPT_EXTENSION + " in una directory");
        System.out.println("  -o <directory>  Directory di output (default: " + DEFAULT_OUTPUT_DIR + ")");
        System.out.println("  -h              Mostra questo messaggio\n");

        System.out.println("FORMATO SCRIPT (una direttiva per riga, '#' per i commenti):");
        System.out.println("  PREMISE|P -> Q");
        System.out.println("  GOAL|Q");
        System.out.println("  ASSUME|P");
        System.out.println("  APPLY|MP|1,2");
        System.out.println("  APPLY|DI_LEFT|3|R\n");

        System.out.println("REGOLE: MP, CI, CE_LEFT, CE_RIGHT, DN, DI_LEFT, DI_RIGHT, DS, II");
    }

    //endregion

    //region CLASSI DI SUPPORTO

    private static final class CheckerConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;

        CheckerConfiguration(String inputPath, String outputPath, boolean isFileMode) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    private static final class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        CheckerConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = DEFAULT_OUTPUT_DIR;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        if (!new File(inputPath).isFile()) {
                            throw new IllegalArgumentException("File non esistente: " + inputPath);
                        }
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        File dir = new File(inputPath);
                        if (!dir.isDirectory() || !dir.canRead()) {
                            throw new IllegalArgumentException("Directory non esistente o non leggibile: " + inputPath);
                        }
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare un file (-f) o una directory (-d)");
            }
            return new CheckerConfiguration(inputPath, outputPath, isFileMode);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int index, String paramName) {
            if (index >= args.length || args[index].startsWith("-")) {
                throw new IllegalArgumentException("Parametro " + paramName + " richiede un valore");
            }
            return args[index];
        }
    }

    private static final class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() {
            successCount++;
        }

        void incrementError() {
            errorCount++;
        }
    }

    //endregion
}
