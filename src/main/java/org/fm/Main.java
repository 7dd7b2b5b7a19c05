package org.fm;

import org.fm.analysis.AnalysisReport;
import org.fm.analysis.EnumerationLimits;
import org.fm.analysis.FeatureModelAnalyzer;
import org.fm.analysis.ValidationResult;
import org.fm.constraint.UnsupportedConstraintException;
import org.fm.model.FeatureModel;
import org.fm.model.ModelParseException;
import org.fm.oracle.OracleException;
import org.fm.oracle.OracleKind;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ANALIZZATORE DI FEATURE MODEL
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: feature model XML (albero, gruppi OR/XOR, vincoli cross-tree)
 * 2. PARSING: albero tipizzato e vincoli classificati dalla grammatica ANTLR
 * 3. COMPILAZIONE: clausole CNF con rule log
 * 4. ENUMERAZIONE: prodotti minimi validi tramite SAT oracle (CDCL interno o Sat4j)
 * 5. VALIDAZIONE (opzionale): verifica di una selezione con diagnostica
 * 6. OUTPUT: DIMACS, regole e report completo
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f): analisi di un modello .xml, con eventuale selezione (-s)
 * - Directory batch (-d): analisi di tutti i modelli .xml di una cartella
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - CNF/: formula in formato DIMACS con mapping delle variabili
 * - RULES/: rule log numerato con la clausola di ogni regola
 * - RESULT/: report completo (albero, regole, vincoli, prodotti, validazione)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String DIR_PARAM = "-d";
    static final String OUTPUT_PARAM = "-o";
    static final String TIMEOUT_PARAM = "-t";
    static final String MAX_PARAM = "-max";
    static final String ORACLE_PARAM = "-oracle=";
    static final String SELECTION_PARAM = "-s";
    static final String STRICT_PARAM = "-strict";

    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int MIN_TIMEOUT_SECONDS = 1;

    /** Margine concesso all'enumerazione per chiudersi da sola prima dell'interruzione forzata */
    private static final int GRACE_SECONDS = 2;

    private static final String MODEL_EXTENSION = ".xml";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Coordina parsing dei parametri, scelta della modalità ed elaborazione.
     *
     * @param args parametri da linea di comando
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO ANALIZZATORE FEATURE MODEL <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            AnalyzerConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            if (config.isFileMode) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore critico", e);
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.exit(1);
        } finally {
            System.out.println("---> FINE ESECUZIONE ANALIZZATORE <---");
        }
    }

    private static AnalyzerConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(AnalyzerConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE ANALIZZATORE <<--");
        System.out.println("Input:     " + config.inputPath);
        System.out.println("Output:    " + (config.outputPath != null ? config.outputPath : "stessa directory dell'input"));
        System.out.println("Timeout:   " + config.timeoutSeconds + "s");
        System.out.println("Soluzioni: max " + config.maxSolutions);
        System.out.println("Oracle:    " + config.oracleKind.name().toLowerCase(Locale.ROOT));
        System.out.println("Strict:    " + (config.strict ? "sì" : "no"));
        if (!config.selection.isEmpty()) {
            System.out.println("Selezione: " + String.join(", ", config.selection));
        }
        System.out.println("=====================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Analizza un modello entro il timeout e salva i risultati.
     *
     * @return true se l'analisi è stata completata e salvata
     */
    static boolean processSingleFile(AnalyzerConfiguration config) {
        System.out.println("-->> ELABORAZIONE MODELLO <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        FeatureModelAnalyzer analyzer = new FeatureModelAnalyzer(config.oracleKind,
                EnumerationLimits.of(config.maxSolutions, Duration.ofSeconds(config.timeoutSeconds)), config.strict);

        try {
            FeatureModel model = analyzer.load(Paths.get(config.inputPath));
            System.out.println("[I] Modello caricato: " + model.size() + " feature, " +
                    model.getConstraints().size() + " vincoli");

            AnalysisOutcome outcome = executeAnalysisWithTimeout(analyzer, model, config);
            if (outcome == null) {
                saveTimeoutReport(config);
                return false;
            }

            saveResults(outcome, config);
            displayOutcome(outcome);
            return true;

        } catch (ModelParseException e) {
            System.out.println("[E] Modello non valido: " + e.getMessage());
        } catch (UnsupportedConstraintException e) {
            System.out.println("[E] Vincolo non supportato in modalità strict: \"" + e.getConstraintText() +
                    "\" (" + e.getMessage() + ")");
        } catch (OracleException e) {
            System.out.println("[E] Errore del SAT oracle: " + e.getMessage());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di scrittura dei risultati", e);
            System.out.println("[E] Impossibile salvare i risultati: " + e.getMessage());
        }
        return false;
    }

    /**
     * Esegue analisi e validazione in un thread dedicato, interrotto allo scadere del
     * timeout più un margine.
     *
     * @return esito o null se il tempo è scaduto
     */
    private static AnalysisOutcome executeAnalysisWithTimeout(FeatureModelAnalyzer analyzer, FeatureModel model,
                                                              AnalyzerConfiguration config) {
        System.out.println("Analisi con oracle " + config.oracleKind.name().toLowerCase(Locale.ROOT) +
                " (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Callable<AnalysisOutcome> task = () -> {
                AnalysisReport report = analyzer.analyze(model);
                ValidationResult validation = config.selection.isEmpty()
                        ? null
                        : analyzer.validate(model, config.selection);
                return new AnalysisOutcome(report, validation);
            };
            Future<AnalysisOutcome> future = executor.submit(task);
            return future.get(config.timeoutSeconds + GRACE_SECONDS, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Analisi fallita", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Analisi interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void displayOutcome(AnalysisOutcome outcome) {
        AnalysisReport report = outcome.report;
        System.out.println("[I] Analisi completata in " + report.getElapsedMs() + "ms");
        System.out.println();
        System.out.print(report.renderTree());
        System.out.println();
        if (report.getProducts().isEmpty()) {
            System.out.println("[W] Nessun prodotto valido: il modello è insoddisfacibile");
        } else {
            System.out.print(report.renderProducts());
        }
        if (!report.getUnsupportedConstraints().isEmpty()) {
            System.out.println("[W] Vincoli non supportati: " + report.getUnsupportedConstraints().size());
        }
        if (report.isTruncated()) {
            System.out.println("[W] Enumerazione troncata: " + report.getEnumeration().getTruncationReason());
        }
        if (outcome.validation != null) {
            System.out.println(outcome.validation.isValid()
                    ? "[I] Selezione valida"
                    : "[I] Selezione non valida:\n  - " + String.join("\n  - ", outcome.validation.getMessages()));
            if (!outcome.validation.getIgnoredNames().isEmpty()) {
                System.out.println("[W] Feature sconosciute ignorate: " +
                        String.join(", ", outcome.validation.getIgnoredNames()));
            }
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(AnalyzerConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<File> models = findAllModelFiles(config.inputPath);
            if (models.isEmpty()) {
                System.out.println("[W] Nessun file " + MODEL_EXTENSION + " trovato nella directory specificata.");
                return;
            }

            int success = 0;
            for (File file : models) {
                System.out.println("Elaborazione: " + file.getName());
                try {
                    if (processSingleFile(config.forFile(file))) {
                        success++;
                    }
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, "Errore inatteso su " + file.getName(), e);
                    System.out.println("[E] Errore durante l'elaborazione di " + file.getName() + ": " + e.getMessage());
                }
                System.out.println();
            }
            displayBatchSummary(models.size(), success);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    static List<File> findAllModelFiles(String dirPath) throws IOException {
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(MODEL_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        }
    }

    private static void displayBatchSummary(int total, int success) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Modelli trovati: " + total);
        System.out.println("Modelli analizzati con successo: " + success);
        System.out.println("Modelli con errori: " + (total - success));
        System.out.printf("Tasso di successo: %.1f%%%n", (double) success / total * 100);
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void saveResults(AnalysisOutcome outcome, AnalyzerConfiguration config) throws IOException {
        AnalysisReport report = outcome.report;
        writeOutput(config, "CNF", ".cnf", report.toDimacs());
        writeOutput(config, "RULES", ".rules", report.renderRules());

        StringBuilder result = new StringBuilder(report.toText());
        if (outcome.validation != null) {
            result.append("===================================[ SELEZIONE ]===================================\n");
            result.append("    Feature:  ").append(String.join(", ", config.selection)).append('\n');
            result.append("    Esito:    ").append(outcome.validation.isValid() ? "VALIDA" : "NON VALIDA").append('\n');
            for (String message : outcome.validation.getMessages()) {
                result.append("    - ").append(message).append('\n');
            }
            if (!outcome.validation.getIgnoredNames().isEmpty()) {
                result.append("    Ignorate: ").append(String.join(", ", outcome.validation.getIgnoredNames()))
                        .append('\n');
            }
        }
        writeOutput(config, "RESULT", ".result", result.toString());
    }

    private static void saveTimeoutReport(AnalyzerConfiguration config) {
        String content = "TIMEOUT\n" +
                "Analisi non completata entro " + config.timeoutSeconds + " secondi\n" +
                "Modello: " + Paths.get(config.inputPath).getFileName() + "\n";
        try {
            writeOutput(config, "RESULT", ".result", content);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Impossibile salvare il report di timeout", e);
            System.out.println("[E] Impossibile salvare il report di timeout: " + e.getMessage());
        }
    }

    private static void writeOutput(AnalyzerConfiguration config, String dirName, String extension,
                                    String content) throws IOException {
        Path outputDir = getOutputDirectory(config, dirName);
        Files.createDirectories(outputDir);

        Path outputFile = outputDir.resolve(getBaseFileName(config.inputPath) + extension);
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
        System.out.println("[I] " + dirName + " salvato: " + outputFile);
    }

    static Path getOutputDirectory(AnalyzerConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> ANALIZZATORE FEATURE MODEL <<::");
        System.out.println("Compilazione CNF, prodotti minimi validi e validazione di selezioni\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar analizzatore-feature-model.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file.xml>     Analizza un singolo modello");
        System.out.println("  -d <directory>    Analizza tutti i modelli .xml di una directory");
        System.out.println("  -o <directory>    Directory di output (default: stessa dell'input)");
        System.out.println("  -t <secondi>      Timeout per modello (min: " + MIN_TIMEOUT_SECONDS +
                ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -max <n>          Numero massimo di soluzioni enumerate (default: " +
                EnumerationLimits.DEFAULT_MAX_SOLUTIONS + ")");
        System.out.println("  -oracle=<tipo>    SAT oracle: cdcl (default) o sat4j");
        System.out.println("  -s <A,B,...>      Valida una selezione di feature (solo con -f)");
        System.out.println("  -strict           Rifiuta i modelli con vincoli cross-tree non supportati");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("VINCOLI CROSS-TREE RICONOSCIUTI:");
        System.out.println("  A requires B | A implies B | A -> B | B is required by A     → Requires(A, B)");
        System.out.println("  A excludes B | A -> !B | A and B are mutually exclusive      → Excludes(A, B)");
        System.out.println("  A is incompatible with B | !(A & B)                          → Excludes(A, B)\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar analizzatore-feature-model.jar -f modello.xml");
        System.out.println("  java -jar analizzatore-feature-model.jar -f modello.xml -s Root,A,B");
        System.out.println("  java -jar analizzatore-feature-model.jar -d ./modelli/ -o ./out/ -oracle=sat4j -t 30\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  CNF/      Formula DIMACS con mapping delle variabili");
        System.out.println("  RULES/    Regole leggibili, una per clausola");
        System.out.println("  RESULT/   Report completo dell'analisi\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata e immutabile dell'applicazione.
     */
    static final class AnalyzerConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final int maxSolutions;
        final OracleKind oracleKind;
        final List<String> selection;
        final boolean strict;

        AnalyzerConfiguration(String inputPath, String outputPath, boolean isFileMode, int timeoutSeconds,
                              int maxSolutions, OracleKind oracleKind, List<String> selection, boolean strict) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.maxSolutions = maxSolutions;
            this.oracleKind = oracleKind;
            this.selection = List.copyOf(selection);
            this.strict = strict;
        }

        /**
         * @return configurazione per un singolo modello della directory batch
         */
        AnalyzerConfiguration forFile(File file) {
            return new AnalyzerConfiguration(file.getAbsolutePath(), outputPath, true, timeoutSeconds,
                    maxSolutions, oracleKind, List.of(), strict);
        }
    }

    /**
     * Parser dei parametri da linea di comando con messaggi di errore per l'utente.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        AnalyzerConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int maxSolutions = EnumerationLimits.DEFAULT_MAX_SOLUTIONS;
            OracleKind oracleKind = OracleKind.CDCL;
            List<String> selection = new ArrayList<>();
            boolean strict = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parsePositiveInt(
                            getNextArgument(args, ++i, "numero secondi"), MIN_TIMEOUT_SECONDS, "timeout");
                    case MAX_PARAM -> maxSolutions = parsePositiveInt(
                            getNextArgument(args, ++i, "numero soluzioni"), 1, "numero massimo di soluzioni");
                    case SELECTION_PARAM -> selection = parseSelection(getNextArgument(args, ++i, "lista di feature"));
                    case STRICT_PARAM -> strict = true;
                    default -> {
                        if (args[i].startsWith(ORACLE_PARAM)) {
                            oracleKind = OracleKind.fromName(args[i].substring(ORACLE_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            if (isFileMode && !inputPath.toLowerCase(Locale.ROOT).endsWith(MODEL_EXTENSION)) {
                throw new IllegalArgumentException("Il modello deve avere estensione " + MODEL_EXTENSION + ": " + inputPath);
            }
            if (!selection.isEmpty() && !isFileMode) {
                throw new IllegalArgumentException("La selezione (-s) è ammessa solo con -f");
            }

            return new AnalyzerConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds, maxSolutions,
                    oracleKind, selection, strict);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositiveInt(String value, int minimum, String description) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < minimum) {
                    throw new IllegalArgumentException("Valore minimo per " + description + ": " + minimum);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + description + ": " + value);
            }
        }

        private List<String> parseSelection(String value) {
            List<String> names = Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .collect(Collectors.toList());
            if (names.isEmpty()) {
                throw new IllegalArgumentException("Selezione vuota");
            }
            return names;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Report di analisi con l'eventuale esito della validazione.
     */
    private static final class AnalysisOutcome {
        final AnalysisReport report;
        final ValidationResult validation;

        AnalysisOutcome(AnalysisReport report, ValidationResult validation) {
            this.report = report;
            this.validation = validation;
        }
    }

    //endregion
}
