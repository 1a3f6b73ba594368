package org.tableaux;

import org.tableaux.classifier.ClassifierConfiguration;
import org.tableaux.classifier.FormulaClassifier;
import org.tableaux.classifier.Verdict;
import org.tableaux.formula.FormulaParser;
import org.tableaux.formula.FormulaSyntaxException;
import org.tableaux.formula.PropositionalFormula;
import org.tableaux.support.FormulaSymbol;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE DI FORMULE PROPOSIZIONALI CON IL METODO DEI TABLEAUX
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula dal catalogo interno oppure fornita in linea
 * 2. PARSING: Notazione infissa completamente parentesizzata -> albero sintattico (ANTLR)
 * 3. CLASSIFICAZIONE: Tableaux di F(f) e T(f) -> tautologia, contraddizione o contingenza
 * 4. SPIEGAZIONE: Cause minime oppure clausole testimone true-on / false-on
 * 5. OUTPUT: Verdetto, statistiche e, su richiesta, i rami di entrambi i tableaux
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Catalogo (-l): Elenco delle formule d'esempio disponibili
 * - Formula del catalogo (-i): Classificazione della formula con l'indice indicato
 * - Formula in linea (-e): Classificazione di una formula scritta dall'utente
 * - Rami (-b): Stampa dei rami di entrambi i tableaux
 * - Cause al primo livello (-min): Ricerca delle cause fermata alla prima cardinalità utile
 * - Timeout configurabile per evitare elaborazioni troppo dispendiose (-t secondi)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String LIST_PARAM = "-l";
    private static final String INDEX_PARAM = "-i";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String BRANCHES_PARAM = "-b";
    private static final String MIN_CAUSES_PARAM = "-min";
    private static final String TIMEOUT_PARAM = "-t";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        // Glifi ¬ ∧ ∨ → ↔ nel verdetto e nei rami: codifica fissa indipendente dal charset di piattaforma
        System.setOut(utf8Console(new FileOutputStream(FileDescriptor.out)));
        int exitCode = run(args, FormulaCatalog.defaultCatalog());
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intero flusso senza terminare la JVM.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Selezione della formula (catalogo o linea di comando)
     * 3. Classificazione con timeout e stampa del verdetto
     *
     * @param args parametri linea di comando
     * @param catalog catalogo di formule d'esempio
     * @return codice di uscita (0 successo, 1 input non valido o errore)
     */
    static int run(String[] args, FormulaCatalog catalog) {
        System.out.println("---> AVVIO CLASSIFICATORE TABLEAUX <---");

        try {
            if (args == null || args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_ERROR;
            }

            DriverConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                System.out.println("Usa -h per visualizzare l'help completo.");
                return EXIT_ERROR;
            }
            if (config == null) return EXIT_OK; // Help mostrato

            return executeMainPipeline(config, catalog);

        } catch (Exception e) {
            return handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE CLASSIFICATORE <---");
        }
    }

    private static int executeMainPipeline(DriverConfiguration config, FormulaCatalog catalog) {
        if (config.mode == DriverMode.LIST) {
            printCatalog(catalog);
            return EXIT_OK;
        }

        String text;
        if (config.mode == DriverMode.CATALOG) {
            FormulaCatalog.Entry entry;
            try {
                entry = catalog.get(config.catalogIndex);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] " + e.getMessage());
                return EXIT_ERROR;
            }
            System.out.println("[I] Formula del catalogo: " + entry.getName());
            text = entry.getFormula();
        } else {
            text = config.expression;
        }

        PropositionalFormula formula;
        try {
            formula = FormulaParser.parse(text);
        } catch (FormulaSyntaxException e) {
            System.out.println("[E] Formula non valida: " + text);
            System.out.println("    " + e.getMessage());
            return EXIT_ERROR;
        }

        processFormula(formula, config);
        return EXIT_OK;
    }

    /**
     * @param out flusso di destinazione
     * @return stream con auto-flush che codifica sempre in UTF-8
     */
    static PrintStream utf8Console(OutputStream out) {
        return new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    /**
     * Gestisce errori critici dell'applicazione.
     *
     * @param e eccezione critica che ha causato il fallimento
     * @return codice di uscita di errore
     */
    private static int handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        return EXIT_ERROR;
    }

    //endregion

    //region CLASSIFICAZIONE

    /**
     * Classifica la formula e stampa il verdetto. Un timeout interrompe solo
     * questa formula e non è considerato un errore.
     */
    private static void processFormula(PropositionalFormula formula, DriverConfiguration config) {
        System.out.println("\n-->> FORMULA <<--");
        System.out.println("Infissa:   " + formula);
        System.out.println("Atomi:     " + formula.atoms());
        System.out.println("Connettivi: " + formula.size() + ", profondità: " + formula.depth());

        ClassificationOutcome outcome = executeClassificationWithTimeout(formula, config);
        if (outcome == null) {
            System.out.println("[W] Classificazione interrotta: nessun verdetto per " + formula);
            return;
        }

        System.out.println("\n-->> VERDETTO <<--");
        System.out.println(outcome.verdict());

        if (outcome.tableaux() != null) {
            System.out.println("\n-->> TABLEAU F(f) <<--");
            System.out.println(outcome.tableaux().getFalseTableaux());
            System.out.println("\n-->> TABLEAU T(f) <<--");
            System.out.println(outcome.tableaux().getTrueTableaux());
        }
    }

    /**
     * Esegue la classificazione con controllo del timeout.
     *
     * Utilizza ExecutorService per controllo temporale e interruzione
     * del classificatore in caso di superamento del timeout configurato:
     * shutdownNow() interrompe il thread di lavoro e il costruttore del tableau
     * abbandona la costruzione in corso al ramo successivo.
     *
     * @return esito della classificazione o null se timeout
     */
    private static ClassificationOutcome executeClassificationWithTimeout(PropositionalFormula formula,
                                                                         DriverConfiguration config) {
        System.out.println("\nClassificazione con tableaux (timeout: " + config.timeoutSeconds + "s)...");

        ClassifierConfiguration classifierConfig = ClassifierConfiguration.defaults()
                .withFirstCauseLevelOnly(config.firstCauseLevelOnly);
        FormulaClassifier classifier = new FormulaClassifier(classifierConfig);

        // Thread daemon: un tableau molto grande non deve trattenere la JVM in chiusura
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tableaux-classifier");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Callable<ClassificationOutcome> task = () -> new ClassificationOutcome(
                    classifier.classify(formula),
                    config.printBranches ? classifier.tableaux(formula) : null);
            Future<ClassificationOutcome> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Classificazione interrotta", e);
        } catch (ExecutionException e) {
            System.out.println("[E] Errore durante la classificazione: " + e.getCause());
            throw new IllegalStateException("Errore nella classificazione", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printCatalog(FormulaCatalog catalog) {
        System.out.println("\n-->> CATALOGO FORMULE <<--");
        List<FormulaCatalog.Entry> entries = catalog.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            System.out.printf("  %2d. %s%n", i, entries.get(i).getName());
            System.out.println("      " + entries.get(i).getFormula());
        }
        System.out.println();
    }

    /**
     * Visualizza l'help completo dell'applicazione.
     */
    private static void printApplicationHelp() {
        System.out.println("\n::>> CLASSIFICATORE TABLEAUX <<::");
        System.out.println("Classifica formule proposizionali come tautologie, contraddizioni");
        System.out.println("o contingenze con il metodo dei tableaux analitici\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar tableaux-prover.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -l              Elenca le formule del catalogo");
        System.out.println("  -i <indice>     Classifica la formula del catalogo con l'indice indicato");
        System.out.println("  -e <formula>    Classifica una formula fornita in linea");
        System.out.println("  -b              Stampa anche i rami dei tableaux F(f) e T(f)");
        System.out.println("  -min            Cause minime limitate alla prima cardinalità utile");
        System.out.println("  -t <secondi>    Timeout per la classificazione (min: 1, default: 10)");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("SINTASSI DELLE FORMULE:");
        for (FormulaSymbol symbol : FormulaSymbol.values()) {
            if (symbol.isConnective()) {
                System.out.printf("  %-15s %s%n", connectiveLabel(symbol) + ":", String.join("  ", symbol.getSpellings()));
            }
        }
        System.out.println("  Parentesi:      ( )  [ ]  { }");
        System.out.println("  Ogni sotto-formula composta va racchiusa tra parentesi, ad eccezione");
        System.out.println("  dell'operatore principale: (a & b) | c è valida, a & b | c no\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar tableaux-prover.jar -l");
        System.out.println("  java -jar tableaux-prover.jar -i 2 -b");
        System.out.println("  java -jar tableaux-prover.jar -e \"((~a) | b) | (c | a)\" -t 30\n");

        System.out.println("===============================================\n");
    }

    private static String connectiveLabel(FormulaSymbol symbol) {
        return switch (symbol) {
            case NOT -> "Negazione";
            case AND -> "Congiunzione";
            case OR -> "Disgiunzione";
            case IMPLIES -> "Implicazione";
            case IFF -> "Equivalenza";
            case ATOM -> "Atomo";
        };
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    private enum DriverMode {
        LIST, CATALOG, EXPRESSION
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class DriverConfiguration {
        final DriverMode mode;
        final int catalogIndex;
        final String expression;
        final boolean printBranches;
        final boolean firstCauseLevelOnly;
        final int timeoutSeconds;

        DriverConfiguration(DriverMode mode, int catalogIndex, String expression,
                            boolean printBranches, boolean firstCauseLevelOnly, int timeoutSeconds) {
            this.mode = mode;
            this.catalogIndex = catalogIndex;
            this.expression = expression;
            this.printBranches = printBranches;
            this.firstCauseLevelOnly = firstCauseLevelOnly;
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -l: Elenco del catalogo (esclusivo con -i e -e)
         * -i <indice>: Formula del catalogo (esclusivo con -l e -e)
         * -e <formula>: Formula in linea (esclusivo con -l e -i)
         * -b: Stampa dei rami
         * -min: Ricerca cause al primo livello
         * -t <sec>: Timeout in secondi
         *
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        DriverConfiguration parse(String[] args) {
            DriverMode mode = null;
            int catalogIndex = -1;
            String expression = null;
            boolean printBranches = false;
            boolean firstCauseLevelOnly = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case LIST_PARAM -> {
                        validateExclusiveMode(mode, DriverMode.LIST);
                        mode = DriverMode.LIST;
                    }
                    case INDEX_PARAM -> {
                        validateExclusiveMode(mode, DriverMode.CATALOG);
                        catalogIndex = parseIndex(getNextArgument(args, ++i, "indice formula"));
                        mode = DriverMode.CATALOG;
                    }
                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode, DriverMode.EXPRESSION);
                        expression = getNextArgument(args, ++i, "formula");
                        mode = DriverMode.EXPRESSION;
                    }
                    case BRANCHES_PARAM -> printBranches = true;
                    case MIN_CAUSES_PARAM -> firstCauseLevelOnly = true;
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare -l, -i <indice> oppure -e <formula>");
            }
            return new DriverConfiguration(mode, catalogIndex, expression, printBranches,
                    firstCauseLevelOnly, timeoutSeconds);
        }

        private void validateExclusiveMode(DriverMode current, DriverMode requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested + " non può essere combinata con "
                        + current + " (-l, -i e -e sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseIndex(String indexStr) {
            try {
                return Integer.parseInt(indexStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Indice formula non valido: " + indexStr);
            }
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }
    }

    /**
     * Verdetto ed eventuali tableaux da stampare.
     */
    private record ClassificationOutcome(Verdict verdict, FormulaClassifier.FormulaTableaux tableaux) {}

    //endregion
}
