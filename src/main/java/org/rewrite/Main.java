package org.rewrite;

import org.rewrite.engine.ProofResult;
import org.rewrite.formula.Axiom;
import org.rewrite.optionalfeatures.ResultWriter;
import org.rewrite.optionalfeatures.StandardAxioms;
import org.rewrite.program.Command;
import org.rewrite.program.ProgramExecutor;
import org.rewrite.program.ProgramLoadException;
import org.rewrite.program.ProgramLoader;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * DIMOSTRATORE EQUAZIONALE - Riscrittura di termini con ricerca BFS limitata
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: programma testuale con comandi axiom / param / prove
 * 2. CARICAMENTO: lexing e parsing ANTLR, tutto-o-niente
 * 3. ESECUZIONE: comandi in ordine, un goal alla volta
 * 4. OUTPUT: percorso di prova più corto per ogni goal, statistiche opzionali su disco
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f): esecuzione di un programma .eq
 * - Directory batch (-d): esecuzione di tutti i file .eq in ordine di nome
 * - Output su disco (-o directory): file RESULT/ e STATS/ per ogni programma
 * - Libreria standard (-std): precarica gli assiomi dell'algebra di Boole
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String DIR_PARAM = "-d";
    static final String OUTPUT_PARAM = "-o";
    static final String STD_PARAM = "-std";

    /** Estensione dei file di programma elaborati in modalità directory */
    static final String PROGRAM_EXTENSION = ".eq";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Esegue l'applicazione scrivendo l'output sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output per l'utente
     * @return codice di uscita: 0 successo, 1 errore di parametri, caricamento o I/O
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return 1;
        }

        ProverConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return 1;
        }

        if (config == null) {
            printApplicationHelp(out);
            return 0;
        }

        try {
            List<Axiom> preloaded = config.useStandardAxioms ? StandardAxioms.booleanAlgebra() : List.of();
            if (config.isFileMode) {
                return processSingleFile(Paths.get(config.inputPath), preloaded, config, out) ? 0 : 1;
            }
            return processDirectoryBatch(Paths.get(config.inputPath), preloaded, config, out);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di I/O", e);
            out.println("[E] Errore di I/O: " + e.getMessage());
            return 1;
        }
    }

    //endregion

    //region ELABORAZIONE

    /**
     * Carica ed esegue un programma, stampando ogni goal appena risolto.
     *
     * @return true se il programma è stato caricato ed eseguito
     */
    private static boolean processSingleFile(Path programFile, List<Axiom> preloaded,
                                             ProverConfiguration config, PrintStream out) throws IOException {
        out.println("-->> PROGRAMMA: " + programFile.getFileName() + " <<--");

        List<Command> commands;
        try {
            commands = ProgramLoader.loadFile(programFile);
        } catch (ProgramLoadException e) {
            LOGGER.log(Level.SEVERE, "Caricamento fallito: " + programFile, e);
            out.println(e.getFormattedMessage());
            return false;
        }

        ProgramExecutor executor = new ProgramExecutor(preloaded);
        List<ProofResult> results = executor.execute(commands, out::print);

        if (config.outputPath != null) {
            new ResultWriter(Paths.get(config.outputPath)).write(programFile, results);
        }
        return true;
    }

    /**
     * Esegue tutti i programmi .eq della directory; un errore in un file non ferma il batch.
     *
     * @return 0 se tutti i file sono stati eseguiti, 1 altrimenti
     */
    private static int processDirectoryBatch(Path directory, List<Axiom> preloaded,
                                             ProverConfiguration config, PrintStream out) throws IOException {
        List<Path> programFiles;
        try (Stream<Path> entries = Files.list(directory)) {
            programFiles = entries
                    .filter(path -> path.toString().endsWith(PROGRAM_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        if (programFiles.isEmpty()) {
            out.println("[W] Nessun file " + PROGRAM_EXTENSION + " trovato nella directory specificata.");
            return 0;
        }

        int failures = 0;
        for (Path programFile : programFiles) {
            try {
                if (!processSingleFile(programFile, preloaded, config, out)) {
                    failures++;
                }
            } catch (IOException e) {
                out.println("[E] Errore nel file " + programFile.getFileName() + ": " + e.getMessage());
                failures++;
            }
            out.println();
        }

        out.println("[I] Programmi eseguiti: " + (programFiles.size() - failures) + "/" + programFiles.size());
        return failures == 0 ? 0 : 1;
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("Uso: java -jar equational-prover.jar (-f <file> | -d <directory>) [-o <directory>] [-std]");
        out.println();
        out.println("  -f <file>       esegue un programma");
        out.println("  -d <directory>  esegue tutti i file " + PROGRAM_EXTENSION + " della directory");
        out.println("  -o <directory>  salva RESULT/ e STATS/ nella directory indicata");
        out.println("  -std            precarica gli assiomi dell'algebra di Boole");
        out.println("  -h              mostra questo help");
        out.println();
        out.println("Comandi del programma:");
        out.println("  axiom nome : formula = formula.");
        out.println("  param max_search_depth 8.  param max_tree_size 20.  param use_proofs_as_axioms true.");
        out.println("  prove formula = formula.");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata della linea di comando.
     */
    static final class ProverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean useStandardAxioms;

        ProverConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean useStandardAxioms) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.useStandardAxioms = useStandardAxioms;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri forniti dall'utente
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono invalidi
         */
        ProverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean useStandardAxioms = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case STD_PARAM -> useStandardAxioms = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new ProverConfiguration(inputPath, outputPath, isFileMode, useStandardAxioms);
        }

        private void validateExclusiveMode(boolean alreadySet, String currentMode) {
            if (alreadySet) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1]
                        + " richiede " + argumentType);
            }
            return args[currentIndex];
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
    }

    //endregion
}
