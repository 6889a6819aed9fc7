package org.rewrite.optionalfeatures;

import org.rewrite.engine.ProofResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * SCRITTURA RISULTATI - Salvataggio strutturato degli esiti su disco (-o)
 *
 * ORGANIZZAZIONE DELL'OUTPUT:
 * - RESULT/nome.result: report di ogni goal, nello stesso formato della console
 * - STATS/nome.stats: statistiche di ricerca di ogni goal
 *
 * "nome" è il nome del file di programma senza estensione.
 */
public class ResultWriter {

    private static final Logger LOGGER = Logger.getLogger(ResultWriter.class.getName());

    public static final String RESULT_DIRECTORY = "RESULT";
    public static final String STATS_DIRECTORY = "STATS";

    private final Path outputDirectory;

    public ResultWriter(Path outputDirectory) {
        if (outputDirectory == null) {
            throw new IllegalArgumentException("Directory di output non può essere null");
        }
        this.outputDirectory = outputDirectory;
    }

    /**
     * Scrive i file RESULT e STATS di un programma.
     *
     * @param programFile file del programma eseguito
     * @param results esiti dei goal, in ordine
     * @throws IOException se le directory o i file non sono scrivibili
     */
    public void write(Path programFile, List<ProofResult> results) throws IOException {
        String baseName = baseName(programFile);

        Path resultFile = outputDirectory.resolve(RESULT_DIRECTORY).resolve(baseName + ".result");
        Path statsFile = outputDirectory.resolve(STATS_DIRECTORY).resolve(baseName + ".stats");
        Files.createDirectories(resultFile.getParent());
        Files.createDirectories(statsFile.getParent());

        try (BufferedWriter writer = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8)) {
            for (ProofResult result : results) {
                writer.write(result.toString());
                writer.write('\n');
            }
        }

        try (BufferedWriter writer = Files.newBufferedWriter(statsFile, StandardCharsets.UTF_8)) {
            int index = 1;
            for (ProofResult result : results) {
                writer.write("Goal #" + index++ + ": " + result.getStart() + " = " + result.getTarget() + "\n");
                writer.write("Esito: " + (result.isSuccess() ? "DIMOSTRATO" : "NON DIMOSTRATO")
                        + ", passi: " + result.getPathLength() + "\n");
                writer.write(result.getStatistics().toString());
                writer.write('\n');
            }
        }

        LOGGER.info("Risultati salvati in " + resultFile + " e " + statsFile);
    }

    /**
     * @return nome del file senza estensione
     */
    static String baseName(Path programFile) {
        String fileName = programFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
