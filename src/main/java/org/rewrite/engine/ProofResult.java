package org.rewrite.engine;

import org.rewrite.formula.Formula;

import java.util.List;
import java.util.Locale;

/**
 * RISULTATO DI UNA DIMOSTRAZIONE - Esito immutabile di un goal prove
 *
 * COMPONENTI:
 * - esito: percorso trovato oppure nessun percorso entro i limiti
 * - percorso: passi (assioma, formula) dalla partenza all'obiettivo, vuoto se le formule coincidono
 * - stati esaminati: lavoro svolto, significativo anche in caso di fallimento
 * - statistiche: metriche dettagliate della ricerca
 *
 * Un fallimento è un esito normale, non un errore: il percorso è vuoto e il conteggio
 * degli stati riflette il lavoro svolto prima dell'esaurimento della frontiera.
 */
public final class ProofResult {

    //region ATTRIBUTI DEL GOAL

    /** Formula di partenza del goal */
    private final Formula start;

    /** Formula obiettivo del goal */
    private final Formula target;

    /**
     * Esito della ricerca.
     * • true: l'obiettivo è stato raggiunto entro i limiti
     * • false: frontiera esaurita senza raggiungere l'obiettivo
     */
    private final boolean success;

    /**
     * Passi dalla partenza all'obiettivo, in ordine.
     * Invariante: vuoto per i fallimenti e quando partenza e obiettivo coincidono.
     */
    private final List<RewriteStep> path;

    /**
     * Stati estratti dalla coda, copiati dalle statistiche alla costruzione.
     */
    private final int statesExplored;

    /**
     * Limite di profondità in vigore per il goal, riportato nel messaggio di fallimento.
     */
    private final int maxSearchDepth;

    /** Metriche dettagliate della ricerca */
    private final SearchStatistics statistics;

    //endregion

    private ProofResult(Formula start, Formula target, boolean success, List<RewriteStep> path,
                        int maxSearchDepth, SearchStatistics statistics) {
        if (start == null || target == null) {
            throw new IllegalArgumentException("Goal incompleto: formule null");
        }
        if (!success && !path.isEmpty()) {
            throw new IllegalArgumentException("Un goal non dimostrato non può avere percorso");
        }
        this.start = start;
        this.target = target;
        this.success = success;
        this.path = List.copyOf(path);
        this.statesExplored = statistics.getStatesExplored();
        this.maxSearchDepth = maxSearchDepth;
        this.statistics = statistics;
    }

    //region FACTORY METHODS

    /**
     * Crea l'esito di un goal dimostrato.
     *
     * @param start formula di partenza
     * @param target formula obiettivo
     * @param path passi della prova, vuoto se le formule coincidono
     * @param maxSearchDepth limite di profondità in vigore
     * @param statistics statistiche della ricerca, già fermate
     * @return esito positivo
     */
    public static ProofResult proved(Formula start, Formula target, List<RewriteStep> path,
                                     int maxSearchDepth, SearchStatistics statistics) {
        return new ProofResult(start, target, true, path, maxSearchDepth, statistics);
    }

    /**
     * Crea l'esito di un goal non dimostrato entro i limiti.
     *
     * @param start formula di partenza
     * @param target formula obiettivo
     * @param maxSearchDepth limite di profondità in vigore
     * @param statistics statistiche della ricerca, già fermate
     * @return esito negativo con percorso vuoto
     */
    public static ProofResult notProved(Formula start, Formula target, int maxSearchDepth,
                                        SearchStatistics statistics) {
        return new ProofResult(start, target, false, List.of(), maxSearchDepth, statistics);
    }

    //endregion

    //region ACCESSORS

    /** @return formula di partenza del goal */
    public Formula getStart() {
        return start;
    }

    /** @return formula obiettivo del goal */
    public Formula getTarget() {
        return target;
    }

    /** @return true se l'obiettivo è stato raggiunto entro i limiti */
    public boolean isSuccess() {
        return success;
    }

    /** @return passi dalla partenza all'obiettivo, in ordine */
    public List<RewriteStep> getPath() {
        return path;
    }

    /** @return numero di passi della prova (0 se le formule coincidono o la prova è fallita) */
    public int getPathLength() {
        return path.size();
    }

    /**
     * @return stati esaminati dalla ricerca, significativo anche in caso di fallimento
     */
    public int getStatesExplored() {
        return statesExplored;
    }

    /** @return limite di profondità in vigore per il goal */
    public int getMaxSearchDepth() {
        return maxSearchDepth;
    }

    /** @return metriche dettagliate della ricerca */
    public SearchStatistics getStatistics() {
        return statistics;
    }

    /** @return true se partenza e obiettivo hanno la stessa forma canonica */
    public boolean isIdentity() {
        return success && path.isEmpty();
    }

    //endregion

    //region OUTPUT

    /**
     * Report testuale del goal nel formato del programma a riga di comando.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("Prove ").append(start).append(" = ").append(target).append(":\n");

        if (!success) {
            output.append("No path found within ").append(maxSearchDepth).append(" steps (")
                    .append(statesExplored).append(" states checked).\n");
        } else if (path.isEmpty()) {
            output.append("Statements are the same.\n");
        } else {
            for (RewriteStep step : path) {
                output.append(step).append('\n');
            }
            double seconds = statistics.getExecutionTimeMs() / 1000.0;
            output.append(String.format(Locale.ROOT, "Done in %.3f seconds after checking %d states.\n",
                    seconds, statesExplored));
        }
        return output.toString();
    }

    /**
     * @return riepilogo su una riga per il logging
     */
    public String toCompactString() {
        return String.format("ProofResult{%s, passi=%d, stati=%d, tempo=%dms}",
                success ? "DIMOSTRATO" : "NON DIMOSTRATO",
                path.size(),
                statesExplored,
                statistics.getExecutionTimeMs());
    }

    //endregion
}
