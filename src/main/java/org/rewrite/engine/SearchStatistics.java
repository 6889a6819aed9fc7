package org.rewrite.engine;

/**
 * STATISTICHE DI RICERCA - Metriche raccolte durante una singola invocazione BFS
 *
 * Raccoglie i contatori del lavoro svolto dal motore (stati esaminati, scoperti, scartati,
 * potati) e il tempo di esecuzione, per il report su console e per i file STATS.
 *
 * CICLO DI VITA:
 * • il timer parte alla costruzione, cioè all'avvio della ricerca
 * • il motore aggiorna i contatori tramite i metodi record* (visibili solo nel package)
 * • {@link #stopTimer()} congela il tempo quando la ricerca termina, con o senza successo
 *
 * Un'istanza appartiene a una sola ricerca e non è condivisa tra thread.
 */
public class SearchStatistics {

    //region CONTATORI METRICHE CORE

    /**
     * Stati estratti dalla coda ed esaminati, incluso lo stato iniziale.
     * È il valore riportato come "states checked" nel report del goal.
     */
    private int statesExplored = 0;

    /**
     * Forme canoniche distinte scoperte, incluso lo stato iniziale.
     * Coincide con la dimensione finale dell'insieme dei visitati.
     */
    private int statesDiscovered = 0;

    /**
     * Successori prodotti dal generatore, duplicati compresi.
     * Misura il fattore di ramificazione effettivo degli assiomi.
     */
    private long successorsGenerated = 0;

    /**
     * Successori scartati perché la loro forma canonica era già stata vista.
     * La prima scoperta di uno stato vince sempre.
     */
    private long duplicatesSkipped = 0;

    //endregion

    //region METRICHE DI POTATURA

    /**
     * Stati esaminati ma non espansi perché hanno raggiunto max_search_depth.
     */
    private int prunedByDepth = 0;

    /**
     * Stati esaminati ma non espansi perché la forma canonica supera max_tree_size.
     */
    private int prunedBySize = 0;

    /**
     * Massima dimensione raggiunta dalla frontiera dopo un'espansione.
     * Indica l'occupazione di memoria di picco della ricerca.
     */
    private int peakFrontierSize = 0;

    /**
     * Livello BFS più profondo estratto dalla coda.
     */
    private int deepestLayer = 0;

    //endregion

    //region TIMING E PERFORMANCE

    /**
     * Timestamp di inizio ricerca, fissato alla costruzione.
     */
    private final long startTime;

    /**
     * Tempo di esecuzione totale in millisecondi, valido dopo {@link #stopTimer()}.
     */
    private long executionTimeMs = 0;

    /**
     * Flag per indicare se il timer è stato fermato.
     * Previene stop multipli che altererebbero il tempo misurato.
     */
    private boolean timerStopped = false;

    //endregion

    //region INIZIALIZZAZIONE E TIMER

    /**
     * Inizializza le statistiche con tutti i contatori a zero e avvia il timer.
     */
    public SearchStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Ferma la misurazione. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale se il timer è fermo, tempo parziale altrimenti
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    /**
     * @return true se la ricerca è terminata e il tempo è definitivo
     */
    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region AGGIORNAMENTO (USO INTERNO DEL MOTORE)

    /**
     * Registra l'estrazione di uno stato dalla coda.
     *
     * @param depth profondità BFS dello stato estratto
     */
    void recordExplored(int depth) {
        statesExplored++;
        deepestLayer = Math.max(deepestLayer, depth);
    }

    /**
     * Registra la prima scoperta di una forma canonica.
     */
    void recordDiscovered() {
        statesDiscovered++;
    }

    /**
     * @param count successori prodotti dall'espansione di uno stato
     */
    void recordSuccessors(int count) {
        successorsGenerated += count;
    }

    void recordDuplicate() {
        duplicatesSkipped++;
    }

    void recordPrunedByDepth() {
        prunedByDepth++;
    }

    void recordPrunedBySize() {
        prunedBySize++;
    }

    /**
     * Aggiorna il picco della frontiera.
     *
     * @param size dimensione corrente della coda
     */
    void recordFrontierSize(int size) {
        peakFrontierSize = Math.max(peakFrontierSize, size);
    }

    //endregion

    //region INTERFACCIA PUBBLICA ACCESSORS

    /**
     * @return stati esaminati, incluso lo stato iniziale
     */
    public int getStatesExplored() {
        return statesExplored;
    }

    /**
     * @return forme canoniche distinte scoperte
     */
    public int getStatesDiscovered() {
        return statesDiscovered;
    }

    /**
     * @return successori generati, duplicati compresi
     */
    public long getSuccessorsGenerated() {
        return successorsGenerated;
    }

    /**
     * @return successori scartati perché già visti
     */
    public long getDuplicatesSkipped() {
        return duplicatesSkipped;
    }

    /**
     * @return stati non espansi per limite di profondità
     */
    public int getPrunedByDepth() {
        return prunedByDepth;
    }

    /**
     * @return stati non espansi per limite di dimensione
     */
    public int getPrunedBySize() {
        return prunedBySize;
    }

    /**
     * @return dimensione massima raggiunta dalla frontiera
     */
    public int getPeakFrontierSize() {
        return peakFrontierSize;
    }

    /**
     * @return livello BFS più profondo esaminato
     */
    public int getDeepestLayer() {
        return deepestLayer;
    }

    /**
     * @return stati esaminati al secondo (0.0 se il tempo non è misurabile)
     */
    public double getStatesPerSecond() {
        long timeMs = getExecutionTimeMs();
        return timeMs > 0 ? (double) statesExplored * 1000 / timeMs : 0.0;
    }

    //endregion

    //region OUTPUT

    /**
     * Report multi-riga usato nei file STATS.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("Stati esaminati: ").append(statesExplored).append('\n');
        output.append("Stati scoperti: ").append(statesDiscovered).append('\n');
        output.append("Successori generati: ").append(successorsGenerated).append('\n');
        output.append("Duplicati scartati: ").append(duplicatesSkipped).append('\n');
        output.append("Potature per profondità: ").append(prunedByDepth).append('\n');
        output.append("Potature per dimensione: ").append(prunedBySize).append('\n');
        output.append("Frontiera massima: ").append(peakFrontierSize).append('\n');
        output.append("Livello massimo: ").append(deepestLayer).append('\n');
        output.append("Tempo: ").append(getExecutionTimeMs()).append(" ms\n");
        return output.toString();
    }

    //endregion
}
