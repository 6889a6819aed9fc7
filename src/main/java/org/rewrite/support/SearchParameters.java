package org.rewrite.support;

import java.util.Objects;

/**
 * PARAMETRI DI RICERCA - Configurazione corrente, immutabile, dei goal successivi
 *
 * I comandi param producono una nuova istanza tramite {@link #with(Parameter, Object)};
 * l'istanza attiva viene passata esplicitamente all'esecuzione di ogni goal.
 */
public final class SearchParameters {

    public static final int DEFAULT_MAX_SEARCH_DEPTH = 8;
    public static final int DEFAULT_MAX_TREE_SIZE = 20;
    public static final boolean DEFAULT_USE_PROOFS_AS_AXIOMS = false;

    public static final SearchParameters DEFAULTS = new SearchParameters(
            DEFAULT_MAX_SEARCH_DEPTH, DEFAULT_MAX_TREE_SIZE, DEFAULT_USE_PROOFS_AS_AXIOMS);

    /**
     * Chiavi dei parametri impostabili con il comando param.
     */
    public enum Parameter {
        MAX_SEARCH_DEPTH("max_search_depth", Integer.class),
        MAX_TREE_SIZE("max_tree_size", Integer.class),
        USE_PROOFS_AS_AXIOMS("use_proofs_as_axioms", Boolean.class);

        private final String key;
        private final Class<?> valueType;

        Parameter(String key, Class<?> valueType) {
            this.key = key;
            this.valueType = valueType;
        }

        public String key() {
            return key;
        }

        public Class<?> valueType() {
            return valueType;
        }

        /**
         * @param key chiave testuale, es. "max_search_depth"
         * @return parametro corrispondente
         * @throws IllegalArgumentException se la chiave non esiste
         */
        public static Parameter fromKey(String key) {
            for (Parameter parameter : values()) {
                if (parameter.key.equals(key)) {
                    return parameter;
                }
            }
            throw new IllegalArgumentException("Parametro sconosciuto: " + key);
        }
    }

    //region ATTRIBUTI

    /**
     * Lunghezza massima della prova, in passi di riscrittura.
     * Gli stati a questa profondità vengono confrontati con l'obiettivo ma non espansi.
     */
    private final int maxSearchDepth;

    /**
     * Lunghezza massima della forma canonica di uno stato espandibile.
     * Stati più lunghi vengono confrontati con l'obiettivo ma non espansi.
     */
    private final int maxTreeSize;

    /**
     * Se true ogni goal dimostrato diventa un lemma disponibile ai goal successivi.
     */
    private final boolean useProofsAsAxioms;

    //endregion

    /**
     * @param maxSearchDepth lunghezza massima della prova (>= 0)
     * @param maxTreeSize lunghezza massima della forma canonica espandibile (>= 0)
     * @param useProofsAsAxioms registrazione dei lemmi
     * @throws IllegalArgumentException se un limite è negativo
     */
    public SearchParameters(int maxSearchDepth, int maxTreeSize, boolean useProofsAsAxioms) {
        if (maxSearchDepth < 0) {
            throw new IllegalArgumentException("max_search_depth non può essere negativo: " + maxSearchDepth);
        }
        if (maxTreeSize < 0) {
            throw new IllegalArgumentException("max_tree_size non può essere negativo: " + maxTreeSize);
        }
        this.maxSearchDepth = maxSearchDepth;
        this.maxTreeSize = maxTreeSize;
        this.useProofsAsAxioms = useProofsAsAxioms;
    }

    //region ACCESSORS

    public int getMaxSearchDepth() {
        return maxSearchDepth;
    }

    public int getMaxTreeSize() {
        return maxTreeSize;
    }

    /** @return true se i goal dimostrati vengono aggiunti come lemmi */
    public boolean isUseProofsAsAxioms() {
        return useProofsAsAxioms;
    }

    //endregion

    /**
     * Restituisce una copia con un solo parametro aggiornato.
     *
     * @param parameter parametro da impostare
     * @param value Integer per i limiti, Boolean per use_proofs_as_axioms
     * @return nuova configurazione
     * @throws IllegalArgumentException se il tipo del valore non corrisponde o il valore è fuori intervallo
     */
    public SearchParameters with(Parameter parameter, Object value) {
        if (!parameter.valueType().isInstance(value)) {
            throw new IllegalArgumentException("Valore " + value + " non valido per " + parameter.key()
                    + ": atteso " + parameter.valueType().getSimpleName());
        }
        return switch (parameter) {
            case MAX_SEARCH_DEPTH -> new SearchParameters((Integer) value, maxTreeSize, useProofsAsAxioms);
            case MAX_TREE_SIZE -> new SearchParameters(maxSearchDepth, (Integer) value, useProofsAsAxioms);
            case USE_PROOFS_AS_AXIOMS -> new SearchParameters(maxSearchDepth, maxTreeSize, (Boolean) value);
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SearchParameters)) {
            return false;
        }
        SearchParameters other = (SearchParameters) obj;
        return maxSearchDepth == other.maxSearchDepth
                && maxTreeSize == other.maxTreeSize
                && useProofsAsAxioms == other.useProofsAsAxioms;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxSearchDepth, maxTreeSize, useProofsAsAxioms);
    }

    @Override
    public String toString() {
        return String.format("max_search_depth=%d, max_tree_size=%d, use_proofs_as_axioms=%s",
                maxSearchDepth, maxTreeSize, useProofsAsAxioms);
    }
}
