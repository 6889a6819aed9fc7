package org.rewrite.support;

import org.rewrite.formula.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SCOPE - Legami variabile di pattern -> sottoformula prodotti da un tentativo di match
 *
 * Costruito incrementalmente durante un singolo tentativo di match e condiviso da tutta
 * la visita. Non viene ripristinato in caso di fallimento parziale: un match fallito
 * invalida l'intero scope, che va scartato.
 *
 * Mantiene l'ordine di inserimento per output deterministico nel logging.
 */
public class Scope {

    /**
     * Legami correnti nome variabile -> sottoformula.
     * Invariante: ogni nome compare al più una volta e il valore non è mai null.
     */
    private final Map<String, Formula> bindings = new LinkedHashMap<>();

    /**
     * @param variableName nome della variabile di pattern
     * @return true se la variabile ha già un legame in questo match
     */
    public boolean isBound(String variableName) {
        return bindings.containsKey(variableName);
    }

    /**
     * Restituisce il legame di una variabile.
     *
     * @param variableName nome della variabile di pattern
     * @return sottoformula legata alla variabile, null se la variabile non è legata
     */
    public Formula lookup(String variableName) {
        return bindings.get(variableName);
    }

    /**
     * Lega una variabile libera. Un legame già presente non viene mai sovrascritto.
     *
     * @param variableName nome della variabile di pattern
     * @param value sottoformula da legare (non null)
     * @throws IllegalArgumentException se il valore è null
     * @throws IllegalStateException se la variabile è già legata
     */
    public void bind(String variableName, Formula value) {
        if (value == null) {
            throw new IllegalArgumentException("Legame null per variabile " + variableName);
        }
        Formula previous = bindings.putIfAbsent(variableName, value);
        if (previous != null) {
            throw new IllegalStateException("Variabile " + variableName + " già legata a " + previous);
        }
    }

    /** @return numero di variabili legate */
    public int size() {
        return bindings.size();
    }

    /** @return true se nessuna variabile è ancora legata */
    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /** @return vista non modificabile dei legami in ordine di inserimento */
    public Map<String, Formula> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
