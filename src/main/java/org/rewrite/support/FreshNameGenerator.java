package org.rewrite.support;

import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;

import java.util.Collection;

/**
 * GENERATORE NOMI FRESCHI - Contatore monotono per segnaposto non risolti
 *
 * Ogni istanza appartiene a una singola invocazione della ricerca: invocazioni diverse
 * sono indipendenti e riproducibili qualunque sia l'ordine di chiamata.
 * I nomi prodotti sono decimali (0, 1, 2, ...) e compaiono nel testo come ?0, ?1, ...
 *
 * Il contatore parte oltre il massimo segnaposto numerico già presente negli input,
 * così un nome coniato non coincide mai con uno scritto dall'utente.
 */
public class FreshNameGenerator {

    private long next;

    /**
     * Inizializza il contatore a zero.
     */
    public FreshNameGenerator() {
        this(0);
    }

    /**
     * @param firstIndex primo indice da coniare (non negativo)
     */
    public FreshNameGenerator(long firstIndex) {
        if (firstIndex < 0) {
            throw new IllegalArgumentException("Indice iniziale negativo: " + firstIndex);
        }
        this.next = firstIndex;
    }

    /**
     * Costruisce un generatore che non collide con i segnaposto numerici delle formule
     * e degli assiomi indicati.
     *
     * @param axioms assiomi disponibili alla ricerca
     * @param formulas formule di partenza e di arrivo
     * @return generatore posizionato dopo il massimo indice già usato
     */
    public static FreshNameGenerator avoiding(Collection<Axiom> axioms, Formula... formulas) {
        long highest = -1;
        for (Formula formula : formulas) {
            highest = Math.max(highest, highestNumericName(formula));
        }
        for (Axiom axiom : axioms) {
            highest = Math.max(highest, highestNumericName(axiom.getLhs()));
            highest = Math.max(highest, highestNumericName(axiom.getRhs()));
        }
        return new FreshNameGenerator(highest + 1);
    }

    private static long highestNumericName(Formula formula) {
        long highest = -1;
        for (String name : formula.unresolvedNames()) {
            if (name.chars().allMatch(Character::isDigit) && name.length() < 18) {
                highest = Math.max(highest, Long.parseLong(name));
            }
        }
        return highest;
    }

    /**
     * @return nuovo segnaposto mai coniato prima da questo generatore
     */
    public Formula nextUnresolved() {
        return Formula.unresolved(Long.toString(next++));
    }

    /** @return indice del prossimo segnaposto che verrà coniato */
    public long peekNextIndex() {
        return next;
    }
}
