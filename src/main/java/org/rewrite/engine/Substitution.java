package org.rewrite.engine;

import org.rewrite.formula.Formula;
import org.rewrite.support.FreshNameGenerator;
import org.rewrite.support.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * SOSTITUZIONE - Istanzia il lato di arrivo di un assioma con i legami di un match
 *
 * REGOLE:
 * - primitive e segnaposto: copiati invariati
 * - operazioni: figli istanziati ricorsivamente, simbolo preservato
 * - variabile legata nello scope: sostituita dal sottoalbero legato
 * - variabile non legata: sostituita da un segnaposto fresco ?n
 *
 * Il risultato non contiene riferimenti pendenti a variabili di pattern: ogni variabile
 * che vi compare proviene da un legame dello scope.
 */
public class Substitution {

    private final FreshNameGenerator freshNames;

    public Substitution(FreshNameGenerator freshNames) {
        if (freshNames == null) {
            throw new IllegalArgumentException("Generatore nomi freschi non può essere null");
        }
        this.freshNames = freshNames;
    }

    /**
     * @param targetPattern lato di arrivo dell'assioma
     * @param scope legami prodotti dal match del lato di partenza
     * @return nuova formula istanziata
     */
    public Formula instantiate(Formula targetPattern, Scope scope) {
        return switch (targetPattern.kind()) {
            case PRIMITIVE, UNRESOLVED -> targetPattern;
            case VARIABLE -> scope.isBound(targetPattern.token())
                    ? scope.lookup(targetPattern.token())
                    : freshNames.nextUnresolved();
            case OPERATION -> {
                List<Formula> children = new ArrayList<>(targetPattern.children().size());
                for (Formula child : targetPattern.children()) {
                    children.add(instantiate(child, scope));
                }
                yield Formula.operation(targetPattern.operator(), children);
            }
        };
    }
}
