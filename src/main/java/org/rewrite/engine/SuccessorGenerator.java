package org.rewrite.engine;

import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;
import org.rewrite.support.FreshNameGenerator;
import org.rewrite.support.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * GENERATORE SUCCESSORI - Tutte le riscritture a un passo di una formula
 *
 * Ogni successore differisce dalla formula di partenza in esattamente una posizione:
 * non vengono mai prodotte riscritture simultanee in più punti.
 * Ogni assioma viene provato in entrambe le direzioni, in ogni nodo dell'albero.
 *
 * ORDINE DI GENERAZIONE (deterministico):
 * 1. assiomi nell'ordine della base di conoscenza
 * 2. per ogni assioma prima lhs -> rhs, poi rhs -> lhs
 * 3. per ogni direzione prima la radice, poi i figli da sinistra a destra (ricorsivamente)
 */
public class SuccessorGenerator {

    private static final Logger LOGGER = Logger.getLogger(SuccessorGenerator.class.getName());

    private final Substitution substitution;

    /**
     * @param freshNames generatore dei segnaposto, appartenente alla ricerca in corso
     */
    public SuccessorGenerator(FreshNameGenerator freshNames) {
        this.substitution = new Substitution(freshNames);
    }

    //region APPLICAZIONE SU UN NODO

    /**
     * Applica la regola from -> to esattamente nella radice del nodo.
     *
     * @return formula riscritta, vuoto se from non corrisponde al nodo
     */
    public Optional<Formula> applyAt(Formula node, Formula from, Formula to) {
        Scope scope = new Scope();
        if (!PatternMatcher.match(node, from, scope)) {
            return Optional.empty();
        }
        return Optional.of(substitution.instantiate(to, scope));
    }

    //endregion

    //region SUCCESSORI PER REGOLA

    /**
     * Tutte le formule ottenibili applicando from -> to in una sola posizione dell'albero.
     *
     * @param node formula di partenza
     * @param ruleName nome con cui etichettare i successori
     * @param from pattern da cercare
     * @param to pattern da istanziare
     * @return un successore per ogni posizione in cui la regola si applica
     */
    public List<RewriteStep> allSuccessorsForRule(Formula node, String ruleName, Formula from, Formula to) {
        List<RewriteStep> successors = new ArrayList<>();
        collectSuccessorsForRule(node, ruleName, from, to, successors);
        return successors;
    }

    private void collectSuccessorsForRule(Formula node, String ruleName, Formula from, Formula to,
                                          List<RewriteStep> successors) {
        applyAt(node, from, to).ifPresent(rewritten -> successors.add(new RewriteStep(ruleName, rewritten)));

        for (int i = 0; i < node.children().size(); i++) {
            List<RewriteStep> childSuccessors = new ArrayList<>();
            collectSuccessorsForRule(node.child(i), ruleName, from, to, childSuccessors);
            // Ricostruisce il percorso fino alla radice cambiando solo il figlio i
            for (RewriteStep childStep : childSuccessors) {
                successors.add(new RewriteStep(ruleName, node.withChild(i, childStep.getFormula())));
            }
        }
    }

    //endregion

    //region SUCCESSORI PER TUTTI GLI ASSIOMI

    /**
     * Unione dei successori di tutti gli assiomi, in entrambe le direzioni.
     *
     * @param axioms assiomi disponibili, nell'ordine della base di conoscenza
     * @param node formula da espandere
     * @return successori etichettati con il nome dell'assioma (possono esserci duplicati)
     */
    public List<RewriteStep> allSuccessors(List<Axiom> axioms, Formula node) {
        List<RewriteStep> successors = new ArrayList<>();
        for (Axiom axiom : axioms) {
            successors.addAll(allSuccessorsForRule(node, axiom.getName(), axiom.getLhs(), axiom.getRhs()));
            successors.addAll(allSuccessorsForRule(node, axiom.getName(), axiom.getRhs(), axiom.getLhs()));
        }
        LOGGER.finest(() -> "Successori di " + node + ": " + successors.size());
        return successors;
    }

    //endregion
}
