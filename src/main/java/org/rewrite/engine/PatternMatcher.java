package org.rewrite.engine;

import org.rewrite.formula.Formula;
import org.rewrite.support.Scope;

/**
 * PATTERN MATCHER - Verifica se un lato di assioma si adatta a un nodo della formula
 *
 * Match del primo ordine non lineare, senza occurs-check. Tabella applicata dall'alto:
 *
 *   regola \ nodo  |  operazione        |  variabile  |  segnaposto  |  primitiva
 *   ---------------------------------------------------------------------------------
 *   operazione     |  stesso simbolo *  |  no         |  no          |  no
 *   variabile      |  **                |  **         |  **          |  **
 *   segnaposto     |  no                |  no         |  stesso nome |  no
 *   primitiva      |  no                |  no         |  no          |  stesso bit
 *
 *   *  stessa arità e tutti i figli devono corrispondere, da sinistra a destra
 *   ** prima occorrenza: lega la variabile al nodo; occorrenze successive:
 *      il nodo deve avere la stessa forma canonica del legame esistente
 *
 * Lo scope non viene ripristinato su fallimento parziale: il fallimento in un punto
 * qualunque fa fallire l'intera chiamata e lo scope va scartato.
 */
public final class PatternMatcher {

    private PatternMatcher() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tenta il match del pattern sul nodo, accumulando i legami nello scope.
     *
     * @param node nodo della formula da esaminare
     * @param rule pattern (lato di un assioma)
     * @param scope legami accumulati finora
     * @return true se il pattern corrisponde al nodo
     */
    public static boolean match(Formula node, Formula rule, Scope scope) {
        return switch (rule.kind()) {
            case PRIMITIVE -> node.kind() == Formula.Kind.PRIMITIVE && rule.token().equals(node.token());
            case UNRESOLVED -> node.kind() == Formula.Kind.UNRESOLVED && rule.token().equals(node.token());
            case VARIABLE -> matchVariable(node, rule.token(), scope);
            case OPERATION -> matchOperation(node, rule, scope);
        };
    }

    /**
     * Variante che parte da uno scope vuoto.
     *
     * @return scope dei legami se il match riesce, null altrimenti
     */
    public static Scope match(Formula node, Formula rule) {
        Scope scope = new Scope();
        return match(node, rule, scope) ? scope : null;
    }

    private static boolean matchVariable(Formula node, String name, Scope scope) {
        if (scope.isBound(name)) {
            return scope.lookup(name).equals(node);
        }
        scope.bind(name, node);
        return true;
    }

    private static boolean matchOperation(Formula node, Formula rule, Scope scope) {
        if (node.kind() != Formula.Kind.OPERATION || node.operator() != rule.operator()) {
            return false;
        }
        if (node.children().size() != rule.children().size()) {
            return false;
        }
        for (int i = 0; i < rule.children().size(); i++) {
            if (!match(node.child(i), rule.child(i), scope)) {
                return false;
            }
        }
        return true;
    }
}
