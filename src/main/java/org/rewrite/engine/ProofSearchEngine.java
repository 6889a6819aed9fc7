package org.rewrite.engine;

import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;
import org.rewrite.support.FreshNameGenerator;
import org.rewrite.support.SearchParameters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MOTORE DI RICERCA - BFS limitata sul grafo implicito delle riscritture
 *
 * Nodi del grafo: forme canoniche delle formule. Archi: un passo del generatore di
 * successori, etichettato con il nome dell'assioma. Ogni arco ha costo unitario e la BFS
 * visita gli stati in ordine di profondità non decrescente: la prima scoperta di uno stato
 * è anche la più corta, e il percorso ricostruito è minimo tra quelli raggiungibili entro i limiti.
 *
 * POLITICA PER OGNI STATO ESTRATTO:
 * 1. forma canonica uguale all'obiettivo: successo, ricostruzione del percorso
 * 2. profondità >= max_search_depth oppure forma canonica più lunga di max_tree_size: potatura
 * 3. altrimenti espansione: ogni successore mai visto viene marcato, accodato e collegato al padre
 *
 * Coda esaurita senza raggiungere l'obiettivo: fallimento (esito normale, non un errore).
 *
 * Ogni istanza esegue una sola ricerca alla volta e possiede in esclusiva frontiera,
 * insieme dei visitati, mappa dei padri e generatore di nomi freschi. Gli assiomi e i
 * parametri sono uno snapshot in sola lettura.
 */
public class ProofSearchEngine {

    private static final Logger LOGGER = Logger.getLogger(ProofSearchEngine.class.getName());

    /**
     * Record di ricerca per uno stato scoperto: basta a ricostruire il percorso
     * risalendo i padri fino alla partenza.
     */
    private static final class SearchNode {

        /** Stato scoperto */
        private final Formula formula;

        /** Distanza in passi dalla partenza */
        private final int depth;

        /** Assioma che ha prodotto lo stato (null per la partenza) */
        private final String ruleName;

        /** Forma canonica del predecessore (null per la partenza) */
        private final String parentKey;

        SearchNode(Formula formula, int depth, String ruleName, String parentKey) {
            this.formula = formula;
            this.depth = depth;
            this.ruleName = ruleName;
            this.parentKey = parentKey;
        }
    }

    private final List<Axiom> axioms;
    private final SearchParameters parameters;

    /**
     * @param axioms assiomi disponibili, nell'ordine della base di conoscenza
     * @param parameters limiti della ricerca
     */
    public ProofSearchEngine(List<Axiom> axioms, SearchParameters parameters) {
        if (axioms == null || parameters == null) {
            throw new IllegalArgumentException("Assiomi e parametri sono obbligatori");
        }
        this.axioms = List.copyOf(axioms);
        this.parameters = parameters;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Cerca un percorso più corto da start a target.
     *
     * @param start formula di partenza
     * @param target formula obiettivo
     * @return esito con percorso (se trovato), stati esaminati e statistiche
     */
    public ProofResult prove(Formula start, Formula target) {
        if (start == null || target == null) {
            throw new IllegalArgumentException("Formule del goal non possono essere null");
        }

        LOGGER.fine("Avvio ricerca " + start + " = " + target + " [" + parameters + ", assiomi="
                + axioms.size() + "]");

        SearchStatistics statistics = new SearchStatistics();
        FreshNameGenerator freshNames = FreshNameGenerator.avoiding(axioms, start, target);
        SuccessorGenerator generator = new SuccessorGenerator(freshNames);

        Deque<Formula> frontier = new ArrayDeque<>();
        Map<String, SearchNode> discovered = new HashMap<>();

        String startKey = start.toCanonicalString();
        String targetKey = target.toCanonicalString();

        frontier.add(start);
        discovered.put(startKey, new SearchNode(start, 0, null, null));
        statistics.recordDiscovered();
        statistics.recordFrontierSize(frontier.size());

        while (!frontier.isEmpty()) {
            Formula current = frontier.poll();
            String currentKey = current.toCanonicalString();
            SearchNode currentNode = discovered.get(currentKey);
            statistics.recordExplored(currentNode.depth);

            if (currentKey.equals(targetKey)) {
                List<RewriteStep> path = reconstructPath(discovered, currentKey, startKey);
                statistics.stopTimer();
                LOGGER.fine("Obiettivo raggiunto in " + path.size() + " passi dopo "
                        + statistics.getStatesExplored() + " stati");
                return ProofResult.proved(start, target, path, parameters.getMaxSearchDepth(), statistics);
            }

            if (currentNode.depth >= parameters.getMaxSearchDepth()) {
                statistics.recordPrunedByDepth();
                continue;
            }
            if (current.canonicalLength() > parameters.getMaxTreeSize()) {
                statistics.recordPrunedBySize();
                continue;
            }

            expand(current, currentNode, generator, frontier, discovered, statistics);
        }

        statistics.stopTimer();
        LOGGER.fine("Nessun percorso entro " + parameters.getMaxSearchDepth() + " passi dopo "
                + statistics.getStatesExplored() + " stati");
        return ProofResult.notProved(start, target, parameters.getMaxSearchDepth(), statistics);
    }

    public SearchParameters getParameters() {
        return parameters;
    }

    public List<Axiom> getAxioms() {
        return axioms;
    }

    //endregion

    //region ESPANSIONE

    /**
     * Accoda i successori non ancora visti. La prima scoperta vince.
     */
    private void expand(Formula current, SearchNode currentNode, SuccessorGenerator generator,
                        Deque<Formula> frontier, Map<String, SearchNode> discovered,
                        SearchStatistics statistics) {
        List<RewriteStep> successors = generator.allSuccessors(axioms, current);
        statistics.recordSuccessors(successors.size());

        for (RewriteStep successor : successors) {
            Formula next = successor.getFormula();
            String nextKey = next.toCanonicalString();
            if (discovered.containsKey(nextKey)) {
                statistics.recordDuplicate();
                continue;
            }
            discovered.put(nextKey, new SearchNode(next, currentNode.depth + 1,
                    successor.getAxiomName(), current.toCanonicalString()));
            frontier.add(next);
            statistics.recordDiscovered();
            LOGGER.finest(() -> "Scoperto " + nextKey + " w/ " + successor.getAxiomName());
        }
        statistics.recordFrontierSize(frontier.size());
    }

    //endregion

    //region RICOSTRUZIONE PERCORSO

    /**
     * Segue i puntatori ai padri dall'obiettivo alla partenza e inverte la sequenza.
     *
     * @throws IllegalStateException se la catena dei padri è interrotta
     */
    private List<RewriteStep> reconstructPath(Map<String, SearchNode> discovered, String reachedKey,
                                              String startKey) {
        List<RewriteStep> path = new ArrayList<>();
        String key = reachedKey;
        while (!key.equals(startKey)) {
            SearchNode node = discovered.get(key);
            if (node == null || node.parentKey == null) {
                throw new IllegalStateException("Catena dei padri interrotta in " + key);
            }
            path.add(new RewriteStep(node.ruleName, node.formula));
            key = node.parentKey;
        }
        Collections.reverse(path);
        return path;
    }

    //endregion
}
