package org.rewrite.program;

import org.rewrite.engine.ProofResult;
import org.rewrite.engine.ProofSearchEngine;
import org.rewrite.engine.RewriteStep;
import org.rewrite.formula.Axiom;
import org.rewrite.support.AxiomStore;
import org.rewrite.support.SearchParameters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ESECUTORE PROGRAMMI - Elaborazione sequenziale dei comandi caricati
 *
 * Mantiene la configurazione corrente (base di conoscenza + parametri di ricerca) e la
 * fa evolvere strettamente nell'ordine del programma: assiomi e parametri influenzano
 * solo i goal che li seguono nel testo.
 *
 * PER OGNI COMANDO:
 * - axiom: aggiunta in coda alla base di conoscenza
 * - param: sostituzione dei parametri correnti con una copia aggiornata
 * - prove: nuova ricerca BFS su uno snapshot degli assiomi e dei parametri correnti;
 *   se use_proofs_as_axioms è attivo e il goal riesce, il lemma viene aggiunto alla base
 *
 * Un goal non dimostrato è un esito normale e non interrompe i goal successivi.
 */
public class ProgramExecutor {

    private static final Logger LOGGER = Logger.getLogger(ProgramExecutor.class.getName());

    private final AxiomStore axiomStore;
    private SearchParameters parameters;

    public ProgramExecutor() {
        this(List.of());
    }

    /**
     * @param preloadedAxioms assiomi disponibili prima del primo comando (es. libreria standard)
     */
    public ProgramExecutor(Collection<Axiom> preloadedAxioms) {
        this.axiomStore = new AxiomStore(preloadedAxioms);
        this.parameters = SearchParameters.DEFAULTS;
    }

    //region ESECUZIONE

    /**
     * Esegue tutti i comandi in ordine.
     *
     * @param commands comandi caricati
     * @return esiti dei goal prove, nell'ordine del programma
     */
    public List<ProofResult> execute(List<Command> commands) {
        return execute(commands, result -> { });
    }

    /**
     * Esegue tutti i comandi in ordine notificando ogni esito appena disponibile.
     *
     * @param commands comandi caricati
     * @param onGoal callback invocata dopo ogni goal prove
     * @return esiti dei goal prove, nell'ordine del programma
     */
    public List<ProofResult> execute(List<Command> commands, Consumer<ProofResult> onGoal) {
        List<ProofResult> results = new ArrayList<>();
        for (Command command : commands) {
            switch (command.getKind()) {
                case AXIOM -> declareAxiom((AxiomDeclaration) command);
                case PARAM -> applyParameter((ParameterSetting) command);
                case PROVE -> {
                    ProofResult result = prove((ProveGoal) command);
                    results.add(result);
                    onGoal.accept(result);
                }
            }
        }
        LOGGER.info("Programma eseguito: " + results.size() + " goal, "
                + results.stream().filter(ProofResult::isSuccess).count() + " dimostrati");
        return results;
    }

    private void declareAxiom(AxiomDeclaration declaration) {
        axiomStore.append(declaration.getAxiom());
    }

    private void applyParameter(ParameterSetting setting) {
        parameters = parameters.with(setting.getParameter(), setting.getValue());
        LOGGER.fine("Parametri aggiornati (riga " + setting.getLine() + "): " + parameters);
    }

    /**
     * Esegue un singolo goal con la configurazione corrente.
     */
    private ProofResult prove(ProveGoal goal) {
        LOGGER.info("Goal riga " + goal.getLine() + ": " + goal);

        ProofSearchEngine engine = new ProofSearchEngine(axiomStore.snapshot(), parameters);
        ProofResult result = engine.prove(goal.getStart(), goal.getTarget());
        LOGGER.info(result.toCompactString());

        if (result.isSuccess()) {
            logPathDiagnostics(result);
            if (parameters.isUseProofsAsAxioms()) {
                Axiom lemma = Axiom.lemma(goal.getStart(), goal.getTarget());
                axiomStore.append(lemma);
                LOGGER.fine("Lemma aggiunto: " + lemma.getName());
            }
        }
        return result;
    }

    /**
     * Riporta a livello FINE la definizione dell'assioma usato in ogni passo.
     */
    private void logPathDiagnostics(ProofResult result) {
        if (!LOGGER.isLoggable(Level.FINE)) {
            return;
        }
        for (RewriteStep step : result.getPath()) {
            LOGGER.fine(step + "  [" + axiomStore.lookup(step.getAxiomName()) + "]");
        }
    }

    //endregion

    //region STATO CORRENTE

    public SearchParameters getParameters() {
        return parameters;
    }

    public AxiomStore getAxiomStore() {
        return axiomStore;
    }

    //endregion
}
