package org.rewrite.support;

import org.rewrite.formula.Axiom;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * BASE DI CONOSCENZA - Sequenza ordinata e append-only di assiomi
 *
 * Contiene gli assiomi nell'ordine in cui i comandi axiom (e gli eventuali lemmi)
 * vengono elaborati. La ricerca riceve sempre uno snapshot dell'intera lista corrente;
 * lookup per nome serve solo alla diagnostica.
 */
public class AxiomStore {

    private static final Logger LOGGER = Logger.getLogger(AxiomStore.class.getName());

    private final List<Axiom> axioms = new ArrayList<>();

    public AxiomStore() {
    }

    public AxiomStore(Collection<Axiom> initialAxioms) {
        initialAxioms.forEach(this::append);
    }

    /**
     * Aggiunge un assioma in coda. Nomi duplicati sono ammessi: lookup restituisce il primo.
     *
     * @param axiom assioma da aggiungere (non null)
     */
    public void append(Axiom axiom) {
        if (axiom == null) {
            throw new IllegalArgumentException("Assioma null non ammesso");
        }
        if (contains(axiom.getName())) {
            LOGGER.warning("Assioma con nome duplicato: " + axiom.getName());
        }
        axioms.add(axiom);
        LOGGER.fine("Assioma aggiunto [" + axioms.size() + "]: " + axiom);
    }

    /**
     * Cerca il primo assioma con il nome indicato.
     *
     * @param name nome dell'assioma
     * @return assioma trovato
     * @throws IllegalArgumentException se nessun assioma ha quel nome
     */
    public Axiom lookup(String name) {
        for (Axiom axiom : axioms) {
            if (axiom.getName().equals(name)) {
                return axiom;
            }
        }
        throw new IllegalArgumentException("Nessun assioma con nome: " + name);
    }

    public boolean contains(String name) {
        return axioms.stream().anyMatch(axiom -> axiom.getName().equals(name));
    }

    /** @return copia immutabile della lista corrente, nell'ordine di inserimento */
    public List<Axiom> snapshot() {
        return List.copyOf(axioms);
    }

    public int size() {
        return axioms.size();
    }

    /** @return numero di lemmi ottenuti da dimostrazioni */
    public long lemmaCount() {
        return axioms.stream().filter(Axiom::isLemma).count();
    }
}
