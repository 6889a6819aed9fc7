package org.rewrite.formula;

import java.util.Objects;

/**
 * ASSIOMA - Equivalenza non orientata con nome
 *
 * Entrambe le direzioni lhs -> rhs e rhs -> lhs sono passi di riscrittura legali.
 * Le variabili dei due lati sono variabili di pattern: quelle presenti solo nel lato
 * di arrivo generano segnaposto freschi durante l'istanziazione.
 *
 * ORIGINE:
 * • comando axiom del programma (o della libreria standard)
 * • dimostrazione riuscita con use_proofs_as_axioms attivo (lemma)
 *
 * Mai modificato dopo la creazione.
 */
public final class Axiom {

    /** Prefisso del nome dei lemmi ottenuti da dimostrazioni */
    public static final String LEMMA_PREFIX = "proof of ";

    //region ATTRIBUTI

    /**
     * Nome dell'assioma, usato per etichettare i passi della prova.
     * Non univoco: più assiomi possono condividere lo stesso nome.
     */
    private final String name;

    /**
     * Lato sinistro dell'equazione.
     */
    private final Formula lhs;

    /**
     * Lato destro dell'equazione.
     */
    private final Formula rhs;

    //endregion

    //region COSTRUZIONE

    /**
     * @param name nome non vuoto
     * @param lhs lato sinistro (non null)
     * @param rhs lato destro (non null)
     * @throws IllegalArgumentException se un componente manca
     */
    public Axiom(String name, Formula lhs, Formula rhs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome assioma non può essere null o vuoto");
        }
        if (lhs == null || rhs == null) {
            throw new IllegalArgumentException("Lati dell'assioma " + name + " non possono essere null");
        }
        this.name = name;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Costruisce il lemma "proof of start = target" da una dimostrazione riuscita.
     *
     * @param start formula di partenza del goal dimostrato
     * @param target formula di arrivo del goal dimostrato
     * @return nuovo assioma con lhs = start e rhs = target
     */
    public static Axiom lemma(Formula start, Formula target) {
        return new Axiom(LEMMA_PREFIX + start + " = " + target, start, target);
    }

    //endregion

    //region ACCESSORS

    public String getName() {
        return name;
    }

    public Formula getLhs() {
        return lhs;
    }

    public Formula getRhs() {
        return rhs;
    }

    /** @return true se l'assioma deriva da una dimostrazione */
    public boolean isLemma() {
        return name.startsWith(LEMMA_PREFIX);
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Axiom)) {
            return false;
        }
        Axiom other = (Axiom) obj;
        return name.equals(other.name) && lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lhs, rhs);
    }

    @Override
    public String toString() {
        return "axiom " + name + " : " + lhs + " = " + rhs + ".";
    }
}
