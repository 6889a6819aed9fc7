package org.rewrite.engine;

import org.rewrite.formula.Formula;

import java.util.Objects;

/**
 * Passo di riscrittura: formula ottenuta e nome dell'assioma applicato.
 * Usato sia per i successori generati sia per i passi del percorso di prova.
 */
public final class RewriteStep {

    /** Nome dell'assioma applicato */
    private final String axiomName;

    /** Formula risultante dal passo */
    private final Formula formula;

    public RewriteStep(String axiomName, Formula formula) {
        if (axiomName == null || formula == null) {
            throw new IllegalArgumentException("Passo di riscrittura incompleto");
        }
        this.axiomName = axiomName;
        this.formula = formula;
    }

    public String getAxiomName() {
        return axiomName;
    }

    public Formula getFormula() {
        return formula;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RewriteStep)) {
            return false;
        }
        RewriteStep other = (RewriteStep) obj;
        return axiomName.equals(other.axiomName) && formula.equals(other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axiomName, formula);
    }

    @Override
    public String toString() {
        return "-> " + formula + "  w/ " + axiomName;
    }
}
