package org.rewrite.program;

import org.rewrite.formula.Axiom;

/**
 * axiom nome : lhs = rhs.
 */
public final class AxiomDeclaration implements Command {

    private final Axiom axiom;
    private final int line;

    public AxiomDeclaration(Axiom axiom, int line) {
        if (axiom == null) {
            throw new IllegalArgumentException("Dichiarazione senza assioma");
        }
        this.axiom = axiom;
        this.line = line;
    }

    public Axiom getAxiom() {
        return axiom;
    }

    @Override
    public Kind getKind() {
        return Kind.AXIOM;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return axiom.toString();
    }
}
