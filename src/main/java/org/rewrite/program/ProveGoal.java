package org.rewrite.program;

import org.rewrite.formula.Formula;

/**
 * prove start = target.
 */
public final class ProveGoal implements Command {

    private final Formula start;
    private final Formula target;
    private final int line;

    public ProveGoal(Formula start, Formula target, int line) {
        if (start == null || target == null) {
            throw new IllegalArgumentException("Goal senza formule");
        }
        this.start = start;
        this.target = target;
        this.line = line;
    }

    /** @return formula di partenza della ricerca */
    public Formula getStart() {
        return start;
    }

    /** @return formula da raggiungere */
    public Formula getTarget() {
        return target;
    }

    @Override
    public Kind getKind() {
        return Kind.PROVE;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "prove " + start + " = " + target + ".";
    }
}
