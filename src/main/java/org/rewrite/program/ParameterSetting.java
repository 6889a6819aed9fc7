package org.rewrite.program;

import org.rewrite.support.SearchParameters.Parameter;

/**
 * param chiave valore.
 *
 * Il valore è un Integer per i limiti e un Boolean per use_proofs_as_axioms,
 * già verificato dal caricatore.
 */
public final class ParameterSetting implements Command {

    private final Parameter parameter;
    private final Object value;
    private final int line;

    /**
     * @param parameter parametro da impostare
     * @param value valore del tipo richiesto dal parametro
     * @param line riga del comando
     * @throws IllegalArgumentException se il tipo del valore non corrisponde
     */
    public ParameterSetting(Parameter parameter, Object value, int line) {
        if (parameter == null || !parameter.valueType().isInstance(value)) {
            throw new IllegalArgumentException("Valore " + value + " non valido per il parametro " + parameter);
        }
        this.parameter = parameter;
        this.value = value;
        this.line = line;
    }

    public Parameter getParameter() {
        return parameter;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.PARAM;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "param " + parameter.key() + " " + value + ".";
    }
}
