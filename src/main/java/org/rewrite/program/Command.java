package org.rewrite.program;

/**
 * Comando di un programma caricato. Le varianti sono elencate da {@link Kind} e
 * l'esecutore le distingue con uno switch sul tipo.
 */
public interface Command {

    /**
     * Tipi di comando del linguaggio.
     */
    enum Kind {
        AXIOM,
        PROVE,
        PARAM
    }

    Kind getKind();

    /** @return riga (1-based) del testo in cui inizia il comando */
    int getLine();
}
