package org.rewrite.program;

/**
 * ERRORE DI CARICAMENTO - Testo del programma malformato
 *
 * Errore fatale: il caricamento è tutto-o-niente, nessun comando viene eseguito.
 * Riporta la posizione (riga e colonna, entrambe 1-based) e la riga sorgente
 * per produrre un messaggio con il cursore sotto il punto dell'errore.
 */
public class ProgramLoadException extends RuntimeException {

    private final int line;
    private final int column;
    private final String sourceLine;
    private final String reason;

    public ProgramLoadException(String reason, int line, int column, String sourceLine) {
        super("Errore (riga " + line + ", colonna " + column + "): " + reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.sourceLine = sourceLine != null ? sourceLine : "";
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /** @return messaggio senza posizione */
    public String getReason() {
        return reason;
    }

    /**
     * Messaggio su tre righe: riga sorgente, cursore sotto la colonna, descrizione.
     */
    public String getFormattedMessage() {
        StringBuilder output = new StringBuilder();
        output.append(sourceLine).append('\n');
        output.append(" ".repeat(Math.max(0, column - 1))).append("^\n");
        output.append(getMessage());
        return output.toString();
    }
}
