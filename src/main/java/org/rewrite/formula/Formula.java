package org.rewrite.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * FORMULA - Albero immutabile della logica algebrica a due valori
 *
 * Rappresenta le formule su cui opera il motore di riscrittura. Ogni nodo è un valore:
 * nessuna trasformazione modifica un albero esistente, ogni passo di riscrittura
 * produce un nuovo albero che condivide i sottoalberi non toccati.
 *
 * TIPI DI NODO:
 * - PRIMITIVE: costante 0 oppure 1 (foglia)
 * - VARIABLE: identificatore scritto dall'utente, variabile di pattern negli assiomi (foglia)
 * - UNRESOLVED: segnaposto ?nome introdotto da una riscrittura non vincolata (foglia)
 * - OPERATION: operatore ~ (unario), * oppure + (binari) con figli
 *
 * FORMA CANONICA:
 * - Notazione prefissa completamente parentesizzata: (* a (~ 1)), ?3, x, 0
 * - Due formule sono lo stesso stato se e solo se hanno forma canonica identica
 * - equals/hashCode delegano alla forma canonica, calcolata una sola volta per nodo
 * - La forma canonica è rileggibile dal loader e produce un albero identico
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati. Insieme chiuso: ogni switch sul tipo è esaustivo.
     */
    public enum Kind {
        PRIMITIVE,      // 0, 1
        VARIABLE,       // x, y, abc_1
        UNRESOLVED,     // ?0, ?1 ...
        OPERATION       // (~ a), (* a b), (+ a b)
    }

    /**
     * Operatori del linguaggio. L'arità è determinata dal simbolo.
     */
    public enum Operator {
        NEGATION("~", 1),
        PRODUCT("*", 2),
        SUM("+", 2);

        private final String symbol;
        private final int arity;

        Operator(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String symbol() {
            return symbol;
        }

        public int arity() {
            return arity;
        }

        /**
         * Risolve il simbolo testuale nell'operatore corrispondente.
         *
         * @param symbol uno tra "~", "*", "+"
         * @return operatore corrispondente
         * @throws IllegalArgumentException se il simbolo non è un operatore
         */
        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Operatore sconosciuto: " + symbol);
        }
    }

    /** Prefisso testuale dei segnaposto nella forma canonica */
    public static final String UNRESOLVED_PREFIX = "?";

    /** Parole chiave del linguaggio dei programmi, non utilizzabili come variabili */
    private static final Set<String> RESERVED_WORDS = Set.of("axiom", "prove", "param", "true", "false");

    private static final Formula FALSE = new Formula(Kind.PRIMITIVE, "0", null, List.of());
    private static final Formula TRUE = new Formula(Kind.PRIMITIVE, "1", null, List.of());

    /** Tipo del nodo */
    private final Kind kind;

    /** Bit per PRIMITIVE, nome per VARIABLE/UNRESOLVED, simbolo per OPERATION */
    private final String token;

    /** Operatore (solo per OPERATION) */
    private final Operator operator;

    /** Figli in ordine (vuota per le foglie) */
    private final List<Formula> children;

    /** Forma canonica calcolata alla prima richiesta */
    private String canonical;

    //endregion

    //region COSTRUZIONE

    private Formula(Kind kind, String token, Operator operator, List<Formula> children) {
        this.kind = kind;
        this.token = token;
        this.operator = operator;
        this.children = children;
    }

    /**
     * Costante primitiva.
     *
     * @param bit 0 oppure 1
     * @throws IllegalArgumentException per qualunque altro valore
     */
    public static Formula primitive(int bit) {
        return switch (bit) {
            case 0 -> FALSE;
            case 1 -> TRUE;
            default -> throw new IllegalArgumentException("Primitiva non valida: " + bit);
        };
    }

    /**
     * Variabile con nome scritto dall'utente.
     *
     * @param name identificatore [A-Za-z_][A-Za-z0-9_]*, diverso dalle parole chiave
     * @throws IllegalArgumentException se il nome non è un identificatore o è riservato
     */
    public static Formula variable(String name) {
        if (!isIdentifier(name) || RESERVED_WORDS.contains(name)) {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
        return new Formula(Kind.VARIABLE, name, null, List.of());
    }

    /**
     * Segnaposto non risolto. Il nome viene passato senza il prefisso '?'.
     *
     * @param name nome alfanumerico del segnaposto
     * @throws IllegalArgumentException se il nome è vuoto o contiene caratteri non ammessi
     */
    public static Formula unresolved(String name) {
        if (name == null || name.isEmpty() || !name.chars().allMatch(c -> c == '_' || isAsciiLetterOrDigit(c))) {
            throw new IllegalArgumentException("Nome segnaposto non valido: " + name);
        }
        return new Formula(Kind.UNRESOLVED, name, null, List.of());
    }

    /**
     * Nodo operatore con figli. Il numero di figli deve coincidere con l'arità.
     *
     * @param operator operatore del nodo
     * @param children figli nell'ordine del testo
     * @throws IllegalArgumentException se operatore o figli sono null o l'arità non coincide
     */
    public static Formula operation(Operator operator, List<Formula> children) {
        if (operator == null) {
            throw new IllegalArgumentException("Operatore non può essere null");
        }
        if (children == null) {
            throw new IllegalArgumentException("Figli null per operatore " + operator.symbol());
        }
        for (Formula child : children) {
            if (child == null) {
                throw new IllegalArgumentException("Figlio null per operatore " + operator.symbol());
            }
        }
        if (children.size() != operator.arity()) {
            throw new IllegalArgumentException("Operatore " + operator.symbol() + " richiede "
                    + operator.arity() + " figli, ricevuti " + children.size());
        }
        return new Formula(Kind.OPERATION, operator.symbol(), operator, List.copyOf(children));
    }

    public static Formula not(Formula operand) {
        return operation(Operator.NEGATION, Arrays.asList(operand));
    }

    public static Formula product(Formula left, Formula right) {
        return operation(Operator.PRODUCT, Arrays.asList(left, right));
    }

    public static Formula sum(Formula left, Formula right) {
        return operation(Operator.SUM, Arrays.asList(left, right));
    }

    //endregion

    //region ACCESSO E TRASFORMAZIONE

    public Kind kind() {
        return kind;
    }

    /**
     * @return "0"/"1" per le primitive, il nome per variabili e segnaposto (senza '?'),
     *         il simbolo per gli operatori
     */
    public String token() {
        return token;
    }

    /** @return operatore del nodo, null se il nodo è una foglia */
    public Operator operator() {
        return operator;
    }

    /** @return vista non modificabile dei figli */
    public List<Formula> children() {
        return children;
    }

    public Formula child(int index) {
        return children.get(index);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Restituisce una copia del nodo in cui solo il figlio indicato è sostituito.
     * Gli altri figli sono condivisi: sono valori immutabili.
     *
     * @param index posizione del figlio da sostituire
     * @param replacement nuovo sottoalbero
     * @return nuovo nodo con un solo figlio cambiato
     * @throws IllegalArgumentException se il nodo è una foglia o l'indice è fuori intervallo
     */
    public Formula withChild(int index, Formula replacement) {
        if (kind != Kind.OPERATION || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException("Indice figlio " + index + " non valido per " + this);
        }
        List<Formula> replaced = new ArrayList<>(children);
        replaced.set(index, replacement);
        return operation(operator, replaced);
    }

    /** @return numero totale di nodi dell'albero */
    public int size() {
        int count = 1;
        for (Formula child : children) {
            count += child.size();
        }
        return count;
    }

    /** @return profondità dell'albero (una foglia ha profondità 1) */
    public int depth() {
        int deepest = 0;
        for (Formula child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }

    /**
     * Raccoglie i nomi dei segnaposto presenti nell'albero, in ordine di visita.
     *
     * @return lista senza duplicati dei nomi (senza '?')
     */
    public List<String> unresolvedNames() {
        List<String> names = new ArrayList<>();
        collectUnresolved(this, names);
        return Collections.unmodifiableList(names);
    }

    private static void collectUnresolved(Formula node, List<String> names) {
        if (node.kind == Kind.UNRESOLVED) {
            if (!names.contains(node.token)) {
                names.add(node.token);
            }
            return;
        }
        for (Formula child : node.children) {
            collectUnresolved(child, names);
        }
    }

    //endregion

    //region FORMA CANONICA

    /**
     * Serializzazione deterministica e iniettiva dell'albero.
     * È l'identità dello stato durante la ricerca.
     *
     * @return forma canonica, es. "(+ (~ x) ?2)"
     */
    public String toCanonicalString() {
        String cached = canonical;
        if (cached == null) {
            StringBuilder builder = new StringBuilder();
            appendCanonical(builder);
            cached = builder.toString();
            canonical = cached;
        }
        return cached;
    }

    private void appendCanonical(StringBuilder builder) {
        switch (kind) {
            case PRIMITIVE, VARIABLE -> builder.append(token);
            case UNRESOLVED -> builder.append(UNRESOLVED_PREFIX).append(token);
            case OPERATION -> {
                builder.append('(').append(token);
                for (Formula child : children) {
                    builder.append(' ');
                    if (child.canonical != null) {
                        builder.append(child.canonical);
                    } else {
                        child.appendCanonical(builder);
                    }
                }
                builder.append(')');
            }
        }
    }

    /** @return lunghezza della forma canonica, usata come stima economica della dimensione */
    public int canonicalLength() {
        return toCanonicalString().length();
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    /**
     * Uguaglianza per forma canonica: isomorfi con nomi di segnaposto diversi sono stati diversi.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return toCanonicalString().equals(other.toCanonicalString());
    }

    @Override
    public int hashCode() {
        return toCanonicalString().hashCode();
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }

    //endregion

    //region UTILITY

    /**
     * Verifica la sintassi degli identificatori: [A-Za-z_][A-Za-z0-9_]*
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (first != '_' && !isAsciiLetter(first)) {
            return false;
        }
        return name.chars().allMatch(c -> c == '_' || isAsciiLetterOrDigit(c));
    }

    private static boolean isAsciiLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiLetterOrDigit(int c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9');
    }

    //endregion
}
