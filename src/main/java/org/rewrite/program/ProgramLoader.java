package org.rewrite.program;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;
import org.rewrite.formula.FormulaTreeBuilder;
import org.rewrite.parser.RewriteProgramBaseVisitor;
import org.rewrite.parser.RewriteProgramLexer;
import org.rewrite.parser.RewriteProgramParser;
import org.rewrite.parser.RewriteProgramParser.AxiomCommandContext;
import org.rewrite.parser.RewriteProgramParser.BooleanValueContext;
import org.rewrite.parser.RewriteProgramParser.CommandContext;
import org.rewrite.parser.RewriteProgramParser.IntegerValueContext;
import org.rewrite.parser.RewriteProgramParser.ParamCommandContext;
import org.rewrite.parser.RewriteProgramParser.ProgramContext;
import org.rewrite.parser.RewriteProgramParser.ProveCommandContext;
import org.rewrite.support.SearchParameters.Parameter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CARICATORE PROGRAMMI - Testo del programma -> sequenza di comandi
 *
 * PIPELINE:
 * 1. Lexing e parsing con la grammatica ANTLR RewriteProgram
 * 2. Costruzione delle formule con {@link FormulaTreeBuilder}
 * 3. Validazione semantica dei comandi param (chiave nota, tipo del valore)
 *
 * Il caricamento è tutto-o-niente: il primo errore lessicale, sintattico o semantico
 * interrompe il caricamento con {@link ProgramLoadException} e nessun comando viene restituito.
 */
public final class ProgramLoader {

    private static final Logger LOGGER = Logger.getLogger(ProgramLoader.class.getName());

    private ProgramLoader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Carica un programma completo.
     *
     * @param text testo del programma
     * @return comandi nell'ordine del testo
     * @throws ProgramLoadException al primo errore, con riga e colonna
     */
    public static List<Command> load(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo del programma non può essere null");
        }
        SourceText source = new SourceText(text);
        RewriteProgramParser parser = createParser(source);

        ProgramContext program = parser.program();
        CommandBuilder builder = new CommandBuilder(source);

        List<Command> commands = new ArrayList<>();
        for (CommandContext commandCtx : program.command()) {
            commands.add(builder.visit(commandCtx));
        }

        LOGGER.fine("Programma caricato: " + commands.size() + " comandi");
        return commands;
    }

    /**
     * Carica un programma da file (UTF-8).
     *
     * @throws IOException se il file non è leggibile
     * @throws ProgramLoadException se il testo è malformato
     */
    public static List<Command> loadFile(Path path) throws IOException {
        LOGGER.info("Lettura programma: " + path);
        return load(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Carica un programma dal classpath.
     *
     * @param resourceName percorso assoluto della risorsa, senza '/' iniziale
     * @throws IOException se la risorsa non esiste o non è leggibile
     */
    public static List<Command> loadResource(String resourceName) throws IOException {
        ClassLoader classLoader = ProgramLoader.class.getClassLoader();
        try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
            if (input == null) {
                throw new IOException("Risorsa non trovata: " + resourceName);
            }
            return load(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    /**
     * Legge una singola formula, ad esempio una forma canonica.
     *
     * @param text formula in notazione prefissa
     * @return albero corrispondente
     * @throws ProgramLoadException se il testo non è una formula ben formata
     */
    public static Formula parseFormula(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        SourceText source = new SourceText(text);
        RewriteProgramParser parser = createParser(source);
        return new FormulaTreeBuilder().visit(parser.singleFormula());
    }

    //endregion

    //region SETUP PIPELINE ANTLR

    private static RewriteProgramParser createParser(SourceText source) {
        CharStream input = CharStreams.fromString(source.text());
        FailFastErrorListener errorListener = new FailFastErrorListener(source);

        RewriteProgramLexer lexer = new RewriteProgramLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        RewriteProgramParser parser = new RewriteProgramParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser;
    }

    /**
     * Trasforma il primo errore di lexer o parser in {@link ProgramLoadException}.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final SourceText source;

        FailFastErrorListener(SourceText source) {
            this.source = source;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ProgramLoadException(msg, line, charPositionInLine + 1, source.line(line));
        }
    }

    //endregion

    //region COSTRUZIONE COMANDI

    /**
     * Visitor dei comandi: delega le formule a {@link FormulaTreeBuilder}.
     */
    private static final class CommandBuilder extends RewriteProgramBaseVisitor<Command> {

        private final SourceText source;
        private final FormulaTreeBuilder formulas = new FormulaTreeBuilder();

        CommandBuilder(SourceText source) {
            this.source = source;
        }

        @Override
        public Command visitAxiomCommand(AxiomCommandContext ctx) {
            String name = ctx.IDENTIFIER().getText();
            Formula lhs = formulas.visit(ctx.formula(0));
            Formula rhs = formulas.visit(ctx.formula(1));
            return new AxiomDeclaration(new Axiom(name, lhs, rhs), ctx.getStart().getLine());
        }

        @Override
        public Command visitProveCommand(ProveCommandContext ctx) {
            Formula start = formulas.visit(ctx.formula(0));
            Formula target = formulas.visit(ctx.formula(1));
            return new ProveGoal(start, target, ctx.getStart().getLine());
        }

        @Override
        public Command visitParamCommand(ParamCommandContext ctx) {
            Token keyToken = ctx.IDENTIFIER().getSymbol();
            Parameter parameter;
            try {
                parameter = Parameter.fromKey(keyToken.getText());
            } catch (IllegalArgumentException e) {
                throw errorAt(keyToken, e.getMessage());
            }

            Object value = parseValue(ctx, parameter);
            return new ParameterSetting(parameter, value, ctx.getStart().getLine());
        }

        private Object parseValue(ParamCommandContext ctx, Parameter parameter) {
            Token valueToken = ctx.value().getStart();

            if (ctx.value() instanceof BooleanValueContext) {
                if (parameter.valueType() != Boolean.class) {
                    throw errorAt(valueToken, "Il parametro " + parameter.key() + " richiede un intero");
                }
                return ((BooleanValueContext) ctx.value()).TRUE() != null;
            }

            if (ctx.value() instanceof IntegerValueContext) {
                if (parameter.valueType() != Integer.class) {
                    throw errorAt(valueToken, "Il parametro " + parameter.key() + " richiede true o false");
                }
                String digits = joinAdjacentDigits((IntegerValueContext) ctx.value());
                try {
                    return Integer.parseInt(digits);
                } catch (NumberFormatException e) {
                    throw errorAt(valueToken, "Valore intero fuori intervallo: " + digits);
                }
            }

            throw errorAt(valueToken, "Valore non riconosciuto: " + valueToken.getText());
        }

        /**
         * Ricompone un intero dalle cifre, che il lexer emette come token singoli
         * perché nelle formule 0 e 1 sono primitive distinte anche se adiacenti.
         *
         * @throws ProgramLoadException se tra due cifre c'è spazio o un commento
         */
        private String joinAdjacentDigits(IntegerValueContext integerValue) {
            StringBuilder digits = new StringBuilder();
            Token previous = null;
            for (int i = 0; i < integerValue.getChildCount(); i++) {
                Token digit = ((TerminalNode) integerValue.getChild(i)).getSymbol();
                if (previous != null && digit.getStartIndex() != previous.getStopIndex() + 1) {
                    throw errorAt(digit, "Valore intero interrotto da spazi");
                }
                digits.append(digit.getText());
                previous = digit;
            }
            return digits.toString();
        }

        private ProgramLoadException errorAt(Token token, String reason) {
            return new ProgramLoadException(reason, token.getLine(), token.getCharPositionInLine() + 1,
                    source.line(token.getLine()));
        }
    }

    //endregion

    //region SUPPORTO

    /**
     * Testo sorgente con accesso per riga, per i messaggi di errore.
     */
    private static final class SourceText {

        /** Testo completo passato al lexer */
        private final String text;

        /** Righe del testo, senza terminatori */
        private final String[] lines;

        SourceText(String text) {
            this.text = text;
            this.lines = text.split("\r?\n", -1);
        }

        String text() {
            return text;
        }

        /**
         * @param lineNumber numero di riga 1-based, come riportato da ANTLR
         * @return contenuto della riga, vuoto se fuori intervallo
         */
        String line(int lineNumber) {
            if (lineNumber < 1 || lineNumber > lines.length) {
                return "";
            }
            return lines[lineNumber - 1];
        }
    }

    //endregion
}
