package org.rewrite.formula;

import org.rewrite.parser.RewriteProgramBaseVisitor;
import org.rewrite.parser.RewriteProgramParser.BinaryOperationContext;
import org.rewrite.parser.RewriteProgramParser.FalsePrimitiveContext;
import org.rewrite.parser.RewriteProgramParser.SingleFormulaContext;
import org.rewrite.parser.RewriteProgramParser.TruePrimitiveContext;
import org.rewrite.parser.RewriteProgramParser.UnaryOperationContext;
import org.rewrite.parser.RewriteProgramParser.UnresolvedContext;
import org.rewrite.parser.RewriteProgramParser.VariableContext;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DI FORMULE - Visitor dall'albero sintattico ANTLR all'albero {@link Formula}
 *
 * Conversione bottom-up: ogni alternativa etichettata della regola formula produce
 * il nodo corrispondente. La grammatica garantisce già l'arità degli operatori.
 */
public class FormulaTreeBuilder extends RewriteProgramBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    @Override
    public Formula visitSingleFormula(SingleFormulaContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitUnaryOperation(UnaryOperationContext ctx) {
        return Formula.not(visit(ctx.formula()));
    }

    @Override
    public Formula visitBinaryOperation(BinaryOperationContext ctx) {
        Formula.Operator operator = ctx.AND() != null ? Formula.Operator.PRODUCT : Formula.Operator.SUM;
        Formula left = visit(ctx.formula(0));
        Formula right = visit(ctx.formula(1));
        return Formula.operation(operator, List.of(left, right));
    }

    @Override
    public Formula visitFalsePrimitive(FalsePrimitiveContext ctx) {
        return Formula.primitive(0);
    }

    @Override
    public Formula visitTruePrimitive(TruePrimitiveContext ctx) {
        return Formula.primitive(1);
    }

    @Override
    public Formula visitVariable(VariableContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        LOGGER.finest("Variabile: " + name);
        return Formula.variable(name);
    }

    @Override
    public Formula visitUnresolved(UnresolvedContext ctx) {
        // Il token include il prefisso '?'
        String text = ctx.UNRESOLVED().getText();
        return Formula.unresolved(text.substring(Formula.UNRESOLVED_PREFIX.length()));
    }
}
