package org.rewrite.engine;

import org.junit.jupiter.api.Test;
import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;
import org.rewrite.support.FreshNameGenerator;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.rewrite.program.ProgramLoader.parseFormula;

class SuccessorGeneratorTest {

    private static final Axiom COMM = new Axiom("comm", parseFormula("(* x y)"), parseFormula("(* y x)"));

    private final SuccessorGenerator generator = new SuccessorGenerator(new FreshNameGenerator());

    @Test
    void applyAtRewritesOnlyTheRoot() {
        assertEquals("(* 1 0)", generator.applyAt(parseFormula("(* 0 1)"), COMM.getLhs(), COMM.getRhs())
                .orElseThrow().toCanonicalString());
        assertTrue(generator.applyAt(parseFormula("(~ (* 0 1))"), COMM.getLhs(), COMM.getRhs()).isEmpty());
    }

    @Test
    void oneSuccessorPerRewritablePosition() {
        List<RewriteStep> successors = generator.allSuccessorsForRule(
                parseFormula("(* (* 0 1) (* 1 1))"), "comm", COMM.getLhs(), COMM.getRhs());

        assertEquals(List.of("(* (* 1 1) (* 0 1))", "(* (* 1 0) (* 1 1))", "(* (* 0 1) (* 1 1))"),
                canonical(successors));
        assertTrue(successors.stream().allMatch(step -> step.getAxiomName().equals("comm")));
    }

    @Test
    void rewritesInsideNestedPositionsRebuildTheWholeTree() {
        List<RewriteStep> successors = generator.allSuccessorsForRule(
                parseFormula("(~ (~ (* x 0)))"), "comm", COMM.getLhs(), COMM.getRhs());

        assertEquals(List.of("(~ (~ (* 0 x)))"), canonical(successors));
    }

    @Test
    void bothDirectionsOfEveryAxiomAreTried() {
        Axiom negation = new Axiom("neg", parseFormula("(~ 0)"), parseFormula("1"));

        List<RewriteStep> successors = generator.allSuccessors(List.of(negation), parseFormula("(+ (~ 0) 1)"));

        assertEquals(List.of("(+ 1 1)", "(+ (~ 0) (~ 0))"), canonical(successors));
    }

    @Test
    void axiomsAreAppliedInStoreOrder() {
        Axiom negation = new Axiom("neg", parseFormula("(~ 0)"), parseFormula("1"));

        List<RewriteStep> successors = generator.allSuccessors(List.of(COMM, negation), parseFormula("(* (~ 0) 1)"));

        assertEquals(List.of("comm", "comm", "neg", "neg"),
                successors.stream().map(RewriteStep::getAxiomName).collect(Collectors.toList()));
    }

    @Test
    void noAxiomsMeansNoSuccessors() {
        assertTrue(generator.allSuccessors(List.of(), parseFormula("(* 0 1)")).isEmpty());
    }

    @Test
    void rewriteIsReversibleWithoutFreshVariables() {
        Formula start = parseFormula("(+ (* 0 1) x)");
        List<RewriteStep> forward = generator.allSuccessorsForRule(start, "comm", COMM.getLhs(), COMM.getRhs());
        Formula rewritten = forward.get(0).getFormula();

        List<RewriteStep> backward = generator.allSuccessorsForRule(rewritten, "comm", COMM.getRhs(), COMM.getLhs());

        assertTrue(backward.stream().anyMatch(step -> step.getFormula().equals(start)));
    }

    @Test
    void inputFormulaIsNeverModified() {
        Formula start = parseFormula("(* (* 0 1) 1)");

        generator.allSuccessors(List.of(COMM), start);

        assertEquals("(* (* 0 1) 1)", start.toCanonicalString());
    }

    private static List<String> canonical(List<RewriteStep> steps) {
        return steps.stream().map(step -> step.getFormula().toCanonicalString()).collect(Collectors.toList());
    }
}
