package org.rewrite.engine;

import org.junit.jupiter.api.Test;
import org.rewrite.formula.Axiom;
import org.rewrite.formula.Formula;
import org.rewrite.support.SearchParameters;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.rewrite.program.ProgramLoader.parseFormula;

class ProofSearchEngineTest {

    private static final Axiom COMM = new Axiom("comm", parseFormula("(* x y)"), parseFormula("(* y x)"));
    private static final Axiom STEP1 = new Axiom("step1", parseFormula("(~ 0)"), parseFormula("1"));
    private static final Axiom STEP2 = new Axiom("step2", parseFormula("(~ 1)"), parseFormula("0"));

    @Test
    void commutativityProvesSwappedProductInOneStep() {
        ProofResult result = prove(List.of(COMM), SearchParameters.DEFAULTS, "(* 0 1)", "(* 1 0)");

        assertTrue(result.isSuccess());
        assertEquals(1, result.getPathLength());
        assertEquals("comm", result.getPath().get(0).getAxiomName());
        assertEquals("(* 1 0)", result.getPath().get(0).getFormula().toCanonicalString());
        assertEquals(2, result.getStatesExplored());
    }

    @Test
    void identicalFormulasSucceedWithEmptyPath() {
        ProofResult result = prove(List.of(), SearchParameters.DEFAULTS, "0", "0");

        assertTrue(result.isSuccess());
        assertTrue(result.isIdentity());
        assertTrue(result.getPath().isEmpty());
        assertEquals(1, result.getStatesExplored());
    }

    @Test
    void identityHoldsEvenWithZeroBounds() {
        SearchParameters zero = new SearchParameters(0, 0, false);

        ProofResult result = prove(List.of(COMM), zero, "(+ (~ x) ?1)", "(+ (~ x) ?1)");

        assertTrue(result.isIdentity());
    }

    @Test
    void notEquivalentFormulasFailAfterExhaustingTheFrontier() {
        SearchParameters depthThree = SearchParameters.DEFAULTS.with(SearchParameters.Parameter.MAX_SEARCH_DEPTH, 3);

        ProofResult result = prove(List.of(COMM), depthThree, "(* 0 1)", "(* 1 1)");

        assertFalse(result.isSuccess());
        assertTrue(result.getPath().isEmpty());
        assertEquals(2, result.getStatesExplored());
        assertEquals(2, result.getStatistics().getStatesDiscovered());
    }

    @Test
    void zeroDepthExaminesOnlyTheStartState() {
        SearchParameters zeroDepth = SearchParameters.DEFAULTS.with(SearchParameters.Parameter.MAX_SEARCH_DEPTH, 0);

        ProofResult result = prove(List.of(COMM), zeroDepth, "(* 0 1)", "(* 1 0)");

        assertFalse(result.isSuccess());
        assertEquals(1, result.getStatesExplored());
        assertEquals(1, result.getStatistics().getPrunedByDepth());
    }

    @Test
    void shortestPathIsReconstructedInStartToTargetOrder() {
        ProofResult result = prove(List.of(STEP1, STEP2), SearchParameters.DEFAULTS, "(~ (~ 0))", "0");

        assertTrue(result.isSuccess());
        assertEquals(List.of("step1", "step2"),
                result.getPath().stream().map(RewriteStep::getAxiomName).collect(Collectors.toList()));
        assertEquals(List.of("(~ 1)", "0"),
                result.getPath().stream().map(step -> step.getFormula().toCanonicalString()).collect(Collectors.toList()));
    }

    @Test
    void depthBoundBelowShortestPathLengthFails() {
        SearchParameters depthOne = SearchParameters.DEFAULTS.with(SearchParameters.Parameter.MAX_SEARCH_DEPTH, 1);

        ProofResult result = prove(List.of(STEP1, STEP2), depthOne, "(~ (~ 0))", "0");

        assertFalse(result.isSuccess());
        assertEquals(1, result.getMaxSearchDepth());
    }

    @Test
    void pathLengthEqualsTheBfsLayerOfTheTarget() {
        // (+ 0 x) -> (+ x 0) -> x richiede due passi, nessun assioma lo fa in uno
        Axiom commAdd = new Axiom("comm_add", parseFormula("(+ a b)"), parseFormula("(+ b a)"));
        Axiom idenAdd = new Axiom("iden_add", parseFormula("(+ a 0)"), parseFormula("a"));

        ProofResult result = prove(List.of(commAdd, idenAdd), SearchParameters.DEFAULTS, "(+ 0 x)", "x");

        assertTrue(result.isSuccess());
        assertEquals(2, result.getPathLength());
        assertEquals("comm_add", result.getPath().get(0).getAxiomName());
        assertEquals("iden_add", result.getPath().get(1).getAxiomName());
    }

    @Test
    void statesLongerThanMaxTreeSizeAreNotExpanded() {
        Axiom grow = new Axiom("grow", parseFormula("x"), parseFormula("(~ (~ x))"));
        SearchParameters small = SearchParameters.DEFAULTS.with(SearchParameters.Parameter.MAX_TREE_SIZE, 8);

        ProofResult pruned = prove(List.of(grow), small, "0", "(~ (~ (~ (~ 0))))");
        ProofResult found = prove(List.of(grow), SearchParameters.DEFAULTS, "0", "(~ (~ (~ (~ 0))))");

        assertFalse(pruned.isSuccess());
        assertEquals(2, pruned.getStatesExplored());
        assertEquals(1, pruned.getStatistics().getPrunedBySize());
        assertTrue(found.isSuccess());
        assertEquals(2, found.getPathLength());
    }

    @Test
    void unconstrainedVariablesIntroduceFreshPlaceholders() {
        Axiom absorption = new Axiom("abs_add", parseFormula("(+ a (* a b))"), parseFormula("a"));

        ProofResult shrink = prove(List.of(absorption), SearchParameters.DEFAULTS, "(+ x (* x y))", "x");

        assertTrue(shrink.isSuccess());
        assertEquals(1, shrink.getPathLength());
    }

    @Test
    void placeholderNamesAreStateIdentityNotWildcards() {
        Axiom absorption = new Axiom("abs_add", parseFormula("(+ a (* a b))"), parseFormula("a"));
        SearchParameters depthOne = SearchParameters.DEFAULTS.with(SearchParameters.Parameter.MAX_SEARCH_DEPTH, 1);

        // ?0 compare nell'obiettivo: il primo segnaposto coniato è ?1, quindi lo stato raggiunto è diverso
        ProofResult result = prove(List.of(absorption), depthOne, "x", "(+ x (* x ?0))");

        assertFalse(result.isSuccess());
        assertEquals(2, result.getStatesExplored());
    }

    @Test
    void separateInvocationsAreIndependent() {
        Axiom absorption = new Axiom("abs_add", parseFormula("(+ a (* a b))"), parseFormula("a"));
        ProofSearchEngine engine = new ProofSearchEngine(List.of(absorption), SearchParameters.DEFAULTS);

        ProofResult first = engine.prove(parseFormula("x"), parseFormula("(+ x (* x ?0))"));
        ProofResult second = engine.prove(parseFormula("x"), parseFormula("(+ x (* x ?0))"));

        assertEquals(first.isSuccess(), second.isSuccess());
        assertEquals(first.getStatesExplored(), second.getStatesExplored());
    }

    @Test
    void statisticsAreFinalizedWhenTheSearchReturns() {
        ProofResult result = prove(List.of(COMM), SearchParameters.DEFAULTS, "(* 0 1)", "(* 1 0)");

        SearchStatistics statistics = result.getStatistics();
        assertTrue(statistics.isTimerStopped());
        assertEquals(2, statistics.getSuccessorsGenerated());
        assertEquals(1, statistics.getDuplicatesSkipped());
        assertEquals(1, statistics.getDeepestLayer());
    }

    @Test
    void reportFollowsTheCommandLineFormat() {
        ProofResult proved = prove(List.of(COMM), SearchParameters.DEFAULTS, "(* 0 1)", "(* 1 0)");
        ProofResult same = prove(List.of(), SearchParameters.DEFAULTS, "0", "0");
        ProofResult failed = prove(List.of(COMM), SearchParameters.DEFAULTS, "(* 0 1)", "(* 1 1)");

        assertTrue(proved.toString().startsWith("Prove (* 0 1) = (* 1 0):\n-> (* 1 0)  w/ comm\nDone in "));
        assertTrue(proved.toString().endsWith("after checking 2 states.\n"));
        assertEquals("Prove 0 = 0:\nStatements are the same.\n", same.toString());
        assertEquals("Prove (* 0 1) = (* 1 1):\nNo path found within 8 steps (2 states checked).\n",
                failed.toString());
    }

    @Test
    void nullGoalIsRejected() {
        ProofSearchEngine engine = new ProofSearchEngine(List.of(), SearchParameters.DEFAULTS);

        assertThrows(IllegalArgumentException.class, () -> engine.prove(null, parseFormula("0")));
    }

    private static ProofResult prove(List<Axiom> axioms, SearchParameters parameters, String start, String target) {
        Formula startFormula = parseFormula(start);
        Formula targetFormula = parseFormula(target);
        return new ProofSearchEngine(axioms, parameters).prove(startFormula, targetFormula);
    }
}
