package org.rewrite.program;

import org.junit.jupiter.api.Test;
import org.rewrite.engine.ProofResult;
import org.rewrite.formula.Axiom;
import org.rewrite.support.SearchParameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.rewrite.program.ProgramLoader.parseFormula;

class ProgramExecutorTest {

    @Test
    void axiomsOnlyAffectLaterGoals() throws IOException {
        List<ProofResult> results = new ProgramExecutor().execute(ProgramLoader.loadResource("programs/ordering.eq"));

        assertEquals(2, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals(1, results.get(0).getStatesExplored());
        assertTrue(results.get(1).isSuccess());
        assertEquals("comm", results.get(1).getPath().get(0).getAxiomName());
    }

    @Test
    void provedGoalsBecomeLemmasWhenEnabled() throws IOException {
        ProgramExecutor executor = new ProgramExecutor();

        List<ProofResult> results = executor.execute(ProgramLoader.loadResource("programs/lemmas.eq"));

        assertEquals(2, results.get(0).getPathLength());
        assertEquals(1, results.get(1).getPathLength());
        assertEquals("proof of (~ (~ 0)) = 0", results.get(1).getPath().get(0).getAxiomName());
        assertEquals(2, executor.getAxiomStore().lemmaCount());
        assertEquals(4, executor.getAxiomStore().size());
    }

    @Test
    void lemmasAreNotRecordedByDefault() {
        ProgramExecutor executor = new ProgramExecutor();

        executor.execute(ProgramLoader.load("axiom comm : (* x y) = (* y x).\nprove (* 0 1) = (* 1 0)."));

        assertEquals(0, executor.getAxiomStore().lemmaCount());
        assertEquals(1, executor.getAxiomStore().size());
    }

    @Test
    void failedGoalsDoNotBecomeLemmas() {
        ProgramExecutor executor = new ProgramExecutor();

        executor.execute(ProgramLoader.load("param use_proofs_as_axioms true.\nprove 0 = 1."));

        assertEquals(0, executor.getAxiomStore().size());
    }

    @Test
    void parametersApplyFromTheirPositionOnward() throws IOException {
        ProgramExecutor executor = new ProgramExecutor();

        List<ProofResult> results = executor.execute(ProgramLoader.loadResource("programs/params.eq"));

        assertEquals(4, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals(1, results.get(0).getMaxSearchDepth());
        assertTrue(results.get(1).isSuccess());
        assertEquals(2, results.get(1).getPathLength());
        assertFalse(results.get(2).isSuccess());
        assertTrue(results.get(3).isIdentity());
        assertEquals(new SearchParameters(2, 20, false), executor.getParameters());
    }

    @Test
    void callbackReceivesEveryGoalInProgramOrder() {
        List<String> seen = new ArrayList<>();
        List<Command> commands = ProgramLoader.load("prove 0 = 0.\nprove 1 = 0.\nprove 1 = 1.");

        new ProgramExecutor().execute(commands, result -> seen.add(result.getStart().toString()));

        assertEquals(List.of("0", "1", "1"), seen);
    }

    @Test
    void preloadedAxiomsPrecedeProgramAxioms() {
        Axiom preloaded = new Axiom("comm", parseFormula("(* x y)"), parseFormula("(* y x)"));
        ProgramExecutor executor = new ProgramExecutor(List.of(preloaded));

        List<ProofResult> results = executor.execute(ProgramLoader.load(
                "axiom neg : (~ 0) = 1.\nprove (* 0 1) = (* 1 0)."));

        assertTrue(results.get(0).isSuccess());
        assertEquals(List.of("comm", "neg"),
                executor.getAxiomStore().snapshot().stream().map(Axiom::getName).collect(Collectors.toList()));
    }
}
