package org.rewrite.support;

import org.junit.jupiter.api.Test;
import org.rewrite.formula.Axiom;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rewrite.program.ProgramLoader.parseFormula;

class AxiomStoreTest {

    private static final Axiom COMM = new Axiom("comm", parseFormula("(* x y)"), parseFormula("(* y x)"));
    private static final Axiom NEG = new Axiom("neg", parseFormula("(~ 0)"), parseFormula("1"));

    @Test
    void snapshotPreservesInsertionOrder() {
        AxiomStore store = new AxiomStore();
        store.append(NEG);
        store.append(COMM);

        assertEquals(List.of(NEG, COMM), store.snapshot());
        assertEquals(2, store.size());
    }

    @Test
    void snapshotIsNotAffectedByLaterAppends() {
        AxiomStore store = new AxiomStore(List.of(COMM));
        List<Axiom> before = store.snapshot();

        store.append(NEG);

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(NEG));
    }

    @Test
    void lookupReturnsFirstAxiomWithDuplicateName() {
        Axiom shadow = new Axiom("comm", parseFormula("(+ x y)"), parseFormula("(+ y x)"));
        AxiomStore store = new AxiomStore(List.of(COMM, shadow));

        assertSame(COMM, store.lookup("comm"));
        assertEquals(2, store.size());
    }

    @Test
    void lookupOfUnknownNameFails() {
        AxiomStore store = new AxiomStore(List.of(COMM));

        assertFalse(store.contains("neg"));
        assertThrows(IllegalArgumentException.class, () -> store.lookup("neg"));
    }

    @Test
    void lemmasAreCountedSeparately() {
        AxiomStore store = new AxiomStore(List.of(COMM));
        store.append(Axiom.lemma(parseFormula("(~ (~ 0))"), parseFormula("0")));

        assertEquals(1, store.lemmaCount());
        assertTrue(store.contains("proof of (~ (~ 0)) = 0"));
    }

    @Test
    void nullAxiomIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AxiomStore().append(null));
    }
}
