package org.rewrite.engine;

import org.junit.jupiter.api.Test;
import org.rewrite.formula.Formula;
import org.rewrite.support.FreshNameGenerator;
import org.rewrite.support.Scope;

import static org.junit.jupiter.api.Assertions.*;
import static org.rewrite.program.ProgramLoader.parseFormula;

class PatternMatcherTest {

    @Test
    void primitiveMatchesOnlyTheSameBit() {
        assertNotNull(PatternMatcher.match(parseFormula("1"), parseFormula("1")));
        assertNull(PatternMatcher.match(parseFormula("0"), parseFormula("1")));
        assertNull(PatternMatcher.match(parseFormula("x"), parseFormula("1")));
        assertNull(PatternMatcher.match(parseFormula("(~ 1)"), parseFormula("1")));
    }

    @Test
    void operationRequiresSameSymbolAndMatchingChildren() {
        assertNotNull(PatternMatcher.match(parseFormula("(* 0 1)"), parseFormula("(* a b)")));
        assertNull(PatternMatcher.match(parseFormula("(+ 0 1)"), parseFormula("(* a b)")));
        assertNull(PatternMatcher.match(parseFormula("(* 0 1)"), parseFormula("(* a 0)")));
        assertNull(PatternMatcher.match(parseFormula("x"), parseFormula("(~ a)")));
        assertNull(PatternMatcher.match(parseFormula("0"), parseFormula("(~ a)")));
    }

    @Test
    void firstOccurrenceBindsAnyNode() {
        Scope scope = PatternMatcher.match(parseFormula("(~ (+ x ?2))"), parseFormula("(~ a)"));

        assertNotNull(scope);
        assertEquals(1, scope.size());
        assertEquals("(+ x ?2)", scope.lookup("a").toCanonicalString());
    }

    @Test
    void repeatedVariableMustBindCanonicallyEqualNodes() {
        Formula rule = parseFormula("(+ a (~ a))");

        assertNotNull(PatternMatcher.match(parseFormula("(+ (* x 1) (~ (* x 1)))"), rule));
        assertNull(PatternMatcher.match(parseFormula("(+ (* x 1) (~ (* 1 x)))"), rule));
    }

    @Test
    void existingBindingIsCheckedAgainstLaterNodes() {
        Scope scope = new Scope();
        scope.bind("a", parseFormula("0"));

        assertFalse(PatternMatcher.match(parseFormula("1"), parseFormula("a"), scope));
        assertTrue(PatternMatcher.match(parseFormula("0"), parseFormula("a"), scope));
    }

    @Test
    void placeholderInRuleMatchesOnlyTheSamePlaceholder() {
        assertNotNull(PatternMatcher.match(parseFormula("?3"), parseFormula("?3")));
        assertNull(PatternMatcher.match(parseFormula("?4"), parseFormula("?3")));
        assertNull(PatternMatcher.match(parseFormula("x"), parseFormula("?3")));
    }

    @Test
    void failedMatchFailsTheWholeCall() {
        Scope scope = new Scope();

        assertFalse(PatternMatcher.match(parseFormula("(* 0 1)"), parseFormula("(* a a)"), scope));
        // legami parziali non ripristinati: lo scope va scartato
        assertTrue(scope.isBound("a"));
    }

    @Test
    void successfulMatchReproducesTheNodeWhenInstantiated() {
        Formula node = parseFormula("(* (+ x 0) (~ (+ x 0)))");
        Formula rule = parseFormula("(* a (~ a))");

        Scope scope = PatternMatcher.match(node, rule);
        Formula rebuilt = new Substitution(new FreshNameGenerator()).instantiate(rule, scope);

        assertEquals(node, rebuilt);
    }
}
