package dumb.cogproof.syntax;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Serializing into a surface syntax and reading it back gives the same formula. */
class SyntaxRoundTripTest extends AbstractProverTest {

    private static void roundTrip(SurfaceSyntax syntax, String text) throws TranslationException, ValidationException {
        var f = parse(text);
        var written = syntax.serialize(f);
        assertEquals(f, syntax.parse(written), () -> syntax.syntax() + " wrote " + written);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "forall x. P(x) -> Q(x)",
            "Obligatory(pay(agent1, 100))",
            "Forbidden[alice](Eventually(steal(bob)))",
            "Until(p, q) & Since(q, r)",
            "Knows[alice](p) -> Believes[alice](p)",
            "exists y. Loves(?x, y) <-> ~(a = b)",
            "x + 1 > x"
    })
    void dcec(String text) throws Exception {
        roundTrip(new DcecSyntax(), text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "forall x. human(x) -> mortal(x)",
            "human(socrates) & ~dead(socrates)",
            "exists x. loves(x, ?y) | x = mary",
            "x + 1 > x",
            "forall x. forall y. R(x, y) -> R(y, x)",
            "(p -> q) -> r",
            "~(p -> q) <-> (p & ~q)",
            "p <-> (a = b)"
    })
    void tptp(String text) throws Exception {
        roundTrip(new TptpSyntax(), text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Necessary(p) -> Possible(p)",
            "Always(p) & Eventually(q)",
            "Obligatory(pay(agent1, 100))",
            "Knows[alice](raining) | ~CommonKnowledge(raining)"
    })
    void modal(String text) throws Exception {
        roundTrip(new ModalSyntax(), text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "forall x. human(x) -> mortal(x)",
            "Obligatory(pay(agent1, 100))",
            "p & q -> r"
    })
    void lean(String text) throws Exception {
        roundTrip(new InteractiveSyntax(InteractiveSyntax.Dialect.LEAN), text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "forall x. human(x) -> mortal(x)",
            "p & q -> r"
    })
    void coq(String text) throws Exception {
        roundTrip(new InteractiveSyntax(InteractiveSyntax.Dialect.COQ), text);
    }

    @Test
    void interactiveNotation() throws TranslationException {
        var f = parse("forall x. human(x) -> mortal(x)");
        assertEquals("∀ x, human x → mortal x", new InteractiveSyntax(InteractiveSyntax.Dialect.LEAN).serialize(f));
        assertEquals("forall x, human x -> mortal x", new InteractiveSyntax(InteractiveSyntax.Dialect.COQ).serialize(f));
    }

    @Test
    void tptpRejectsModalOperators() {
        var tptp = new TptpSyntax();
        var f = parse("Always(p)");
        assertThrows(TranslationException.class, () -> tptp.serialize(f));
        assertFalse(tptp.lossless(f));
        assertTrue(tptp.lossless(parse("p -> q")));
    }

    @Test
    void modalFormReportsItsLosses() throws TranslationException {
        var modal = new ModalSyntax();
        var f = parse("Forbidden[alice](steal(bob))");
        assertEquals("[O:alice]~steal(bob)", modal.serialize(f));
        assertFalse(modal.lossless(f));
        assertEquals("{forall x. P(x)}", modal.serialize(parse("forall x. P(x)")));
    }

    @Test
    void tptpReadsImplicationsAfterAtoms() throws ValidationException {
        var tptp = new TptpSyntax();
        assertEquals(parse("p -> q"), tptp.parse("p => q"));
        assertEquals(parse("forall x. human(x) -> mortal(x)"), tptp.parse("![X]: (human(X) => mortal(X))"));
        assertEquals(parse("q -> p"), tptp.parse("p <= q"));
        assertEquals(parse("a = b -> p"), tptp.parse("a = b => p"));
    }

    @Test
    void tptpProblemListsAxiomsThenConjecture() throws TranslationException {
        var text = new TptpSyntax().problem(parse("mortal(socrates)"),
                parseAll("forall x. human(x) -> mortal(x)", "human(socrates)"));
        assertEquals("""
                fof(a1, axiom, ![X]: (human(X) => mortal(X))).
                fof(a2, axiom, human(socrates)).
                fof(goal, conjecture, mortal(socrates)).
                """, text);
    }
}
