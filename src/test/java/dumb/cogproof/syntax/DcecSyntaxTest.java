package dumb.cogproof.syntax;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DcecSyntaxTest extends AbstractProverTest {

    private final DcecSyntax dcec = new DcecSyntax();

    @Test
    void obligationSurvivesTheRoundTrip() throws Exception {
        var f = parse("Obligatory(pay(agent1, 100))");
        var text = dcec.serialize(f);
        assertEquals("(Obligatory agent1 (pay agent1 100))", text);
        var back = dcec.parse(text);
        assertEquals(f, back);
        var d = assertInstanceOf(Formula.Deontic.class, back);
        assertEquals(Formula.DeonticOp.OBLIGATORY, d.op);
        assertEquals(Term.Const.of("agent1"), d.agent);
    }

    @Test
    void writesQuantifiersWithQuestionMarkVariables() throws Exception {
        var f = parse("forall x. P(x) -> Q(x)");
        var text = dcec.serialize(f);
        assertEquals("(forall (?x) (implies (P ?x) (Q ?x)))", text);
        assertEquals(f, dcec.parse(text));
    }

    @Test
    void readsVariadicConjunction() throws ValidationException {
        assertEquals(parse("(p & q) & r"), dcec.parse("(and p q r)"));
    }

    @Test
    void readsCognitiveOperators() throws ValidationException {
        assertEquals(parse("Knows[alice](Believes[bob](raining))"), dcec.parse("(Knows alice (Believes bob raining))"));
        assertEquals(parse("CommonKnowledge(p)"), dcec.parse("(CommonKnowledge p)"));
    }

    @Test
    void keepsArithmeticTerms() throws Exception {
        var f = parse("x + 1 > x");
        assertEquals(f, dcec.parse(dcec.serialize(f)));
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(ValidationException.class, () -> dcec.parse("(Obligatory)"));
        assertThrows(ValidationException.class, () -> dcec.parse("(and p)"));
        assertThrows(ValidationException.class, () -> dcec.parse("(not p q)"));
        assertThrows(ValidationException.class, () -> dcec.parse("()"));
        var e = assertThrows(ValidationException.class, () -> dcec.parse("(and (forall (?x) (P ?x)) (Q ?x))"));
        assertTrue(e.reason().contains("outside the scope"), e.getMessage());
    }

    @Test
    void refusesPredicatesNamedLikeOperators() {
        var f = Formula.pred("implies", Term.Const.of("a"));
        assertThrows(TranslationException.class, () -> dcec.serialize(f));
    }
}
