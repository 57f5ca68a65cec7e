package dumb.cogproof;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaTest extends AbstractProverTest {

    @Test
    void printsComparisonsWithBracketedArithmetic() {
        assertEquals("(x + 1) > x", parse("x + 1 > x").text());
    }

    @Test
    void omitsTheImpliedAgent() {
        assertEquals("Obligatory(pay(agent1, 100))", parse("Obligatory(pay(agent1, 100))").text());
        assertEquals("Obligatory[bob](pay(alice))", parse("Obligatory[bob](pay(alice))").text());
    }

    @Test
    void quantifierBodyExtendsRight() {
        var f = parse("forall x. P(x) -> Q(x)");
        assertTrue(f instanceof Formula.Quant);
        assertEquals("forall x. P(x) -> Q(x)", f.text());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "P(a) & Q(b) | ~R(c)",
            "forall x. exists y. Loves(x, y)",
            "Always(p -> Eventually(q))",
            "Until(p, q)",
            "Knows[alice](Believes[bob](p))",
            "CommonKnowledge(p)",
            "Forbidden[alice](steal(bob))",
            "Necessary(p) -> Possible(p)",
            "f(a, g(b)) = c",
            "P(?x) -> Q(?x)"
    })
    void printedTextParsesBack(String text) {
        var f = parse(text);
        assertEquals(f, parse(f.text()));
    }

    @Test
    void equalityIgnoresBoundVariableNames() {
        assertEquals(parse("forall x. P(x)"), parse("forall y. P(y)"));
        assertNotEquals(parse("forall x. P(x)"), parse("exists x. P(x)"));
    }

    @Test
    void freeVariablesAreMarked() {
        var f = parse("P(?x) & forall y. Q(y, ?x)");
        assertEquals(Set.of(Term.Var.free("x")), f.freeVars());
        assertTrue(parse("forall y. Q(y)").freeVars().isEmpty());
    }

    @Test
    void identifiersOutsideQuantifiersAreConstants() {
        var p = (Formula.Pred) parse("P(x)");
        assertEquals(Term.Const.of("x"), p.args.get(0));
    }

    @Test
    void instantiateOpensTheBinder() {
        var q = (Formula.Quant) parse("forall x. P(x) -> Q(x, b)");
        assertEquals(parse("P(a) -> Q(a, b)"), q.instantiate(Term.Const.of("a")));
    }

    @Test
    void factoriesBindByName() {
        var x = Term.Var.free("x");
        var built = Formula.forall("x", Formula.implies(Formula.pred("P", x), Formula.pred("Q", x)));
        assertEquals(parse("forall x. P(x) -> Q(x)"), built);
        assertFalse(built.loose(0));
    }

    @Test
    void defaultAgentIsTheFirstArgument() {
        var d = (Formula.Deontic) parse("Obligatory(pay(agent1, 100))");
        assertEquals(Term.Const.of("agent1"), d.agent);
        var n = (Formula.Deontic) parse("Permitted(rain)");
        assertEquals(Formula.ANYONE, n.agent);
    }

    @Test
    void knowledgeBaseSkipsEquivalentFacts() {
        var kb = kb("forall x. P(x)", "Q(a) & R(b)");
        var grown = kb.extend(parseAll("forall y. P(y)", "R(b) & Q(a)"));
        assertSame(kb, grown);
        assertEquals(2, grown.size());

        var next = kb.extend(List.of(parse("S(c)")));
        assertEquals(3, next.size());
        assertEquals(1, next.delta().size());
        assertTrue(next.contains(parse("forall z. P(z)")));
        assertEquals(1, next.withHead("S/1").count());
    }
}
