package dumb.cogproof.syntax;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TdfolParserTest extends AbstractProverTest {

    @Test
    void rejectsVariableOutsideItsQuantifier() {
        var e = assertThrows(ValidationException.class, () -> TdfolParser.parse("(forall x. P(x)) & Q(x)"));
        assertTrue(e.reason().contains("outside the scope"), e.getMessage());
        assertTrue(e.span().known());
        assertEquals(1, e.span().line());
    }

    @Test
    void reportsLineAndColumn() {
        var e = assertThrows(ValidationException.class, () -> TdfolParser.parse("p &\n)"));
        assertEquals(2, e.span().line());
        assertEquals(1, e.span().col());
        assertTrue(e.getMessage().contains("line 2, col 1"), e.getMessage());
    }

    @Test
    void unclosedGroupReportsTheFurthestError() {
        var e = assertThrows(ValidationException.class, () -> TdfolParser.parse("(p & q"));
        assertTrue(e.reason().contains("expected ')' but found end of input"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "P(a) & P(a, b)",
            "P(a) $ Q(b)",
            "P(a",
            "Knows(p)",
            "forall x. x",
            "forall forall. P(a)",
            "Always(p, q)",
            "?",
            "\"unterminated"
    })
    void rejectsMalformedInput(String text) {
        assertThrows(ValidationException.class, () -> TdfolParser.parse(text));
    }

    @Test
    void arityClashNamesTheSymbol() {
        var e = assertThrows(ValidationException.class, () -> TdfolParser.parse("P(a) & P(a, b)"));
        assertTrue(e.reason().contains("'P'"), e.getMessage());
    }

    @Test
    void sharedSignatureSpansFormulas() throws ValidationException {
        var sig = new Signature();
        TdfolParser.parse("Owns(alice, car)", sig);
        assertThrows(ValidationException.class, () -> TdfolParser.parse("Owns(bob)", sig));
    }

    @Test
    void enforcesLimits() {
        var deep = "~".repeat(300) + "p";
        var e = assertThrows(ValidationException.class, () -> TdfolParser.parse(deep));
        assertTrue(e.reason().contains("nesting"), e.getMessage());
        assertThrows(ValidationException.class, () -> TdfolParser.parse("P(a) & Q(b)", new Signature(), new TdfolParser.Limits(5, 256)));
    }

    @Test
    void precedenceAndAssociativity() {
        assertEquals(parse("p -> (q -> r)"), parse("p -> q -> r"));
        assertEquals(parse("(p & q) | r"), parse("p & q | r"));
        assertEquals(parse("(p -> q) <-> r"), parse("p -> q <-> r"));
        assertEquals(parse("(~p) & q"), parse("~p & q"));
    }

    @Test
    void unicodeAndAsciiAgree() {
        assertEquals(parse("forall x. P(x) -> Q(x)"), parse("∀x. P(x) → Q(x)"));
        assertEquals(parse("~p & q | r"), parse("¬p ∧ q ∨ r"));
        assertEquals(parse("Necessary(p) -> Possible(p)"), parse("□p -> ◇p"));
    }

    @Test
    void negatedComparisonAndXor() {
        assertEquals(Formula.not(parse("a = b")), parse("a != b"));
        assertEquals(Formula.not(parse("p <-> q")), parse("p ⊕ q"));
    }

    @Test
    void severalVariablesInOneQuantifier() {
        assertEquals(parse("forall x. forall y. R(x, y)"), parse("forall x, y. R(x, y)"));
    }

    @Test
    void parsesArithmeticComparison() {
        var f = (Formula.Pred) parse("x + 1 > x");
        assertEquals(">", f.symbol);
        assertTrue(f.comparison());
    }

    @Test
    void rulePatternsReadGreekMetavariables() throws ValidationException {
        var f = TdfolParser.parsePattern("φ -> ψ");
        assertTrue(f.hasMeta());
        assertTrue(!parse("p -> q").hasMeta());
    }
}
