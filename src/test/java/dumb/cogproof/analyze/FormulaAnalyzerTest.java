package dumb.cogproof.analyze;

import dumb.cogproof.AbstractProverTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaAnalyzerTest extends AbstractProverTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "p & q                             | PROPOSITIONAL",
            "a = b                             | PROPOSITIONAL",
            "forall x. P(x) -> Q(x)            | QUANTIFIED_PROPOSITIONAL",
            "forall x. R(x, a)                 | PURE_FOL",
            "P(f(a))                           | PURE_FOL",
            "x + 1 > x                         | ARITHMETIC",
            "Necessary(p) -> p                 | MODAL",
            "Always(Eventually(P(x)))          | TEMPORAL",
            "Obligatory(pay(agent1, 100))      | DEONTIC",
            "Knows[alice](p)                   | COGNITIVE",
            "Obligatory(p) & Knows[alice](q)   | MIXED_MODAL"
    })
    void classifies(String text, FormulaType expected) {
        assertEquals(expected, FormulaAnalyzer.analyze(parse(text)).type());
    }

    @Test
    void countsOperators() {
        var a = FormulaAnalyzer.analyze(parse("p & q"));
        assertEquals(1, a.count("and"));
        assertEquals(2, a.count("predicate"));
        assertEquals(0, a.count("or"));
        assertEquals(2, a.astDepth());
        assertEquals(7, a.complexity());
    }

    @Test
    void measuresDepths() {
        var a = FormulaAnalyzer.analyze(parse("Always(Eventually(forall x. exists y. R(x, y)))"));
        assertEquals(2, a.modalDepth());
        assertEquals(2, a.quantifierDepth());
        assertEquals(1, a.count("always"));
        assertEquals(1, a.count("forall"));
        assertEquals(2, a.modalOperators());
        assertEquals(1, a.modalFamilies());
    }

    @Test
    void arithmeticIsDetected() {
        var a = FormulaAnalyzer.analyze(parse("x + 1 > x"));
        assertTrue(a.hasArithmetic());
        assertEquals(1, a.count("arithmetic"));
        assertEquals(1, a.count("comparison"));
        assertEquals(EnumSet.of(Capability.PROPOSITIONAL, Capability.ARITHMETIC), a.requiredCapabilities());
    }

    @Test
    void freeVariablesAreSchematic() {
        var a = FormulaAnalyzer.analyze(parse("P(?x) -> Q(?x)"));
        assertTrue(a.hasFreeVars());
        assertFalse(a.hasQuantifiers());
        assertEquals(EnumSet.of(Capability.PROPOSITIONAL), a.requiredCapabilities());
    }

    @Test
    void capabilitiesOfModalAndFirstOrderProblems() {
        assertEquals(EnumSet.of(Capability.PROPOSITIONAL, Capability.MODAL),
                FormulaAnalyzer.analyze(parse("Necessary(p) -> p")).requiredCapabilities());
        assertEquals(EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL),
                FormulaAnalyzer.analyze(parse("forall x. P(x)")).requiredCapabilities());
    }

    @Test
    void axiomsContribute() {
        var a = FormulaAnalyzer.analyze(parse("Q(a)"), parseAll("forall x. P(x) -> Q(x)", "P(a)"));
        assertTrue(a.hasQuantifiers());
        assertEquals(FormulaType.QUANTIFIED_PROPOSITIONAL, a.type());
    }

    @Test
    void complexityIsClamped() {
        var text = "Necessary(".repeat(40) + "p" + ")".repeat(40);
        assertEquals(100, FormulaAnalyzer.analyze(parse(text)).complexity());
        assertFalse(FormulaType.PROPOSITIONAL.modalFamily());
        assertTrue(FormulaType.MIXED_MODAL.modalFamily());
    }
}
