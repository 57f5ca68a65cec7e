package dumb.cogproof.syntax;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaturalLanguageTest extends AbstractProverTest {

    private final NaturalLanguage english = new NaturalLanguage();

    @Test
    void glossesUniversalConditional() {
        var g = english.gloss(parse("forall x. P(x) -> Q(x)"));
        assertEquals("For every x, if x is P then x is Q.", g.text());
        assertTrue(g.grammatical());
    }

    @Test
    void glossesObligation() {
        assertEquals("Agent1 is obliged to see that pay holds of agent1 and 100.",
                english.gloss(parse("Obligatory(pay(agent1, 100))")).text());
    }

    @Test
    void glossesComparisonAndTime() {
        assertEquals("It is always the case that eventually x is greater than 3.",
                english.gloss(parse("Always(Eventually(x > 3))")).text());
    }

    @Test
    void fallsBackToATemplate() throws ValidationException {
        var g = english.gloss(TdfolParser.parsePattern("φ -> ψ"));
        assertFalse(g.grammatical());
        assertEquals(NaturalLanguage.TEMPLATE_CONFIDENCE, g.confidence(), 1e-9);
        assertTrue(g.text().startsWith("The following holds: "));
    }

    @Test
    void readsObligation() throws ValidationException {
        var r = english.read("The contractor must pay the invoice.");
        assertEquals(NaturalLanguage.PatternType.OBLIGATION, r.pattern());
        assertEquals(parse("Obligatory(pay(contractor, invoice))"), r.formula());
    }

    @Test
    void readsProhibitionBeforeObligation() throws ValidationException {
        var r = english.read("The tenant must not smoke");
        assertEquals(NaturalLanguage.PatternType.PROHIBITION, r.pattern());
        assertEquals(parse("Forbidden(smoke(tenant))"), r.formula());
    }

    @Test
    void readsPermission() throws ValidationException {
        var r = english.read("Visitors may enter");
        assertEquals(NaturalLanguage.PatternType.PERMISSION, r.pattern());
        assertEquals(parse("Permitted(enter(visitors))"), r.formula());
    }

    @Test
    void readsUniversal() throws ValidationException {
        var r = english.read("Every employee is insured");
        assertEquals(NaturalLanguage.PatternType.UNIVERSAL, r.pattern());
        assertEquals(parse("forall x. employee(x) -> insured(x)"), r.formula());
    }

    @Test
    void conditionalMultipliesConfidence() throws ValidationException {
        var r = english.read("If it rains, then the ground is wet.");
        assertEquals(NaturalLanguage.PatternType.CONDITIONAL, r.pattern());
        assertEquals(parse("rain(it) -> wet(ground)"), r.formula());
        assertEquals(0.9 * 0.7 * 0.75, r.confidence(), 1e-9);
    }

    @Test
    void temporalAdverbWrapsTheSentence() throws ValidationException {
        var r = english.read("Always the alarm is armed");
        assertEquals(parse("Always(armed(alarm))"), r.formula());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "colorless green ideas sleep furiously"})
    void rejectsUnreadableSentences(String s) {
        assertThrows(ValidationException.class, () -> english.read(s));
    }

    @Test
    void foldsPlurals() {
        assertEquals("contractor", NaturalLanguage.singular("contractors"));
        assertEquals("class", NaturalLanguage.singular("classes"));
        assertEquals("party", NaturalLanguage.singular("parties"));
        assertEquals("glass", NaturalLanguage.singular("glass"));
    }
}
