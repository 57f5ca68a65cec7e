package dumb.cogproof.modal;

import dumb.cogproof.AbstractProverTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableauxTest extends AbstractProverTest {

    private static Tableaux.Outcome check(ModalSystem system, String goal, String... axioms) throws Exception {
        return new Tableaux(system, Tableaux.DEFAULT_MAX_WORLDS, 5000).check(parse(goal), parseAll(axioms));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "K  | Necessary(p -> q) -> (Necessary(p) -> Necessary(q)) | VALID",
            "K  | Necessary(p) -> p                                   | INVALID",
            "T  | Necessary(p) -> p                                   | VALID",
            "K  | Necessary(p) -> Possible(p)                         | INVALID",
            "D  | Necessary(p) -> Possible(p)                         | VALID",
            "K  | Necessary(p) -> Necessary(Necessary(p))             | INVALID",
            "S4 | Necessary(p) -> Necessary(Necessary(p))             | VALID",
            "S4 | Possible(p) -> Necessary(Possible(p))               | INVALID",
            "S5 | Possible(p) -> Necessary(Possible(p))               | VALID",
            "K  | p -> p                                              | VALID",
            "K  | Always(p) -> p                                      | VALID",
            "K  | Always(Eventually(p))                               | INVALID",
            "K  | Obligatory[a](p) -> Permitted[a](p)                 | VALID",
            "K  | Knows[a](p) -> p                                    | VALID",
            "K  | Believes[a](p) -> p                                 | INVALID"
    })
    void verdicts(ModalSystem system, String goal, Tableaux.Verdict expected) throws Exception {
        assertEquals(expected, check(system, goal).verdict());
    }

    @Test
    void axiomsAreAssumedAtTheRoot() throws Exception {
        assertEquals(Tableaux.Verdict.VALID, check(ModalSystem.K, "Necessary(q)", "Necessary(p)", "Necessary(p -> q)").verdict());
        assertEquals(Tableaux.Verdict.INVALID, check(ModalSystem.K, "Necessary(q)", "Necessary(p)").verdict());
    }

    @Test
    void invalidComesWithACountermodel() throws Exception {
        var o = check(ModalSystem.K, "Necessary(p) -> p");
        assertEquals(Tableaux.Verdict.INVALID, o.verdict());
        assertNotNull(o.countermodel());
        assertTrue(o.worlds() >= 1);
        var text = o.countermodel().toString();
        assertTrue(text.startsWith("w0:"), text);
        assertTrue(text.contains("~p"), text);
    }

    @Test
    void validHasNoCountermodel() throws Exception {
        var o = check(ModalSystem.T, "Necessary(p) -> p");
        assertNull(o.countermodel());
        assertNull(o.reason());
    }

    @Test
    void worldLimitGivesUnknown() throws Exception {
        var o = new Tableaux(ModalSystem.K, 1, 5000).check(parse("Necessary(p)"), List.of());
        assertEquals(Tableaux.Verdict.UNKNOWN, o.verdict());
        assertTrue(o.reason().contains("world limit"), o.reason());
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new Tableaux(ModalSystem.K, 0, 1000));
    }
}
