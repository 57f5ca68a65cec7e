package dumb.cogproof;

import dumb.cogproof.syntax.TdfolParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

/** Parsing helpers shared by the prover tests. */
public abstract class AbstractProverTest {

    protected static Formula parse(String text) {
        try {
            return TdfolParser.parse(text);
        } catch (ValidationException e) {
            fail("Failed to parse '" + text + "': " + e.getMessage());
            return null;
        }
    }

    protected static List<Formula> parseAll(String... texts) {
        var out = new ArrayList<Formula>(texts.length);
        for (var t : texts) out.add(parse(t));
        return out;
    }

    protected static KnowledgeBase kb(String... texts) {
        return KnowledgeBase.of(parseAll(texts));
    }

    protected static void assertStatus(ProofStatus expected, ProofResult r) {
        assertEquals(expected, r.status(), () -> "Unexpected result: " + r.toJson());
    }

    protected static ProofStep lastStep(ProofResult r) {
        if (r.steps().isEmpty()) fail("Result has no steps: " + r.toJson());
        return r.steps().get(r.steps().size() - 1);
    }
}
