package dumb.cogproof;

import dumb.cogproof.bridge.ProverCandidate;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.syntax.Syntax;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CogProofTest extends AbstractProverTest {

    @Test
    void provesFromText() throws ValidationException {
        try (var cp = new CogProof()) {
            var r = cp.prove("Q(x)", List.of("P(x)", "P(x) -> Q(x)"));
            assertStatus(ProofStatus.PROVED, r);
            assertEquals("native", r.method());
            assertFalse(r.cached());

            var again = cp.prove("Q(x)", List.of("P(x) -> Q(x)", "P(x)"));
            assertTrue(again.cached());
            assertEquals(2, cp.router.stats().requests());
        }
    }

    @Test
    void nothingRunsWhenAnAxiomIsMalformed() {
        try (var cp = new CogProof()) {
            assertThrows(ValidationException.class, () -> cp.prove("Q(x)", List.of("P(x) ->")));
            assertThrows(ValidationException.class, () -> cp.prove("(forall x. P(x)) & Q(x)", List.of()));
            assertEquals(0, cp.router.stats().requests());
        }
    }

    @Test
    void provesFromDcec() throws ValidationException {
        try (var cp = new CogProof()) {
            var r = cp.prove("(Believes alice p)", List.of("(Knows alice p)"), Syntax.DCEC, cp.defaults());
            assertStatus(ProofStatus.PROVED, r);
        }
    }

    @Test
    void provesFromKnowledgeBase() {
        try (var cp = new CogProof()) {
            var r = cp.prove(parse("mortal(socrates)"), kb("human(socrates)", "forall x. human(x) -> mortal(x)"), cp.defaults());
            assertStatus(ProofStatus.PROVED, r);
        }
    }

    @Test
    void registersConfiguredProvers() {
        var exe = Executors.newCachedThreadPool();
        try {
            assertEquals(List.of("native", "modal_tableaux", "cec"), methods(CogProof.candidates(new Config(), exe)));
            var withZ3 = new Config(16, null, 10, 5000, ModalSystem.K, false, 2, 64, "z3", null, null, "coqc", false,
                    Config.DEFAULT_LLM_URL, Config.DEFAULT_LLM_MODEL);
            assertEquals(List.of("native", "modal_tableaux", "cec", "z3", "coq"), methods(CogProof.candidates(withZ3, exe)));
        } finally {
            exe.shutdownNow();
        }
    }

    private static List<String> methods(List<ProverCandidate> candidates) {
        return candidates.stream().map(ProverCandidate::method).toList();
    }
}
