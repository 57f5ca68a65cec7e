package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.reason.NativeProver;
import dumb.cogproof.route.RouteConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NativeCandidateTest extends AbstractProverTest {

    private final NativeCandidate candidate = new NativeCandidate();

    @Test
    void provesThroughTheNativeProver() {
        var r = candidate.attempt(parse("Q(x)"), parseAll("P(x)", "P(x) -> Q(x)"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(NativeProver.METHOD, r.method());
    }

    @Test
    void passesTheModalSystemOn() {
        var goal = parse("p");
        var axioms = parseAll("Necessary(p)");
        assertStatus(ProofStatus.UNKNOWN, candidate.attempt(goal, axioms, RouteConfig.DEFAULT));
        assertStatus(ProofStatus.PROVED, candidate.attempt(goal, axioms, RouteConfig.DEFAULT.withSystem(ModalSystem.T)));
    }

    @Test
    void cannotDoArithmetic() {
        assertFalse(candidate.capabilities().contains(Capability.ARITHMETIC));
        assertEquals(BridgeKind.NATIVE, candidate.kind());
    }
}
