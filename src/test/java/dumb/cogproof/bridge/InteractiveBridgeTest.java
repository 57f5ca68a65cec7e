package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.syntax.InteractiveSyntax;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractiveBridgeTest extends AbstractProverTest {

    @Test
    void leanTheoryStatesTheGoalOverTheAxioms() throws Exception {
        var lean = new InteractiveBridge("lean", InteractiveSyntax.Dialect.LEAN, StubTransport.replying(""));
        var text = lean.translate(parse("mortal(socrates)"), parseAll("forall x. human(x) -> mortal(x)", "human(socrates)"));
        assertTrue(text.contains("axiom human : U → Prop\n"), text);
        assertTrue(text.contains("theorem goal_holds (h1 : ∀ x, human x → mortal x) (h2 : human socrates) : mortal socrates := by\n"), text);
    }

    @Test
    void coqTheoryEndsWithAProofScript() throws Exception {
        var coq = new InteractiveBridge("coq", InteractiveSyntax.Dialect.COQ, StubTransport.replying(""));
        var text = coq.translate(parse("q"), parseAll("p", "p -> q"));
        assertTrue(text.contains("Theorem goal_holds : (p) -> (p -> q) -> (q).\n"), text);
        assertTrue(text.endsWith("Qed.\n"), text);
    }

    @Test
    void cleanExitProves() {
        var r = new InteractiveBridge("lean", InteractiveSyntax.Dialect.LEAN, StubTransport.replying(""))
                .attempt(parse("q"), parseAll("p", "p -> q"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("lean_tactic", lastStep(r).ruleName());
    }

    @Test
    void failedTacticsLeaveTheGoalOpen() throws Exception {
        var lean = new InteractiveBridge("lean", InteractiveSyntax.Dialect.LEAN, StubTransport.replying(""));
        var r = lean.parseResult(new RawOutput(1, "goal.lean:3:2: error: unsolved goals\n", ""), 10);
        assertStatus(ProofStatus.UNKNOWN, r);
        assertTrue(r.message().contains("unsolved goals"), r.message());
    }

    @Test
    void otherErrorsRejectTheTheory() {
        var coq = new InteractiveBridge("coq", InteractiveSyntax.Dialect.COQ, StubTransport.replying(""));
        assertThrows(BridgeException.class, () -> coq.parseResult(new RawOutput(1, "", "Error: Syntax error: '.' expected."), 10));
    }

    @Test
    void factoriesUseTheoryFiles() {
        var lean = InteractiveBridge.lean("lean");
        assertEquals(InteractiveSyntax.Dialect.LEAN, lean.dialect());
        assertEquals(BridgeKind.INTERACTIVE, lean.kind());
        assertEquals(List.of("coqc", "-q"), ((ProcessTransport) InteractiveBridge.coq("coqc").transport()).command());
    }
}
