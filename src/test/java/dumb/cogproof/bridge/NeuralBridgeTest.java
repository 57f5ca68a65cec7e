package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.route.RouteConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NeuralBridgeTest extends AbstractProverTest {

    @Test
    void promptListsPremisesAndConclusion() {
        var prompt = new NeuralBridge("llm", StubTransport.replying("")).translate(parse("q"), parseAll("p", "p -> q"));
        assertTrue(prompt.contains("Premises:\n1. p\n2. p -> q\n"), prompt);
        assertTrue(prompt.contains("Conclusion: q"), prompt);
        assertTrue(prompt.contains("VERDICT: PROVED, DISPROVED or UNKNOWN"), prompt);
    }

    @Test
    void provedVerdictIsMarkedAsJudgement() {
        var stub = StubTransport.replying("VERDICT: PROVED\nREASON: modus ponens applies");
        var r = new NeuralBridge("llm", stub).attempt(parse("q"), parseAll("p", "p -> q"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("model judgement, not machine-checked: modus ponens applies", r.message());
    }

    @Test
    void disprovedAndUnknownVerdicts() throws Exception {
        var neural = new NeuralBridge("llm", StubTransport.replying(""));
        var d = neural.parseResult(RawOutput.ok("verdict: disproved\nreason: no premise mentions q"), 5);
        assertStatus(ProofStatus.DISPROVED, d);
        assertTrue(d.message().endsWith("no premise mentions q"), d.message());
        assertStatus(ProofStatus.UNKNOWN, neural.parseResult(RawOutput.ok("VERDICT: UNKNOWN"), 5));
    }

    @Test
    void replyWithoutVerdictIsAFailure() {
        var neural = new NeuralBridge("llm", StubTransport.replying(""));
        assertThrows(BridgeException.class, () -> neural.parseResult(RawOutput.ok("I think so."), 5));
        assertEquals(BridgeKind.NEURAL, neural.kind());
    }
}
