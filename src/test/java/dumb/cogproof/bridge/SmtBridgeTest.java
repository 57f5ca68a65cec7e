package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.route.RouteConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmtBridgeTest extends AbstractProverTest {

    @Test
    void arithmeticGoalIsNegatedAndChecked() throws Exception {
        var smt = new SmtBridge("z3", StubTransport.replying("unsat"));
        var text = smt.translate(parse("x + 1 > x"), List.of());
        assertTrue(text.startsWith("(set-logic ALL)\n(declare-sort U 0)\n"), text);
        assertTrue(text.contains("(declare-const x Int)\n"), text);
        assertTrue(text.endsWith("(assert (not (> (+ x 1) x)))\n(check-sat)\n"), text);
    }

    @Test
    void quantifiersAndPredicatesAreDeclared() throws Exception {
        var smt = new SmtBridge("z3", StubTransport.replying("unsat"));
        var text = smt.translate(parse("Q(a)"), parseAll("forall x. P(x) -> Q(x)", "P(a)"));
        assertTrue(text.contains("(declare-const a U)\n"), text);
        assertTrue(text.contains("(declare-fun P (U) Bool)\n"), text);
        assertTrue(text.contains("(assert (forall ((x!0 U)) (=> (P x!0) (Q x!0))))\n"), text);
        assertTrue(text.contains("(assert (not (Q a)))\n"), text);
    }

    @Test
    void unsatProves() {
        var stub = StubTransport.replying("unsat\n");
        var r = new SmtBridge("z3", stub).attempt(parse("x + 1 > x"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("z3", r.method());
        assertEquals("z3_refutation", lastStep(r).ruleName());
        assertEquals(1, stub.requests.size());
    }

    @Test
    void satDisprovesWithModel() throws Exception {
        var r = new SmtBridge("cvc5", StubTransport.replying("")).parseResult(RawOutput.ok("sat\n(model\n  (define-fun p () Bool false)\n)"), 3);
        assertStatus(ProofStatus.DISPROVED, r);
        assertTrue(r.countermodel().contains("define-fun p"));
    }

    @Test
    void unknownAnswer() throws Exception {
        var r = new SmtBridge("z3", StubTransport.replying("")).parseResult(RawOutput.ok("unknown"), 3);
        assertStatus(ProofStatus.UNKNOWN, r);
    }

    @Test
    void garbageIsABridgeFailure() {
        var smt = new SmtBridge("z3", StubTransport.replying(""));
        assertThrows(BridgeException.class, () -> smt.parseResult(new RawOutput(1, "", "(error \"line 3: unknown constant\")"), 3));
        var r = new SmtBridge("z3", StubTransport.replying("segfault")).attempt(parse("p"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.ERROR, r);
    }

    @Test
    void modalGoalIsNotExpressible() {
        var stub = StubTransport.replying("unsat");
        var r = new SmtBridge("z3", stub).attempt(parse("Necessary(p)"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.ERROR, r);
        assertTrue(r.message().startsWith("not expressible for z3"), r.message());
        assertTrue(stub.requests.isEmpty());
    }

    @Test
    void transportTimeoutIsTimeout() {
        var r = new SmtBridge("z3", StubTransport.failing(BridgeException.timeout(100)))
                .attempt(parse("p"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.TIMEOUT, r);
    }

    @Test
    void describesItself() {
        var z3 = SmtBridge.z3("z3");
        assertEquals(BridgeKind.SMT, z3.kind());
        assertEquals("z3", z3.method());
        assertEquals(List.of("z3", "-in", "-smt2"), ((ProcessTransport) z3.transport()).command());
        assertEquals("cvc5", SmtBridge.cvc5("cvc5").method());
    }
}
