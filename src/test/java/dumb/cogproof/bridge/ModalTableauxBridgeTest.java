package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.route.RouteConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModalTableauxBridgeTest extends AbstractProverTest {

    private final ModalTableauxBridge tableaux = new ModalTableauxBridge();

    @Test
    void requestNamesTheSystem() {
        var stub = StubTransport.replying("valid");
        new ModalTableauxBridge(stub).attempt(parse("Necessary(p) -> p"), parseAll("q"), RouteConfig.DEFAULT.withSystem(ModalSystem.T));
        assertEquals("system: T\naxiom: q\ngoal: []p -> p\n", stub.lastRequest());
    }

    @Test
    void systemDecidesTheVerdict() {
        var goal = parse("Necessary(p) -> p");
        var k = tableaux.attempt(goal, List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.DISPROVED, k);
        assertNotNull(k.countermodel());

        var t = tableaux.attempt(goal, List.of(), RouteConfig.DEFAULT.withSystem(ModalSystem.T));
        assertStatus(ProofStatus.PROVED, t);
        assertEquals("tableau_closed", lastStep(t).ruleName());
        assertEquals(ModalTableauxBridge.METHOD, t.method());
    }

    @Test
    void alwaysEventuallyIsRefuted() {
        var r = tableaux.attempt(parse("Always(Eventually(P(x)))"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.DISPROVED, r);
    }

    @Test
    void deonticAxiomD() {
        var r = tableaux.attempt(parse("Permitted[alice](pay(alice))"), parseAll("Obligatory[alice](pay(alice))"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
    }

    @Test
    void malformedRequestsAreRejected() {
        var transport = new TableauxTransport();
        assertThrows(BridgeException.class, () -> transport.invoke("axiom: p\n", 1000));
        assertThrows(BridgeException.class, () -> transport.invoke("lemma: p\ngoal: p\n", 1000));
        assertThrows(BridgeException.class, () -> transport.invoke("just text\n", 1000));
        assertThrows(BridgeException.class, () -> transport.invoke("system: Q\ngoal: p\n", 1000));
    }

    @Test
    void unreadableAnswerIsAFailure() {
        var r = new ModalTableauxBridge(StubTransport.replying("maybe")).attempt(parse("p"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.ERROR, r);
        assertTrue(r.message().contains("unreadable"), r.message());
    }
}
