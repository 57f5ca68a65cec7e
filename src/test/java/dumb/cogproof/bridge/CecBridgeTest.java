package dumb.cogproof.bridge;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CecBridgeTest extends AbstractProverTest {

    @Test
    void requestCarriesDcecText() throws Exception {
        var cec = new CecBridge(StubTransport.replying(""));
        var req = Json.the.readTree(cec.translate(parse("Permitted[alice](pay(alice))"), parseAll("Obligatory[alice](pay(alice))")));
        assertEquals("(Permitted alice (pay alice))", req.get("goal").asText());
        assertEquals("(Obligatory alice (pay alice))", req.get("axioms").get(0).asText());
        assertEquals(RouteConfig.DEFAULT.maxDepth(), req.get("max_depth").asInt());
    }

    @Test
    void provesDeonticConsequence() {
        var r = new CecBridge().attempt(parse("Permitted[alice](pay(alice))"), parseAll("Obligatory[alice](pay(alice))"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(CecBridge.METHOD, r.method());
        assertEquals("deontic_d_axiom", lastStep(r).ruleName());
    }

    @Test
    void knowledgeImpliesBelief() {
        var r = new CecBridge().attempt(parse("Believes[bob](raining)"), parseAll("Knows[bob](raining)"), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("knowledge_implies_belief", lastStep(r).ruleName());
    }

    @Test
    void badRepliesAndRequests() {
        var r = new CecBridge(StubTransport.replying("not json")).attempt(parse("p"), List.of(), RouteConfig.DEFAULT);
        assertStatus(ProofStatus.ERROR, r);
        var transport = new CecTransport();
        assertThrows(BridgeException.class, () -> transport.invoke("{}", 1000));
        assertThrows(BridgeException.class, () -> transport.invoke("{\"goal\": \"(and p\"}", 1000));
    }
}
