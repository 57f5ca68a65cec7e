package dumb.cogproof.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.TranslationException;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.syntax.DcecSyntax;
import dumb.cogproof.util.Json;

import java.util.EnumSet;
import java.util.List;

/**
 * Cognitive event calculus prover. The request is a JSON object carrying the goal and axioms as DCEC
 * s-expressions; the reply is a {@link ProofResult} in JSON.
 */
public class CecBridge extends ProverBridge {

    public static final String METHOD = "cec";

    private final DcecSyntax syntax = new DcecSyntax();

    public CecBridge() {
        this(new CecTransport());
    }

    public CecBridge(BridgeTransport transport) {
        super(METHOD, transport, EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL, Capability.MODAL));
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.CEC;
    }

    @Override
    public String translate(Formula f) throws TranslationException {
        return syntax.serialize(f);
    }

    @Override
    public String translate(Formula goal, List<Formula> axioms) throws TranslationException {
        return request(goal, axioms, RouteConfig.DEFAULT);
    }

    @Override
    protected String request(Formula goal, List<Formula> axioms, RouteConfig cfg) throws TranslationException {
        var req = Json.node();
        req.put("goal", translate(goal));
        var arr = req.putArray("axioms");
        for (var a : axioms) arr.add(translate(a));
        req.put("max_depth", cfg.maxDepth());
        req.put("timeout_ms", cfg.timeoutMs());
        return Json.str(req);
    }

    @Override
    public ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException {
        try {
            return ProofResult.fromJson(out.stdout()).withMethod(method).withElapsed(elapsedMs);
        } catch (JsonProcessingException e) {
            throw new BridgeException(method + " reply is not a proof result: " + e.getOriginalMessage(), e);
        }
    }
}
