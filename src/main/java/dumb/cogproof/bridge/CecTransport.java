package dumb.cogproof.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogproof.Formula;
import dumb.cogproof.KnowledgeBase;
import dumb.cogproof.ValidationException;
import dumb.cogproof.reason.NativeProver;
import dumb.cogproof.reason.ProverConfig;
import dumb.cogproof.reason.RuleCategory;
import dumb.cogproof.syntax.DcecSyntax;
import dumb.cogproof.util.Json;

import java.util.ArrayList;
import java.util.EnumSet;

/**
 * Answers {@link CecBridge} requests in process with a rule library cut down to the event calculus:
 * cognitive, deontic and basic rules, plus the temporal ones when the problem mentions time.
 */
public class CecTransport implements BridgeTransport {

    private final NativeProver prover;
    private final DcecSyntax syntax = new DcecSyntax();

    public CecTransport() {
        this(new NativeProver());
    }

    public CecTransport(NativeProver prover) {
        this.prover = prover;
    }

    @Override
    public String name() {
        return "cec";
    }

    @Override
    public RawOutput invoke(String request, long timeoutMs) throws BridgeException, InterruptedException {
        Formula goal;
        var axioms = new ArrayList<Formula>();
        int maxDepth;
        try {
            var req = Json.the.readTree(request);
            if (req == null || !req.hasNonNull("goal")) throw new BridgeException("request has no goal");
            goal = syntax.parse(req.get("goal").asText());
            for (var a : req.path("axioms")) axioms.add(syntax.parse(a.asText()));
            maxDepth = req.path("max_depth").asInt(ProverConfig.DEFAULT.maxDepth());
        } catch (JsonProcessingException e) {
            throw new BridgeException("request is not JSON: " + e.getOriginalMessage(), e);
        } catch (ValidationException e) {
            throw new BridgeException("unreadable DCEC formula: " + e.getMessage(), e);
        }

        var categories = EnumSet.of(RuleCategory.BASIC, RuleCategory.COGNITIVE, RuleCategory.DEONTIC);
        if (goal.subformulas().anyMatch(Formula.Temporal.class::isInstance)
                || axioms.stream().anyMatch(a -> a.subformulas().anyMatch(Formula.Temporal.class::isInstance)))
            categories.add(RuleCategory.TEMPORAL_MODAL);
        var cfg = ProverConfig.DEFAULT.withDepth(maxDepth).withTimeout(timeoutMs).withCategories(categories);

        var r = prover.prove(goal, KnowledgeBase.of(axioms), cfg);
        if (Thread.interrupted()) throw new InterruptedException();
        return RawOutput.ok(r.toJson());
    }
}
