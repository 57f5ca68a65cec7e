package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.KnowledgeBase;
import dumb.cogproof.ProofResult;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.reason.NativeProver;
import dumb.cogproof.reason.ProverConfig;
import dumb.cogproof.route.RouteConfig;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** The forward-chaining {@link NativeProver} as a routing candidate. */
public class NativeCandidate implements ProverCandidate {

    private static final Set<Capability> CAPABILITIES = Set.copyOf(EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL, Capability.MODAL));

    private final NativeProver prover;
    private final int maxFacts;

    public NativeCandidate() {
        this(new NativeProver(), ProverConfig.DEFAULT.maxFacts());
    }

    public NativeCandidate(NativeProver prover, int maxFacts) {
        this.prover = requireNonNull(prover);
        this.maxFacts = maxFacts;
    }

    @Override
    public String method() {
        return NativeProver.METHOD;
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.NATIVE;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public ProofResult attempt(Formula goal, List<Formula> axioms, RouteConfig cfg) {
        var pc = ProverConfig.DEFAULT.withDepth(cfg.maxDepth()).withTimeout(cfg.timeoutMs()).withSystem(cfg.modalSystem());
        if (maxFacts != pc.maxFacts())
            pc = new ProverConfig(pc.maxDepth(), pc.timeoutMs(), pc.system(), maxFacts, pc.categories());
        return prover.prove(goal, KnowledgeBase.of(axioms), pc);
    }

    @Override
    public String toString() {
        return method() + "[" + kind() + "]";
    }
}
