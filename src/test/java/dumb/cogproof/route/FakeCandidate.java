package dumb.cogproof.route;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.bridge.BridgeKind;
import dumb.cogproof.bridge.ProverCandidate;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** A scripted prover for routing tests. */
final class FakeCandidate implements ProverCandidate {

    interface Behaviour {
        ProofResult run(String method) throws InterruptedException;
    }

    final AtomicInteger calls = new AtomicInteger();
    private final String method;
    private final BridgeKind kind;
    private final Behaviour behaviour;
    private Set<Capability> capabilities = EnumSet.allOf(Capability.class);
    private boolean available = true;

    FakeCandidate(String method, BridgeKind kind, Behaviour behaviour) {
        this.method = method;
        this.kind = kind;
        this.behaviour = behaviour;
    }

    static FakeCandidate answering(String method, BridgeKind kind, ProofStatus status) {
        return new FakeCandidate(method, kind, m -> switch (status) {
            case PROVED -> ProofResult.proved(m, 1, List.of());
            case DISPROVED -> ProofResult.disproved(m, 1, "w0: ~p");
            case UNKNOWN -> ProofResult.unknown(m, 1, "gave up");
            case TIMEOUT -> ProofResult.timeout(m, 1);
            case ERROR -> ProofResult.error(m, 1, "broken");
        });
    }

    FakeCandidate unavailable() {
        available = false;
        return this;
    }

    FakeCandidate capable(Capability... caps) {
        capabilities = EnumSet.of(Capability.PROPOSITIONAL, caps);
        return this;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public BridgeKind kind() {
        return kind;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public boolean available() {
        return available;
    }

    @Override
    public ProofResult attempt(Formula goal, List<Formula> axioms, RouteConfig cfg) {
        calls.incrementAndGet();
        try {
            return behaviour.run(method);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProofResult.cancelled(method, 0, "cancelled");
        }
    }

    @Override
    public String toString() {
        return method;
    }
}
