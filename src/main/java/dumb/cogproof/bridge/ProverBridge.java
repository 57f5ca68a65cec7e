package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.TranslationException;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.route.RouteConfig;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static dumb.cogproof.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * A prover reached through a {@link BridgeTransport}: translate the problem into the prover's
 * language, invoke it, read its answer back.
 */
public abstract class ProverBridge implements ProverCandidate {

    protected final String method;
    protected final BridgeTransport transport;
    private final Set<Capability> capabilities;

    protected ProverBridge(String method, BridgeTransport transport, Set<Capability> capabilities) {
        this.method = requireNonNull(method);
        this.transport = requireNonNull(transport);
        this.capabilities = Set.copyOf(EnumSet.copyOf(capabilities));
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public boolean available() {
        return transport.available();
    }

    public BridgeTransport transport() {
        return transport;
    }

    /** One formula in the prover's language. */
    public abstract String translate(Formula f) throws TranslationException;

    /** The whole problem, ready to send. */
    public abstract String translate(Formula goal, List<Formula> axioms) throws TranslationException;

    public abstract ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException;

    /** The request for one attempt; the configuration matters only to some provers. */
    protected String request(Formula goal, List<Formula> axioms, RouteConfig cfg) throws TranslationException {
        return translate(goal, axioms);
    }

    public RawOutput invoke(String nativeSyntax, long timeoutMs) throws BridgeException, InterruptedException {
        return transport.invoke(nativeSyntax, timeoutMs);
    }

    @Override
    public ProofResult attempt(Formula goal, List<Formula> axioms, RouteConfig cfg) {
        var start = System.nanoTime();
        try {
            var out = invoke(request(goal, axioms, cfg), cfg.timeoutMs());
            return parseResult(out, elapsedMs(start));
        } catch (TranslationException e) {
            return ProofResult.error(method, elapsedMs(start), "not expressible for " + method + ": " + e.getMessage());
        } catch (BridgeException e) {
            if (e.isTimeout()) return ProofResult.timeout(method, elapsedMs(start));
            warning(method + " failed: " + e.getMessage());
            return ProofResult.error(method, elapsedMs(start), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProofResult.cancelled(method, elapsedMs(start), "cancelled");
        }
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return method + "[" + kind() + " via " + transport.name() + "]";
    }
}
