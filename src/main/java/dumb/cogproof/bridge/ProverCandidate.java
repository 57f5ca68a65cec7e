package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.route.RouteConfig;

import java.util.List;
import java.util.Set;

/** Anything the router can hand a proof obligation to. */
public interface ProverCandidate {

    /** Name recorded in attempts and results, and matched by a forced method. */
    String method();

    BridgeKind kind();

    Set<Capability> capabilities();

    /**
     * Tries to settle {@code axioms ⊢ goal} within the configured time. Failures are reported as
     * ERROR or TIMEOUT results rather than thrown; an interrupt yields TIMEOUT.
     */
    ProofResult attempt(Formula goal, List<Formula> axioms, RouteConfig cfg);

    default boolean available() {
        return true;
    }
}
