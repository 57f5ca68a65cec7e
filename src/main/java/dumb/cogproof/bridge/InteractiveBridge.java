package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStep;
import dumb.cogproof.TranslationException;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.syntax.InteractiveSyntax;

import java.util.EnumSet;
import java.util.List;

/**
 * Lean 4 or Coq, run in batch mode on a generated theory file. The goal is stated as a theorem over
 * the axioms and attacked with a fixed tactic script; a checked file proves it. A failed tactic leaves
 * the goal open, which is UNKNOWN; any other error means the file was rejected.
 */
public class InteractiveBridge extends ProverBridge {

    private static final List<String> LEAN_OPEN = List.of("unsolved goals", "failed", "omega could not", "simp made no progress");
    private static final List<String> COQ_OPEN = List.of("Tactic failure", "No applicable tactic", "incomplete proof", "Cannot find", "not found");

    private final InteractiveSyntax syntax;

    public InteractiveBridge(String method, InteractiveSyntax.Dialect dialect, BridgeTransport transport) {
        super(method, transport, EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL, Capability.ARITHMETIC,
                Capability.MODAL, Capability.INTERACTIVE));
        this.syntax = new InteractiveSyntax(dialect);
    }

    public static InteractiveBridge lean(String executable) {
        return new InteractiveBridge("lean", InteractiveSyntax.Dialect.LEAN, ProcessTransport.file(".lean", executable));
    }

    public static InteractiveBridge coq(String executable) {
        return new InteractiveBridge("coq", InteractiveSyntax.Dialect.COQ, ProcessTransport.file(".v", executable, "-q"));
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.INTERACTIVE;
    }

    public InteractiveSyntax.Dialect dialect() {
        return syntax.dialect();
    }

    @Override
    public String translate(Formula f) throws TranslationException {
        return syntax.serialize(f);
    }

    @Override
    public String translate(Formula goal, List<Formula> axioms) throws TranslationException {
        return syntax.problem(goal, axioms);
    }

    @Override
    public ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException {
        var text = out.combined();
        var firstError = text.lines().filter(l -> l.contains("error") || l.contains("Error")).findFirst().orElse(null);
        if (out.exitCode() == 0 && firstError == null)
            return ProofResult.proved(method, elapsedMs, List.of(new ProofStep(method + "_tactic", List.of(), "goal_holds")));
        var open = syntax.dialect() == InteractiveSyntax.Dialect.LEAN ? LEAN_OPEN : COQ_OPEN;
        if (open.stream().anyMatch(text::contains))
            return ProofResult.unknown(method, elapsedMs, "tactics left the goal open" + (firstError == null ? "" : ": " + firstError.strip()));
        throw new BridgeException(method + " rejected the theory (exit " + out.exitCode() + ")"
                + (firstError == null ? "" : ": " + firstError.strip()));
    }
}
