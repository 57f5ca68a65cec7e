package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.ProofStep;
import dumb.cogproof.analyze.Capability;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Asks a language model for a verdict. Its answers are judgements, not proofs, so the router tries it
 * last; the reason it gives is kept as the result message.
 */
public class NeuralBridge extends ProverBridge {

    static final String VERDICT = "VERDICT:";
    static final String REASON = "REASON:";

    public NeuralBridge(String method, BridgeTransport transport) {
        super(method, transport, EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL, Capability.ARITHMETIC, Capability.MODAL));
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.NEURAL;
    }

    @Override
    public String translate(Formula f) {
        return f.text();
    }

    @Override
    public String translate(Formula goal, List<Formula> axioms) {
        var sb = new StringBuilder();
        sb.append("You are a careful logician. Formulas are temporal deontic first-order logic: ")
                .append("~ & | -> <->, forall x. / exists x., Always, Eventually, Next, Until, Since, Necessary, Possible, ")
                .append("Obligatory[agent], Permitted[agent], Forbidden[agent], Believes[agent], Knows[agent], CommonKnowledge.\n\n");
        if (axioms.isEmpty()) sb.append("There are no premises.\n");
        else {
            sb.append("Premises:\n");
            for (var i = 0; i < axioms.size(); i++) sb.append(i + 1).append(". ").append(axioms.get(i).text()).append('\n');
        }
        sb.append("\nConclusion: ").append(goal.text()).append("\n\n")
                .append("Does the conclusion follow from the premises? Answer with exactly two lines:\n")
                .append(VERDICT).append(" PROVED, DISPROVED or UNKNOWN\n")
                .append(REASON).append(" one sentence\n");
        return sb.toString();
    }

    @Override
    public ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException {
        String verdict = null, reason = null;
        for (var line : out.stdout().lines().map(String::strip).toList()) {
            var upper = line.toUpperCase(Locale.ROOT);
            if (verdict == null && upper.startsWith(VERDICT)) verdict = upper.substring(VERDICT.length()).strip();
            else if (reason == null && upper.startsWith(REASON)) reason = line.substring(REASON.length()).strip();
        }
        if (verdict == null) throw new BridgeException(method + " reply has no verdict line");
        var note = "model judgement, not machine-checked" + (reason == null || reason.isEmpty() ? "" : ": " + reason);
        if (verdict.startsWith("PROVED")) {
            var r = ProofResult.proved(method, elapsedMs, List.of(new ProofStep(method + "_judgement", List.of(), "goal")));
            return new ProofResult(r.status(), r.method(), r.elapsedMs(), r.steps(), r.attempts(), note, null, false);
        }
        if (verdict.startsWith("DISPROVED"))
            return new ProofResult(ProofStatus.DISPROVED, method, elapsedMs, List.of(), List.of(), note, null, false);
        return ProofResult.unknown(method, elapsedMs, note);
    }
}
