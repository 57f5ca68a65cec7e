package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStep;
import dumb.cogproof.TranslationException;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.syntax.ModalSyntax;

import java.util.EnumSet;
import java.util.List;

/**
 * Labelled tableaux for the propositional multi-modal fragment. The problem goes out as lines of
 * {@link ModalSyntax}: {@code system: S4}, then {@code axiom: ...} lines, then one {@code goal: ...}
 * line. The reply is {@code valid}, {@code invalid} followed by the countermodel, or
 * {@code unknown <reason>}.
 */
public class ModalTableauxBridge extends ProverBridge {

    public static final String METHOD = "modal_tableaux";

    private final ModalSyntax syntax = new ModalSyntax();

    public ModalTableauxBridge() {
        this(new TableauxTransport());
    }

    public ModalTableauxBridge(BridgeTransport transport) {
        super(METHOD, transport, EnumSet.of(Capability.PROPOSITIONAL, Capability.MODAL));
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.MODAL_TABLEAUX;
    }

    @Override
    public String translate(Formula f) throws TranslationException {
        return syntax.serialize(f);
    }

    @Override
    public String translate(Formula goal, List<Formula> axioms) throws TranslationException {
        var sb = new StringBuilder();
        for (var a : axioms) sb.append("axiom: ").append(translate(a)).append('\n');
        return sb.append("goal: ").append(translate(goal)).append('\n').toString();
    }

    @Override
    protected String request(Formula goal, List<Formula> axioms, RouteConfig cfg) throws TranslationException {
        return "system: " + cfg.modalSystem() + '\n' + translate(goal, axioms);
    }

    @Override
    public ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException {
        var text = out.stdout().strip();
        if (text.equals("valid"))
            return ProofResult.proved(method, elapsedMs, List.of(new ProofStep("tableau_closed", List.of(), "goal")));
        if (text.startsWith("invalid"))
            return ProofResult.disproved(method, elapsedMs, text.substring("invalid".length()).strip());
        if (text.startsWith("unknown"))
            return ProofResult.unknown(method, elapsedMs, text.substring("unknown".length()).strip());
        throw new BridgeException(method + " gave an unreadable answer: " + (text.isEmpty() ? out.stderr().strip() : text));
    }
}
