package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.analyze.Analysis;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public enum RuleCategory {
    /** Propositional and first-order rules. */
    BASIC,
    /** Belief, knowledge, intention, perception and common knowledge. */
    COGNITIVE,
    /** Obligation, permission, prohibition, and their temporal combinations. */
    DEONTIC,
    TEMPORAL_MODAL;

    /** Categories whose operators occur in {@code f}; BASIC always applies. */
    static void present(Formula f, Set<RuleCategory> out) {
        out.add(BASIC);
        f.subformulas().forEach(g -> {
            if (g instanceof Formula.Cognitive) out.add(COGNITIVE);
            else if (g instanceof Formula.Deontic) out.add(DEONTIC);
            else if (g instanceof Formula.Temporal || g instanceof Formula.Modal) out.add(TEMPORAL_MODAL);
        });
    }

    /** Search order for a goal: the family that dominates it first, then the basic rules, then the rest. */
    public static List<RuleCategory> order(Analysis a) {
        var first = switch (a.type()) {
            case COGNITIVE -> COGNITIVE;
            case DEONTIC -> DEONTIC;
            case MODAL, TEMPORAL -> TEMPORAL_MODAL;
            case MIXED_MODAL -> a.hasCognitive() ? COGNITIVE : a.hasDeontic() ? DEONTIC : TEMPORAL_MODAL;
            default -> BASIC;
        };
        var out = new ArrayList<RuleCategory>();
        out.add(first);
        if (first != BASIC) out.add(BASIC);
        for (var c : EnumSet.complementOf(EnumSet.of(first, BASIC))) out.add(c);
        return out;
    }
}
