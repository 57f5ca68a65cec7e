package dumb.cogproof.route;

import dumb.cogproof.analyze.Analysis;
import dumb.cogproof.analyze.FormulaType;
import dumb.cogproof.bridge.ProverCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Orders the candidates that can handle a problem, best first. */
public interface RoutingPolicy {

    List<ProverCandidate> rank(Analysis analysis, List<ProverCandidate> candidates);

    /** Capability filter, then a fixed score per prover kind; ties keep registration order. */
    RoutingPolicy DEFAULT = new RoutingPolicy() {
        @Override
        public List<ProverCandidate> rank(Analysis a, List<ProverCandidate> candidates) {
            var required = a.requiredCapabilities();
            var out = new ArrayList<ProverCandidate>();
            for (var c : candidates)
                if (c.capabilities().containsAll(required)) out.add(c);
            out.sort(Comparator.comparingInt((ProverCandidate c) -> RoutingPolicy.score(a, c)).reversed());
            return out;
        }

        @Override
        public String toString() {
            return "default";
        }
    };

    static int score(Analysis a, ProverCandidate c) {
        var t = a.type();
        return switch (c.kind()) {
            case NATIVE -> (t == FormulaType.PROPOSITIONAL || t == FormulaType.QUANTIFIED_PROPOSITIONAL) && a.complexity() <= 40 ? 100
                    : t == FormulaType.PURE_FOL ? 60
                    : t.modalFamily() ? 50 : 30;
            case SMT -> a.hasArithmetic() ? 95
                    : (t == FormulaType.PURE_FOL || t == FormulaType.QUANTIFIED_PROPOSITIONAL) && a.complexity() <= 70 ? 80 : 40;
            case INTERACTIVE -> a.complexity() > 70 || a.modalDepth() > 3 ? 90 : 20;
            case MODAL_TABLEAUX -> (t == FormulaType.MODAL || t == FormulaType.TEMPORAL || t == FormulaType.DEONTIC)
                    && !a.hasArithmetic() ? 97 : 25;
            case CEC -> a.hasCognitive() ? 98 : a.hasDeontic() ? 45 : 15;
            case NEURAL -> 5;
        };
    }
}
