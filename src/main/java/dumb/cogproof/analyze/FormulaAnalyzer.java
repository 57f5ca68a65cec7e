package dumb.cogproof.analyze;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Computes {@link Analysis} feature vectors. Stateless; safe from any thread. */
public enum FormulaAnalyzer {
    ;

    static final Set<String> MODAL_KINDS = Set.of("necessary", "possible", "always", "eventually", "next", "until", "since",
            "obligatory", "permitted", "forbidden", "believes", "knows", "intends", "desires", "perceives", "says", "common_knowledge");

    public static Analysis analyze(Formula f) {
        return analyze(f, List.of());
    }

    /** Analysis of the whole problem: the goal together with its axioms. */
    public static Analysis analyze(Formula goal, List<Formula> axioms) {
        var w = new Walk();
        w.visit(goal, 1, 0, 0);
        for (var a : axioms) w.visit(a, 1, 0, 0);
        return w.result();
    }

    private static final class Walk {
        final Map<String, Integer> ops = new HashMap<>();
        int quantDepth, astDepth, modalDepth, nodes;
        boolean modal, temporal, deontic, cognitive, arithmetic, quantifiers, functions, freeVars, polyadic;

        void visit(Formula f, int depth, int qDepth, int mDepth) {
            nodes++;
            astDepth = Math.max(astDepth, depth);
            if (f instanceof Formula.Quant) qDepth++;
            quantDepth = Math.max(quantDepth, qDepth);
            if (f instanceof Formula.Modal m) {
                modal = true;
                mDepth++;
                count(m.op.name());
            } else if (f instanceof Formula.Temporal t) {
                temporal = true;
                mDepth++;
                count(t.op.name());
            } else if (f instanceof Formula.Deontic d) {
                deontic = true;
                mDepth++;
                count(d.op.name());
            } else if (f instanceof Formula.Cognitive c) {
                cognitive = true;
                mDepth++;
                count(c.op.name());
            } else if (f instanceof Formula.Quant q) {
                quantifiers = true;
                count(q.kind.name());
            } else if (f instanceof Formula.Bin b) count(b.op.name());
            else if (f instanceof Formula.Not) count("not");
            else if (f instanceof Formula.Pred p) {
                if (p.comparison()) {
                    arithmetic |= !p.symbol.equals("=") || p.args.stream().anyMatch(FormulaAnalyzer::numeric);
                    count("comparison");
                } else count("predicate");
                if (p.arity() > 1) polyadic = true;
            } else if (f instanceof Formula.Meta) count("meta");
            modalDepth = Math.max(modalDepth, mDepth);
            for (var t : f.terms()) term(t);
            for (var c : f.children()) visit(c, depth + 1, qDepth, mDepth);
        }

        void term(Term t) {
            if (t instanceof Term.Var v && v.isFree()) freeVars = true;
            else if (t instanceof Term.Fn fn) {
                if (fn.arithmetic()) {
                    arithmetic = true;
                    count("arithmetic");
                } else {
                    functions = true;
                    count("function");
                }
                fn.args().forEach(this::term);
            }
        }

        void count(String op) {
            ops.merge(op.toLowerCase(), 1, Integer::sum);
        }

        Analysis result() {
            var families = (modal ? 1 : 0) + (temporal ? 1 : 0) + (deontic ? 1 : 0) + (cognitive ? 1 : 0);
            FormulaType type;
            if (families > 1) type = FormulaType.MIXED_MODAL;
            else if (modal) type = FormulaType.MODAL;
            else if (temporal) type = FormulaType.TEMPORAL;
            else if (deontic) type = FormulaType.DEONTIC;
            else if (cognitive) type = FormulaType.COGNITIVE;
            else if (arithmetic) type = FormulaType.ARITHMETIC;
            else if (quantifiers) type = polyadic || functions ? FormulaType.PURE_FOL : FormulaType.QUANTIFIED_PROPOSITIONAL;
            else if (functions) type = FormulaType.PURE_FOL;
            else type = FormulaType.PROPOSITIONAL;

            var score = 3 * astDepth + 8 * quantDepth + 8 * modalDepth + nodes / 2 + 5 * families + (arithmetic ? 10 : 0);
            return new Analysis(quantDepth, astDepth, modalDepth, ops, modal, temporal, deontic, cognitive,
                    arithmetic, quantifiers, functions, freeVars, Math.max(0, Math.min(100, score)), type);
        }
    }

    private static boolean numeric(Term t) {
        return t instanceof Term.Const c && c.numeric() || t instanceof Term.Fn fn && fn.arithmetic();
    }
}
