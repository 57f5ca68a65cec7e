package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * First-order unification and one-way matching over terms, and pattern matching of rule patterns
 * against formulas. Free variables are the variables; bound variables are rigid and compare by index.
 */
public enum Unifier {
    ;

    private static final int MAX_SUBST_DEPTH = 50;

    /** Most general unifier extending {@code bindings}, with occurs check; null when none exists. */
    @Nullable
    public static Bindings unify(Term x, Term y, Bindings bindings) {
        return unifyRecursive(x, y, bindings, 0);
    }

    /** Binds variables of {@code pattern} only; variables of {@code term} are treated as constants. */
    @Nullable
    public static Bindings match(Term pattern, Term term, Bindings bindings) {
        return matchRecursive(pattern, term, bindings, 0);
    }

    /** Applies bindings, leaving unbound variables in place. */
    public static Term subst(Term term, Bindings bindings) {
        return substRecursive(term, bindings, 0);
    }

    /** Matches a rule pattern against a formula, binding metavariables and term variables together. */
    @Nullable
    public static Bindings match(Formula pattern, Formula f, Bindings bindings) {
        return matchFormula(pattern, f, bindings, 0);
    }

    /** Instantiates a rule pattern; null when a metavariable or term variable is left unbound. */
    @Nullable
    public static Formula subst(Formula pattern, Bindings bindings) {
        return substFormula(pattern, bindings, 0, true);
    }

    /** Applies bindings to a formula, leaving anything unbound as it is. */
    public static Formula apply(Formula f, Bindings bindings) {
        var r = substFormula(f, bindings, 0, false);
        return r == null ? f : r;
    }

    @Nullable
    private static Bindings unifyRecursive(Term x, Term y, @Nullable Bindings bindings, int depth) {
        if (bindings == null || depth > MAX_SUBST_DEPTH) return null;
        var xSubst = substRecursive(x, bindings, depth + 1);
        var ySubst = substRecursive(y, bindings, depth + 1);
        if (xSubst.equals(ySubst)) return bindings;
        if (xSubst instanceof Term.Var varX && varX.isFree()) return bindVariable(varX, ySubst, bindings, depth);
        if (ySubst instanceof Term.Var varY && varY.isFree()) return bindVariable(varY, xSubst, bindings, depth);
        if (xSubst instanceof Term.Fn fx && ySubst instanceof Term.Fn fy && fx.symbol().equals(fy.symbol())) {
            var s = fx.args().size();
            if (s == fy.args().size()) {
                var current = bindings;
                for (var i = 0; i < s; i++) {
                    current = unifyRecursive(fx.args().get(i), fy.args().get(i), current, depth + 1);
                    if (current == null) return null;
                }
                return current;
            }
        }
        return null;
    }

    @Nullable
    private static Bindings bindVariable(Term.Var var, Term value, Bindings bindings, int depth) {
        if (var.equals(value)) return bindings;
        var existing = bindings.term(var);
        if (existing != null) return unifyRecursive(existing, value, bindings, depth + 1);
        var finalValue = substRecursive(value, bindings, depth + 1);
        if (finalValue.loose(0) || occurs(var, finalValue, bindings, depth + 1)) return null;
        return bindings.with(var, finalValue);
    }

    private static boolean occurs(Term.Var var, Term term, Bindings bindings, int depth) {
        if (depth > MAX_SUBST_DEPTH) return true;
        var t = substRecursive(term, bindings, depth + 1);
        if (t instanceof Term.Var v) return var.equals(v);
        if (t instanceof Term.Fn fn) return fn.args().stream().anyMatch(a -> occurs(var, a, bindings, depth + 1));
        return false;
    }

    @Nullable
    private static Bindings matchRecursive(Term pattern, Term term, @Nullable Bindings bindings, int depth) {
        if (bindings == null || depth > MAX_SUBST_DEPTH) return null;
        if (pattern instanceof Term.Var v && v.isFree()) {
            var bound = bindings.term(v);
            if (bound != null) return bound.equals(term) ? bindings : null;
            return term.loose(0) ? null : bindings.with(v, term);
        }
        if (pattern instanceof Term.Fn pf && term instanceof Term.Fn tf) {
            if (!pf.symbol().equals(tf.symbol()) || pf.args().size() != tf.args().size()) return null;
            var current = bindings;
            for (var i = 0; i < pf.args().size(); i++) {
                current = matchRecursive(pf.args().get(i), tf.args().get(i), current, depth + 1);
                if (current == null) return null;
            }
            return current;
        }
        return pattern.equals(term) ? bindings : null;
    }

    private static Term substRecursive(Term term, Bindings bindings, int depth) {
        if (bindings.terms().isEmpty() || depth > MAX_SUBST_DEPTH) return term;
        if (term instanceof Term.Var v) {
            var b = v.isFree() ? bindings.term(v) : null;
            return b == null ? v : substRecursive(b, bindings, depth + 1);
        }
        if (term instanceof Term.Fn fn) {
            var changed = false;
            var args = new ArrayList<Term>(fn.args().size());
            for (var a : fn.args()) {
                var s = substRecursive(a, bindings, depth + 1);
                changed |= s != a;
                args.add(s);
            }
            return changed ? new Term.Fn(fn.symbol(), args) : fn;
        }
        return term;
    }

    @Nullable
    private static Bindings matchFormula(Formula pattern, Formula f, @Nullable Bindings bindings, int depth) {
        if (bindings == null) return null;
        if (pattern instanceof Formula.Meta m) {
            if (!bindings.bound(m.name)) return bindings.with(m.name, f, depth);
            var value = bindings.formula(m.name, depth);
            return value != null && value.equals(f) ? bindings : null;
        }
        if (pattern.getClass() != f.getClass() || !pattern.label().equals(f.label())) return null;
        var pt = pattern.terms();
        var ft = f.terms();
        if (pt.size() != ft.size()) return null;
        var current = bindings;
        for (var i = 0; i < pt.size() && current != null; i++) current = matchRecursive(pt.get(i), ft.get(i), current, 0);
        var pc = pattern.children();
        var fc = f.children();
        if (pc.size() != fc.size()) return null;
        var kidDepth = pattern instanceof Formula.Quant ? depth + 1 : depth;
        for (var i = 0; i < pc.size() && current != null; i++) current = matchFormula(pc.get(i), fc.get(i), current, kidDepth);
        return current;
    }

    @Nullable
    private static Formula substFormula(Formula pattern, Bindings bindings, int depth, boolean strict) {
        if (pattern instanceof Formula.Meta m) {
            var value = bindings.formula(m.name, depth);
            return value != null ? value : strict ? null : pattern;
        }
        var changed = false;
        var ts = pattern.terms();
        var newTerms = new ArrayList<Term>(ts.size());
        for (var t : ts) {
            var s = strict ? instantiate(t, bindings) : substRecursive(t, bindings, 0);
            if (s == null) return null;
            changed |= s != t;
            newTerms.add(s);
        }
        var cs = pattern.children();
        var newKids = new ArrayList<Formula>(cs.size());
        var kidDepth = pattern instanceof Formula.Quant ? depth + 1 : depth;
        for (var c : cs) {
            var s = substFormula(c, bindings, kidDepth, strict);
            if (s == null) return null;
            changed |= s != c;
            newKids.add(s);
        }
        return changed ? pattern.with(newTerms, newKids) : pattern;
    }

    @Nullable
    private static Term instantiate(Term t, Bindings bindings) {
        if (t instanceof Term.Var v && v.isFree()) return bindings.term(v);
        if (t instanceof Term.Fn fn) {
            var args = new ArrayList<Term>(fn.args().size());
            for (var a : fn.args()) {
                var s = instantiate(a, bindings);
                if (s == null) return null;
                args.add(s);
            }
            return args.equals(fn.args()) ? fn : new Term.Fn(fn.symbol(), args);
        }
        return t;
    }

    /** Free variables of a pattern: its term variables. */
    static List<Term.Var> variables(Formula pattern) {
        return pattern.freeVars().stream().sorted((a, b) -> a.name().compareTo(b.name())).toList();
    }
}
