package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable substitution for rule patterns: formula metavariables and term variables.
 * A metavariable remembers the binder depth it was matched at, so a value with loose
 * bound variables can be placed back under the same binders.
 */
public final class Bindings {

    public static final Bindings EMPTY = new Bindings(Map.of(), Map.of());

    private final Map<String, Bound> formulas;
    private final Map<Term.Var, Term> terms;

    private Bindings(Map<String, Bound> formulas, Map<Term.Var, Term> terms) {
        this.formulas = formulas;
        this.terms = terms;
    }

    public Bindings with(Term.Var v, Term t) {
        var m = new HashMap<>(terms);
        m.put(v, t);
        return new Bindings(formulas, Collections.unmodifiableMap(m));
    }

    public Bindings with(String meta, Formula f, int depth) {
        var m = new HashMap<>(formulas);
        m.put(meta, new Bound(f, depth));
        return new Bindings(Collections.unmodifiableMap(m), terms);
    }

    @Nullable
    public Term term(Term.Var v) {
        return terms.get(v);
    }

    public boolean bound(String meta) {
        return formulas.containsKey(meta);
    }

    /** Value of a metavariable placed at the given binder depth, or null when unbound or not placeable there. */
    @Nullable
    public Formula formula(String meta, int depth) {
        var b = formulas.get(meta);
        if (b == null) return null;
        if (b.depth == depth || !b.formula.loose(0)) return b.formula;
        return depth > b.depth ? b.formula.shift(depth - b.depth) : null;
    }

    public Map<Term.Var, Term> terms() {
        return terms;
    }

    public int size() {
        return formulas.size() + terms.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Bindings b && formulas.equals(b.formulas) && terms.equals(b.terms);
    }

    @Override
    public int hashCode() {
        return 31 * formulas.hashCode() + terms.hashCode();
    }

    @Override
    public String toString() {
        return "Bindings" + formulas + terms;
    }

    private record Bound(Formula formula, int depth) {
        @Override
        public String toString() {
            return formula.text();
        }
    }
}
