package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-sorted reading of a first-order problem for typed provers: every constant, function argument,
 * function result, predicate argument and variable is either an integer or an individual of one
 * uninterpreted sort. Numerals, arithmetic and ordering comparisons force integers; equality and
 * shared symbols propagate the choice.
 */
public final class SortInference {

    public enum Sort {
        INDIVIDUAL, INT
    }

    private static final String INT_KEY = "#int";

    private final Map<String, String> parent = new HashMap<>();
    private final Map<String, Integer> predicates = new LinkedHashMap<>();
    private final Map<String, Integer> functions = new LinkedHashMap<>();
    private final Set<String> constants = new LinkedHashSet<>();
    private final Set<String> freeVars = new LinkedHashSet<>();
    private final Map<Formula.Quant, Integer> binders = new IdentityHashMap<>();
    private final List<Formula.Quant> scope = new ArrayList<>();

    private SortInference() {
    }

    public static SortInference of(Collection<? extends Formula> formulas) {
        var s = new SortInference();
        formulas.forEach(s::walk);
        return s;
    }

    private void walk(Formula f) {
        if (f instanceof Formula.Pred p) {
            if (p.comparison() && !p.symbol.equals("=")) {
                for (var a : p.args) union(key(a), INT_KEY);
            } else if (p.symbol.equals("=") && p.arity() == 2) {
                union(key(p.args.get(0)), key(p.args.get(1)));
            } else {
                predicates.putIfAbsent(p.symbol, p.arity());
                for (var i = 0; i < p.args.size(); i++) union(key(p.args.get(i)), "p:" + p.symbol + "/" + p.arity() + "#" + i);
            }
            return;
        }
        for (var t : f.terms()) key(t);
        if (f instanceof Formula.Quant q) {
            binders.putIfAbsent(q, binders.size());
            scope.add(q);
            walk(q.body);
            scope.remove(scope.size() - 1);
        } else for (var c : f.children()) walk(c);
    }

    private String key(Term t) {
        if (t instanceof Term.Var v) {
            if (v.isFree()) {
                freeVars.add(v.name());
                return "v:" + v.name();
            }
            return v.index() < scope.size() ? "q:" + binders.get(scope.get(scope.size() - 1 - v.index())) : "v:" + v.name();
        }
        if (t instanceof Term.Const c) {
            if (c.numeric()) return INT_KEY;
            constants.add(c.name());
            return "c:" + c.name();
        }
        var fn = (Term.Fn) t;
        if (fn.arithmetic()) {
            for (var a : fn.args()) union(key(a), INT_KEY);
            return INT_KEY;
        }
        var sig = fn.symbol() + "/" + fn.args().size();
        functions.putIfAbsent(fn.symbol(), fn.args().size());
        for (var i = 0; i < fn.args().size(); i++) union(key(fn.args().get(i)), "f:" + sig + "#" + i);
        return "f:" + sig;
    }

    private String find(String k) {
        var p = parent.get(k);
        if (p == null || p.equals(k)) return k;
        var root = find(p);
        parent.put(k, root);
        return root;
    }

    private void union(String a, String b) {
        var ra = find(a);
        var rb = find(b);
        if (ra.equals(rb)) return;
        // keep the integer class rooted at its marker
        if (rb.equals(INT_KEY)) parent.put(ra, rb);
        else parent.put(rb, ra);
    }

    private Sort sort(String key) {
        return find(key).equals(find(INT_KEY)) ? Sort.INT : Sort.INDIVIDUAL;
    }

    public Sort constant(String name) {
        return sort("c:" + name);
    }

    public Sort freeVar(String name) {
        return sort("v:" + name);
    }

    /** Sort of the variable a quantifier binds. */
    public Sort bound(Formula.Quant q) {
        var id = binders.get(q);
        return id == null ? Sort.INDIVIDUAL : sort("q:" + id);
    }

    public Sort functionResult(String symbol, int arity) {
        return sort("f:" + symbol + "/" + arity);
    }

    public Sort functionArg(String symbol, int arity, int i) {
        return sort("f:" + symbol + "/" + arity + "#" + i);
    }

    public Sort predicateArg(String symbol, int arity, int i) {
        return sort("p:" + symbol + "/" + arity + "#" + i);
    }

    /** Predicate symbols with their arities, in first-occurrence order; comparisons excluded. */
    public Map<String, Integer> predicates() {
        return predicates;
    }

    public Map<String, Integer> functions() {
        return functions;
    }

    public Set<String> constants() {
        return constants;
    }

    public Set<String> freeVars() {
        return freeVars;
    }

    public boolean usesIntegers() {
        return parent.containsKey(INT_KEY) || parent.containsValue(INT_KEY);
    }
}
