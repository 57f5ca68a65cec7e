package dumb.cogproof;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arity registry for function and predicate symbols. A symbol used with two different arities
 * is rejected; functions and predicates live in separate namespaces.
 */
public class Signature {

    private final Map<String, Integer> functions = new ConcurrentHashMap<>();
    private final Map<String, Integer> predicates = new ConcurrentHashMap<>();

    public Signature() {
        Term.ARITHMETIC.forEach(s -> functions.put(s, 2));
        Formula.Pred.COMPARISONS.forEach(s -> predicates.put(s, 2));
    }

    public void function(String symbol, int arity, Span span) throws ValidationException {
        check(functions, "function", symbol, arity, span);
    }

    public void predicate(String symbol, int arity, Span span) throws ValidationException {
        check(predicates, "predicate", symbol, arity, span);
    }

    private static void check(Map<String, Integer> table, String kind, String symbol, int arity, Span span) throws ValidationException {
        var prev = table.putIfAbsent(symbol, arity);
        if (prev != null && prev != arity)
            throw new ValidationException(kind + " '" + symbol + "' used with arity " + arity + " but declared with arity " + prev, span, symbol);
    }

    /** Checks every symbol of a formula. */
    public void check(Formula f) throws ValidationException {
        for (var g : (Iterable<Formula>) f.subformulas()::iterator) {
            if (g instanceof Formula.Pred p) predicate(p.symbol, p.arity(), Span.NONE);
            for (var t : g.terms()) checkTerm(t);
        }
    }

    private void checkTerm(Term t) throws ValidationException {
        if (t instanceof Term.Fn fn) {
            function(fn.symbol(), fn.args().size(), Span.NONE);
            for (var a : fn.args()) checkTerm(a);
        }
    }
}
