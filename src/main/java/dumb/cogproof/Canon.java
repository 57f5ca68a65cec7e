package dumb.cogproof;

import java.util.ArrayList;
import java.util.Comparator;

/**
 * Canonicalization: bound variables renamed by binding depth, And/Or chains flattened and their
 * operands ordered by content hash. The result is idempotent, so it doubles as an identity.
 */
public enum Canon {
    ;

    private static final Comparator<Formula> OPERAND_ORDER = Comparator.comparing((Formula f) -> f.hash().hex()).thenComparing(Formula::text);

    public static CanonicalForm canonicalize(Formula f) {
        return f.canonical();
    }

    public static ContentHash hash(Formula f) {
        return f.hash();
    }

    public static boolean same(Formula a, Formula b) {
        return a.hash().equals(b.hash());
    }

    static CanonicalForm build(Formula f) {
        var c = rename(reorder(f), 0);
        return new CanonicalForm(c, c.text());
    }

    private static Formula reorder(Formula f) {
        if (f instanceof Formula.Bin b && (b.op == Formula.Connective.AND || b.op == Formula.Connective.OR)) {
            var ops = new ArrayList<Formula>();
            for (var x : b.flatten()) ops.add(reorder(x));
            ops.sort(OPERAND_ORDER);
            return Formula.chain(b.op, ops);
        }
        return f.replace(g -> g == f ? null : reorder(g));
    }

    private static Formula rename(Formula f, int depth) {
        if (f instanceof Formula.Quant q) {
            var body = rename(q.body, depth + 1);
            return new Formula.Quant(q.kind, "x" + (depth + 1), body);
        }
        var renamed = f.terms().isEmpty() ? f : renameTerms(f, depth);
        return renamed.replace(g -> g == renamed ? null : rename(g, depth));
    }

    private static Formula renameTerms(Formula f, int depth) {
        var ts = new ArrayList<Term>();
        for (var t : f.terms()) ts.add(Term.replaceVars(t, v -> v.isFree() ? v :
                Term.Var.bound(v.index() < depth ? "x" + (depth - v.index()) : "_" + (v.index() - depth), v.index())));
        return f.rebuild(ts, f.children());
    }
}
