package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;

import java.util.Comparator;
import java.util.List;

/**
 * Replaces an existential binder by a witness: a fresh constant, or a function of the formula's free
 * variables. Witness names derive from the formula's content hash, so the same formula always gets
 * the same witness.
 */
public enum Skolemizer {
    ;

    public static final String PREFIX = "sk_";

    public static Formula skolemize(Formula.Quant exists) {
        if (exists.kind != Formula.Quantifier.EXISTS)
            throw new IllegalArgumentException("Input must be an existential formula: " + exists.text());
        var name = PREFIX + (Term.IDENTIFIER.matcher(exists.var).matches() ? exists.var : "v") + "_" + exists.hash().shortHex().substring(0, 6);
        List<Term> args = exists.freeVars().stream().sorted(Comparator.comparing(Term.Var::name)).map(Term.class::cast).toList();
        var witness = args.isEmpty() ? Term.Const.of(name) : new Term.Fn(name, args);
        return exists.instantiate(witness);
    }
}
