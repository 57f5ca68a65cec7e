package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofStep;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Arena of derived facts. Each node is addressed by its index and refers to its premises by index,
 * so a derivation chain is recovered without back-pointers between formulas.
 * Not thread-safe; one per proof search.
 */
public final class Derivation {

    private static final int[] NONE = new int[0];

    private final List<Formula> formulas = new ArrayList<>();
    private final List<@Nullable String> rules = new ArrayList<>();
    private final List<int[]> premises = new ArrayList<>();

    /** Adds an axiom or other given fact. */
    public int given(Formula f) {
        return add(f, null, NONE);
    }

    public int derived(Formula f, String rule, int[] premiseIds) {
        for (var p : premiseIds)
            if (p < 0 || p >= formulas.size()) throw new IllegalArgumentException("Unknown premise " + p + " for " + rule);
        return add(f, rule, premiseIds.clone());
    }

    private int add(Formula f, @Nullable String rule, int[] ps) {
        formulas.add(f);
        rules.add(rule);
        premises.add(ps);
        return formulas.size() - 1;
    }

    public Formula formula(int id) {
        return formulas.get(id);
    }

    /** Rule that derived the node; null for a given fact. */
    @Nullable
    public String rule(int id) {
        return rules.get(id);
    }

    public int[] premises(int id) {
        return premises.get(id).clone();
    }

    public int size() {
        return formulas.size();
    }

    /**
     * Rule applications leading to {@code id}, premises before conclusions, each node once.
     * Given facts contribute no step.
     */
    public List<ProofStep> chain(int id) {
        var out = new ArrayList<ProofStep>();
        var done = new BitSet(formulas.size());
        var stack = new ArrayDeque<int[]>();
        stack.push(new int[]{id, 0});
        while (!stack.isEmpty()) {
            var top = stack.peek();
            var node = top[0];
            var ps = premises.get(node);
            if (done.get(node)) {
                stack.pop();
            } else if (top[1] < ps.length) {
                var next = ps[top[1]++];
                if (!done.get(next)) stack.push(new int[]{next, 0});
            } else {
                stack.pop();
                done.set(node);
                var rule = rules.get(node);
                if (rule != null) {
                    var pf = new ArrayList<Formula>(ps.length);
                    for (var p : ps) pf.add(formulas.get(p));
                    out.add(ProofStep.of(rule, pf, formulas.get(node)));
                }
            }
        }
        return out;
    }
}
