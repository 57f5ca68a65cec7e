package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStep;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.analyze.Capability;
import dumb.cogproof.syntax.SortInference;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SMT-LIB 2 back end (z3, cvc5). The problem asserts the axioms and the negated goal: {@code unsat}
 * proves the goal, {@code sat} refutes it. Symbols live in one uninterpreted sort {@code U} or in
 * {@code Int}, as {@link SortInference} decides; free variables become constants.
 */
public class SmtBridge extends ProverBridge {

    private static final Pattern SIMPLE = Pattern.compile("[A-Za-z][A-Za-z0-9_.]*");
    private static final Map<String, String> ARITHMETIC = Map.of("+", "+", "-", "-", "*", "*", "/", "div");

    public SmtBridge(String method, BridgeTransport transport) {
        super(method, transport, EnumSet.of(Capability.PROPOSITIONAL, Capability.FOL, Capability.ARITHMETIC));
    }

    public static SmtBridge z3(String executable) {
        return new SmtBridge("z3", ProcessTransport.stdin(executable, "-in", "-smt2"));
    }

    public static SmtBridge cvc5(String executable) {
        return new SmtBridge("cvc5", ProcessTransport.stdin(executable, "--lang=smt2"));
    }

    @Override
    public BridgeKind kind() {
        return BridgeKind.SMT;
    }

    @Override
    public String translate(Formula f) throws TranslationException {
        var w = new Writer(SortInference.of(List.of(f)));
        w.formula(f);
        return w.sb.toString();
    }

    @Override
    public String translate(Formula goal, List<Formula> axioms) throws TranslationException {
        var all = new ArrayList<>(axioms);
        all.add(goal);
        var sorts = SortInference.of(all);
        var sb = new StringBuilder("(set-logic ALL)\n(declare-sort U 0)\n");
        for (var c : sorts.constants())
            sb.append("(declare-const ").append(symbol(c)).append(' ').append(sort(sorts.constant(c))).append(")\n");
        for (var v : sorts.freeVars())
            sb.append("(declare-const ").append(symbol("?" + v)).append(' ').append(sort(sorts.freeVar(v))).append(")\n");
        for (var e : sorts.functions().entrySet()) {
            sb.append("(declare-fun ").append(symbol(e.getKey())).append(" (");
            for (var i = 0; i < e.getValue(); i++)
                sb.append(i > 0 ? " " : "").append(sort(sorts.functionArg(e.getKey(), e.getValue(), i)));
            sb.append(") ").append(sort(sorts.functionResult(e.getKey(), e.getValue()))).append(")\n");
        }
        for (var e : sorts.predicates().entrySet()) {
            sb.append("(declare-fun ").append(symbol(e.getKey())).append(" (");
            for (var i = 0; i < e.getValue(); i++)
                sb.append(i > 0 ? " " : "").append(sort(sorts.predicateArg(e.getKey(), e.getValue(), i)));
            sb.append(") Bool)\n");
        }
        var w = new Writer(sorts);
        for (var a : axioms) {
            sb.append("(assert ");
            w.sb.setLength(0);
            w.formula(a);
            sb.append(w.sb).append(")\n");
        }
        w.sb.setLength(0);
        w.formula(goal);
        sb.append("(assert (not ").append(w.sb).append("))\n(check-sat)\n");
        return sb.toString();
    }

    @Override
    public ProofResult parseResult(RawOutput out, long elapsedMs) throws BridgeException {
        var lines = out.stdout().strip().lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
        var answer = lines.isEmpty() ? "" : lines.get(0);
        switch (answer) {
            case "unsat":
                return ProofResult.proved(method, elapsedMs, List.of(new ProofStep(method + "_refutation", List.of(), "unsat")));
            case "sat":
                return ProofResult.disproved(method, elapsedMs, lines.size() > 1 ? String.join("\n", lines.subList(1, lines.size())) : null);
            case "unknown":
            case "timeout":
                return ProofResult.unknown(method, elapsedMs, method + " answered " + answer);
            default:
                var detail = out.combined().strip();
                throw new BridgeException(method + " gave no verdict (exit " + out.exitCode() + ")"
                        + (detail.isEmpty() ? "" : ": " + detail.lines().findFirst().orElse("")));
        }
    }

    private static String sort(SortInference.Sort s) {
        return s == SortInference.Sort.INT ? "Int" : "U";
    }

    static String symbol(String s) {
        if (SIMPLE.matcher(s).matches()) return s;
        if (s.indexOf('|') >= 0 || s.indexOf('\\') >= 0) return "|" + s.replace("|", "_").replace("\\", "_") + "|";
        return "|" + s + "|";
    }

    private static final class Writer {
        final StringBuilder sb = new StringBuilder();
        private final SortInference sorts;
        private final List<String> scope = new ArrayList<>();

        Writer(SortInference sorts) {
            this.sorts = sorts;
        }

        void formula(Formula f) throws TranslationException {
            if (f instanceof Formula.Pred p) {
                if (p.args.isEmpty()) {
                    sb.append(symbol(p.symbol));
                    return;
                }
                sb.append('(').append(p.comparison() ? p.symbol : symbol(p.symbol));
                for (var a : p.args) {
                    sb.append(' ');
                    term(a);
                }
                sb.append(')');
            } else if (f instanceof Formula.Not n) {
                sb.append("(not ");
                formula(n.body);
                sb.append(')');
            } else if (f instanceof Formula.Bin b) {
                sb.append('(').append(switch (b.op) {
                    case AND -> "and";
                    case OR -> "or";
                    case IMPLIES -> "=>";
                    case IFF -> "=";
                }).append(' ');
                formula(b.left);
                sb.append(' ');
                formula(b.right);
                sb.append(')');
            } else if (f instanceof Formula.Quant q) {
                var name = "x!" + scope.size();
                sb.append('(').append(q.kind.keyword).append(" ((").append(name).append(' ')
                        .append(sort(sorts.bound(q))).append(")) ");
                scope.add(name);
                formula(q.body);
                scope.remove(scope.size() - 1);
                sb.append(')');
            } else {
                var construct = f.getClass().getSimpleName();
                throw new TranslationException("SMT-LIB has no " + construct.toLowerCase() + " operators", construct);
            }
        }

        private void term(Term t) throws TranslationException {
            if (t instanceof Term.Var v) {
                if (v.isFree()) sb.append(symbol("?" + v.name()));
                else if (v.index() < scope.size()) sb.append(scope.get(scope.size() - 1 - v.index()));
                else throw new TranslationException("unbound variable " + v.name(), v.name());
            } else if (t instanceof Term.Const c) {
                if (c.numeric()) {
                    if (c.name().contains(".")) throw new TranslationException("real numeral " + c.name() + " in integer arithmetic", c.name());
                    sb.append(c.name().startsWith("-") ? "(- " + c.name().substring(1) + ")" : c.name());
                } else sb.append(symbol(c.name()));
            } else if (t instanceof Term.Fn fn) {
                sb.append('(').append(fn.arithmetic() ? ARITHMETIC.get(fn.symbol()) : symbol(fn.symbol()));
                for (var a : fn.args()) {
                    sb.append(' ');
                    term(a);
                }
                sb.append(')');
            }
        }
    }
}
