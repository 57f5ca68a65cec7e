package dumb.cogproof.modal;

import dumb.cogproof.Formula;
import dumb.cogproof.TranslationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * Labelled multi-modal tableau. Every modality family gets its own accessibility relation with its own
 * frame conditions: {@code Necessary} uses the configured system, {@code Always} S4, {@code Next} D,
 * each obligation index D, each knower S5, each believer KD4, common knowledge S4, and the remaining
 * attitudes K. Sub-formulas without a modal reading (quantifiers, Until, Since) are opaque atoms.
 * <p>
 * {@code axioms → goal} is valid when every branch of the tableau for {@code axioms ∧ ¬goal} closes;
 * an open saturated branch is a countermodel. Subset blocking keeps transitive frames finite.
 */
public final class Tableaux {

    public static final int DEFAULT_MAX_WORLDS = 64;

    private final ModalSystem system;
    private final int maxWorlds;
    private final long deadline;

    public Tableaux(ModalSystem system, int maxWorlds, long timeoutMs) {
        if (maxWorlds <= 0) throw new IllegalArgumentException("maxWorlds must be positive");
        this.system = system;
        this.maxWorlds = maxWorlds;
        this.deadline = System.nanoTime() + timeoutMs * 1_000_000;
    }

    public enum Verdict {
        VALID, INVALID, UNKNOWN
    }

    /** Result of one check; {@code countermodel} is set when the verdict is INVALID. */
    public record Outcome(Verdict verdict, @Nullable Countermodel countermodel, int worlds, @Nullable String reason) {
    }

    public record Edge(String relation, int from, int to) {
        @Override
        public String toString() {
            return "w" + from + " -" + relation + "-> w" + to;
        }
    }

    /** Worlds with the atoms true and false in each, and the accessibility edges between them. */
    public record Countermodel(List<Map<String, Boolean>> valuations, List<Edge> edges) {
        @Override
        public String toString() {
            var sb = new StringBuilder();
            for (var w = 0; w < valuations.size(); w++) {
                if (w > 0) sb.append('\n');
                sb.append('w').append(w).append(':');
                valuations.get(w).forEach((atom, v) -> sb.append(' ').append(v ? "" : "~").append(atom));
            }
            for (var e : edges) sb.append('\n').append(e);
            return sb.toString();
        }
    }

    /**
     * @throws TimeoutException when the time budget runs out before the tableau is saturated
     */
    public Outcome check(Formula goal, List<Formula> axioms) throws TranslationException, InterruptedException, TimeoutException {
        var root = new Branch();
        root.world(-1);
        for (var a : axioms) root.agenda.add(new Task(0, nnf(a, true)));
        root.agenda.add(new Task(0, nnf(goal, false)));
        return expand(root);
    }

    // ---- negation normal form over labelled relations

    record Rel(String name, ModalSystem.Frame frame) {
    }

    sealed interface Node permits Lit, Top, And, Or, Box, Dia {
    }

    record Lit(String atom, boolean positive) implements Node {
    }

    /** Holds everywhere; body of the diamond a serial relation demands. */
    record Top() implements Node {
    }

    record And(Node left, Node right) implements Node {
    }

    record Or(Node left, Node right) implements Node {
    }

    record Box(Rel rel, Node body) implements Node {
    }

    record Dia(Rel rel, Node body) implements Node {
    }

    private static final Top TOP = new Top();

    private Node nnf(Formula f, boolean pos) throws TranslationException {
        if (f instanceof Formula.Meta) throw new TranslationException("rule metavariables have no modal reading", "meta");
        if (f instanceof Formula.Not n) return nnf(n.body, !pos);
        if (f instanceof Formula.Bin b) {
            return switch (b.op) {
                case AND -> pos ? new And(nnf(b.left, true), nnf(b.right, true)) : new Or(nnf(b.left, false), nnf(b.right, false));
                case OR -> pos ? new Or(nnf(b.left, true), nnf(b.right, true)) : new And(nnf(b.left, false), nnf(b.right, false));
                case IMPLIES -> pos ? new Or(nnf(b.left, false), nnf(b.right, true)) : new And(nnf(b.left, true), nnf(b.right, false));
                case IFF -> pos
                        ? new Or(new And(nnf(b.left, true), nnf(b.right, true)), new And(nnf(b.left, false), nnf(b.right, false)))
                        : new Or(new And(nnf(b.left, true), nnf(b.right, false)), new And(nnf(b.left, false), nnf(b.right, true)));
            };
        }
        if (f instanceof Formula.Modal m) {
            var rel = new Rel("[]", system.frame);
            return modal(rel, m.op == Formula.ModalOp.NECESSARY, m.body, pos);
        }
        if (f instanceof Formula.Temporal t) {
            return switch (t.op) {
                case ALWAYS -> modal(new Rel("G", ModalSystem.S4.frame), true, t.body, pos);
                case EVENTUALLY -> modal(new Rel("G", ModalSystem.S4.frame), false, t.body, pos);
                case NEXT -> new Box(new Rel("X", ModalSystem.D.frame), nnf(t.body, pos));
                default -> atom(f, pos);
            };
        }
        if (f instanceof Formula.Deontic d) {
            var rel = new Rel("O:" + d.agent.text(), ModalSystem.D.frame);
            return switch (d.op) {
                case OBLIGATORY -> modal(rel, true, d.action, pos);
                case PERMITTED -> modal(rel, false, d.action, pos);
                case FORBIDDEN -> pos ? new Box(rel, nnf(d.action, false)) : new Dia(rel, nnf(d.action, true));
            };
        }
        if (f instanceof Formula.Cognitive c) {
            var rel = switch (c.op) {
                case KNOWS -> new Rel("K:" + c.agent.text(), ModalSystem.S5.frame);
                case BELIEVES -> new Rel("B:" + c.agent.text(), ModalSystem.Frame.BELIEF);
                case COMMON_KNOWLEDGE -> new Rel("C", ModalSystem.S4.frame);
                default -> new Rel(c.op.keyword + ":" + c.agent.text(), ModalSystem.Frame.BASIC);
            };
            return modal(rel, true, c.body, pos);
        }
        return atom(f, pos);
    }

    private Node modal(Rel rel, boolean box, Formula body, boolean pos) throws TranslationException {
        return box == pos ? new Box(rel, nnf(body, pos)) : new Dia(rel, nnf(body, pos));
    }

    private static Node atom(Formula f, boolean pos) throws TranslationException {
        if (f.loose(0)) throw new TranslationException("open sub-formula has no modal reading", f.text());
        return new Lit(f.canonical().text(), pos);
    }

    // ---- branches

    private record Task(int world, Node node) {
    }

    private enum Status {
        OPEN, CLOSED, LIMIT
    }

    private final class Branch {
        final List<Set<Node>> labels;
        final List<Integer> parents;
        final List<Map<String, Boolean>> valuation;
        final Set<Edge> edges;
        final Deque<Task> agenda;
        final List<Task> disjunctions, diamonds;

        Branch() {
            labels = new ArrayList<>();
            parents = new ArrayList<>();
            valuation = new ArrayList<>();
            edges = new LinkedHashSet<>();
            agenda = new ArrayDeque<>();
            disjunctions = new ArrayList<>();
            diamonds = new ArrayList<>();
        }

        Branch(Branch b) {
            labels = new ArrayList<>(b.labels.size());
            b.labels.forEach(l -> labels.add(new LinkedHashSet<>(l)));
            parents = new ArrayList<>(b.parents);
            valuation = new ArrayList<>(b.valuation.size());
            b.valuation.forEach(v -> valuation.add(new TreeMap<>(v)));
            edges = new LinkedHashSet<>(b.edges);
            agenda = new ArrayDeque<>(b.agenda);
            disjunctions = new ArrayList<>(b.disjunctions);
            diamonds = new ArrayList<>(b.diamonds);
        }

        int world(int parent) {
            labels.add(new LinkedHashSet<>());
            parents.add(parent);
            valuation.add(new TreeMap<>());
            return labels.size() - 1;
        }

        List<Integer> successors(Rel rel, int w) {
            var out = new ArrayList<Integer>();
            for (var e : edges) if (e.from == w && e.relation.equals(rel.name)) out.add(e.to);
            return out;
        }

        void edge(Rel rel, int from, int to) {
            if (!edges.add(new Edge(rel.name, from, to))) return;
            for (var n : labels.get(from)) {
                if (n instanceof Box b && b.rel.equals(rel)) {
                    agenda.add(new Task(to, b.body));
                    if (rel.frame.transitive()) agenda.add(new Task(to, b));
                }
            }
            if (rel.frame.euclidean()) edge(rel, to, from);
        }

        /** False on a clash. */
        boolean add(Task t) {
            var w = t.world;
            if (!labels.get(w).add(t.node)) return true;
            var n = t.node;
            if (n instanceof Lit l) {
                var prev = valuation.get(w).putIfAbsent(l.atom, l.positive);
                return prev == null || prev == l.positive;
            }
            if (n instanceof And a) {
                agenda.add(new Task(w, a.left));
                agenda.add(new Task(w, a.right));
            } else if (n instanceof Or) {
                disjunctions.add(t);
            } else if (n instanceof Box b) {
                for (var v : successors(b.rel, w)) {
                    agenda.add(new Task(v, b.body));
                    if (b.rel.frame.transitive()) agenda.add(new Task(v, b));
                }
                if (b.rel.frame.reflexive()) agenda.add(new Task(w, b.body));
                else if (b.rel.frame.serial()) diamonds.add(new Task(w, new Dia(b.rel, TOP)));
            } else if (n instanceof Dia) {
                diamonds.add(t);
            }
            return true;
        }

        boolean blocked(int w) {
            for (var u = parents.get(w); u >= 0; u = parents.get(u))
                if (labels.get(u).containsAll(labels.get(w))) return true;
            return false;
        }

        Countermodel model() {
            var vals = new ArrayList<Map<String, Boolean>>(valuation.size());
            valuation.forEach(v -> vals.add(Map.copyOf(new TreeMap<>(v))));
            return new Countermodel(vals, List.copyOf(edges));
        }
    }

    private Outcome expand(Branch root) throws InterruptedException, TimeoutException {
        var r = new Outcome[1];
        var s = expand(root, r);
        return switch (s) {
            case CLOSED -> new Outcome(Verdict.VALID, null, root.labels.size(), null);
            case OPEN -> r[0];
            case LIMIT -> new Outcome(Verdict.UNKNOWN, null, maxWorlds, "world limit " + maxWorlds + " reached");
        };
    }

    private Status expand(Branch b, Outcome[] open) throws InterruptedException, TimeoutException {
        while (true) {
            if (Thread.interrupted()) throw new InterruptedException();
            if (System.nanoTime() - deadline > 0) throw new TimeoutException("tableau deadline exceeded");
            while (!b.agenda.isEmpty())
                if (!b.add(b.agenda.poll())) return Status.CLOSED;

            if (!b.disjunctions.isEmpty()) {
                var t = b.disjunctions.remove(0);
                var or = (Or) t.node;
                var label = b.labels.get(t.world);
                if (label.contains(or.left) || label.contains(or.right)) continue;
                var limited = false;
                for (var choice : List.of(or.left, or.right)) {
                    var child = new Branch(b);
                    child.agenda.add(new Task(t.world, choice));
                    var s = expand(child, open);
                    if (s == Status.OPEN) return s;
                    limited |= s == Status.LIMIT;
                }
                return limited ? Status.LIMIT : Status.CLOSED;
            }

            if (!b.diamonds.isEmpty()) {
                var t = b.diamonds.remove(0);
                var d = (Dia) t.node;
                if (b.blocked(t.world)) continue;
                var witnessed = false;
                for (var v : b.successors(d.rel, t.world))
                    if (d.body == TOP || b.labels.get(v).contains(d.body)) witnessed = true;
                if (witnessed) continue;
                if (b.labels.size() >= maxWorlds) return Status.LIMIT;
                var v = b.world(t.world);
                b.agenda.add(new Task(v, d.body));
                b.edge(d.rel, t.world, v);
                continue;
            }

            open[0] = new Outcome(Verdict.INVALID, b.model(), b.labels.size(), null);
            return Status.OPEN;
        }
    }
}
