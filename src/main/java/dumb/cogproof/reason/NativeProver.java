package dumb.cogproof.reason;

import dumb.cogproof.ContentHash;
import dumb.cogproof.Formula;
import dumb.cogproof.KnowledgeBase;
import dumb.cogproof.ProofResult;
import dumb.cogproof.analyze.Analysis;
import dumb.cogproof.analyze.FormulaAnalyzer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.cogproof.util.Log.debug;

/**
 * Bounded semi-naive forward chaining over a {@link RuleLibrary}. Each iteration fires every active
 * rule with at least one premise taken from the facts the previous iteration added, and stops as soon
 * as a derived fact has the goal's content hash. Reentrant: all search state lives in one
 * {@link Search} per call.
 */
public class NativeProver {

    public static final String METHOD = "native";

    private static final int MAX_TARGETS = 256;
    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private final RuleLibrary library;

    public NativeProver() {
        this(RuleLibrary.standard());
    }

    public NativeProver(RuleLibrary library) {
        this.library = library;
    }

    public RuleLibrary library() {
        return library;
    }

    public ProofResult prove(Formula goal, KnowledgeBase kb, ProverConfig cfg) {
        return prove(goal, kb, cfg, FormulaAnalyzer.analyze(goal, kb.facts().toList()));
    }

    public ProofResult prove(Formula goal, KnowledgeBase kb, ProverConfig cfg, Analysis analysis) {
        var start = System.nanoTime();
        if (kb.contains(goal)) return ProofResult.proved(METHOD, elapsedMs(start), List.of());
        var r = new Search(goal, kb, cfg, analysis, start).run();
        debug("native " + r.status() + " for " + goal.text() + " in " + r.elapsedMs() + "ms");
        return r;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private final class Search {
        private final ContentHash goalHash;
        private final ProverConfig cfg;
        private final long start, deadline;
        private final Derivation derivation = new Derivation();
        private final Map<ContentHash, Integer> ids = new HashMap<>();
        private final Set<RuleCategory> present = EnumSet.noneOf(RuleCategory.class);
        private final List<InferenceRule> rules = new ArrayList<>();
        private final Map<InferenceRule, List<Bindings>> seeds = new IdentityHashMap<>();
        private final RuleContext ctx;
        private final int givenCount, maxWeight;

        private KnowledgeBase cur;
        private List<Formula> fresh = new ArrayList<>();
        private @Nullable ProofResult outcome;
        private long ticks;

        Search(Formula goal, KnowledgeBase kb, ProverConfig cfg, Analysis analysis, long start) {
            this.goalHash = goal.hash();
            this.cfg = cfg;
            this.start = start;
            this.deadline = start + cfg.timeoutMs() * 1_000_000;

            var facts = kb.facts().toList();
            for (var f : facts) ids.putIfAbsent(f.hash(), derivation.given(f));
            this.givenCount = derivation.size();
            this.cur = KnowledgeBase.of(facts);

            RuleCategory.present(goal, present);
            facts.forEach(f -> RuleCategory.present(f, present));

            var targets = new LinkedHashSet<Formula>();
            goal.subformulas().filter(Search::closed).forEach(targets::add);
            for (var f : facts) {
                if (targets.size() >= MAX_TARGETS) break;
                f.subformulas().filter(Search::closed).limit(MAX_TARGETS - targets.size()).forEach(targets::add);
            }
            this.ctx = new RuleContext(goal, new ArrayList<>(targets), RuleLibrary.groundTerms(goal, facts), cfg.system());

            for (var c : RuleCategory.order(analysis)) {
                if (!cfg.categories().contains(c)) continue;
                for (var r : library.rules(c)) {
                    if (!r.enabled(cfg.system())) continue;
                    rules.add(r);
                    seeds.put(r, r.goalDirected() ? r.seeds(ctx.targets()) : List.of(Bindings.EMPTY));
                }
            }

            var w = goal.weight();
            for (var f : facts) w = Math.max(w, f.weight());
            this.maxWeight = 2 * w + 4;
        }

        private static boolean closed(Formula f) {
            return !f.loose(0) && !f.hasMeta();
        }

        ProofResult run() {
            try {
                for (var iteration = 1; iteration <= cfg.maxDepth(); iteration++) {
                    fresh = new ArrayList<>();
                    for (var r : rules) {
                        if (!present.contains(r.category())) continue;
                        var n = r.premises().size();
                        for (var seed : seeds.get(r)) {
                            if (n == 0) {
                                if (iteration == 1 && fire(r, seed, new Formula[0])) return outcome;
                                continue;
                            }
                            for (var dpos = 0; dpos < n; dpos++)
                                if (join(r, dpos, 0, seed, new Formula[n])) return outcome;
                        }
                    }
                    if (fresh.isEmpty())
                        return ProofResult.unknown(METHOD, elapsedMs(start), "saturated after " + iteration + " iterations, " + derived() + " facts derived");
                    cur = cur.extend(fresh);
                    fresh.forEach(f -> RuleCategory.present(f, present));
                }
                return ProofResult.unknown(METHOD, elapsedMs(start), "depth limit " + cfg.maxDepth() + " reached, " + derived() + " facts derived");
            } catch (Deadline e) {
                return ProofResult.timeout(METHOD, elapsedMs(start));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProofResult.cancelled(METHOD, elapsedMs(start), "cancelled");
            }
        }

        private int derived() {
            return derivation.size() - givenCount;
        }

        /** Matches premise {@code j} onward; premises before {@code dpos} come from the old facts, {@code dpos} from the newest. */
        private boolean join(InferenceRule r, int dpos, int j, Bindings b, Formula[] matched) throws InterruptedException {
            if (j == matched.length) return fire(r, b, matched);
            var pattern = r.premises().get(j);
            var inst = Unifier.subst(pattern, b);
            if (inst != null) {
                var fact = lookup(inst.hash(), j, dpos);
                if (fact == null) return false;
                matched[j] = fact;
                return join(r, dpos, j + 1, b, matched);
            }
            for (var f : candidates(pattern, j, dpos)) {
                tick();
                var next = Unifier.match(pattern, f, b);
                if (next == null) continue;
                matched[j] = f;
                if (join(r, dpos, j + 1, next, matched)) return true;
            }
            return false;
        }

        @Nullable
        private Formula lookup(ContentHash h, int j, int dpos) {
            var old = cur.parent();
            if (j < dpos) return old.get(h);
            var f = cur.get(h);
            if (j == dpos && f != null && old.contains(h)) return null;
            return f;
        }

        private List<Formula> candidates(Formula pattern, int j, int dpos) {
            var head = KnowledgeBase.head(pattern);
            if (j == dpos) {
                var delta = cur.delta();
                return head == null ? delta : delta.stream().filter(f -> head.equals(KnowledgeBase.head(f))).toList();
            }
            return (j < dpos ? cur.parent() : cur).withHead(head).toList();
        }

        private boolean fire(InferenceRule r, Bindings b, Formula[] matched) throws InterruptedException {
            tick();
            var conclusions = r.conclude(b, Arrays.asList(matched), ctx);
            if (conclusions.isEmpty()) return false;
            var premiseIds = new int[matched.length];
            for (var i = 0; i < matched.length; i++) premiseIds[i] = ids.get(matched[i].hash());
            for (var c : conclusions)
                if (emit(c, r.name(), premiseIds)) return true;
            return false;
        }

        private boolean emit(Formula c, String rule, int[] premiseIds) {
            if (c.hasMeta() || c.loose(0) || c.weight() > maxWeight) return false;
            var h = c.hash();
            if (ids.containsKey(h)) return false;
            var id = derivation.derived(c, rule, premiseIds);
            ids.put(h, id);
            fresh.add(c);
            if (h.equals(goalHash)) {
                outcome = ProofResult.proved(METHOD, elapsedMs(start), derivation.chain(id));
                return true;
            }
            if (derived() >= cfg.maxFacts()) {
                outcome = ProofResult.unknown(METHOD, elapsedMs(start), "fact limit " + cfg.maxFacts() + " reached");
                return true;
            }
            return false;
        }

        private void tick() throws InterruptedException {
            if (++ticks % DEADLINE_CHECK_INTERVAL != 0) return;
            if (Thread.interrupted()) throw new InterruptedException();
            if (System.nanoTime() - deadline > 0) throw new Deadline();
        }
    }

    /** Thrown inside a search when its wall-clock budget is spent. */
    private static final class Deadline extends RuntimeException {
        Deadline() {
            super("deadline exceeded", null, false, false);
        }
    }
}
