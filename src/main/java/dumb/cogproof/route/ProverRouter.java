package dumb.cogproof.route;

import dumb.cogproof.Attempt;
import dumb.cogproof.Formula;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.analyze.FormulaAnalyzer;
import dumb.cogproof.bridge.ProverCandidate;
import dumb.cogproof.cache.CacheKey;
import dumb.cogproof.cache.ProofCache;
import dumb.cogproof.util.Events;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static dumb.cogproof.util.Log.debug;
import static dumb.cogproof.util.Log.message;
import static dumb.cogproof.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Chooses provers for a problem and runs them until one gives a conclusive answer. Results go
 * through a {@link ProofCache}, so a repeated problem is answered without running anything and
 * concurrent identical requests share one computation.
 * <p>
 * Candidates are tried best first. With racing on, the best {@code raceWidth} run at once: the first
 * conclusive answer wins and the rest are cancelled. Every prover that ran is listed in the result's
 * attempts. When none is conclusive the result is TIMEOUT if any attempt ran out of time, otherwise
 * UNKNOWN if any attempt ended inconclusively, otherwise ERROR.
 */
public class ProverRouter implements AutoCloseable {

    public static final String AUTO = "auto";

    /** Slack past the attempt budget before a racing prover is given up on. */
    static final long RACE_GRACE_MS = 250;

    private final List<ProverCandidate> candidates;
    private final ProofCache cache;
    private final RoutingPolicy policy;
    private final @Nullable Events events;
    private final ExecutorService exe;
    private final boolean ownsExecutor;

    private final AtomicLong requests = new AtomicLong();
    private final Map<String, AtomicLong> attempts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> wins = new ConcurrentHashMap<>();

    public ProverRouter(List<? extends ProverCandidate> candidates, ProofCache cache) {
        this(candidates, cache, RoutingPolicy.DEFAULT, null, Executors.newCachedThreadPool(), true);
    }

    public ProverRouter(List<? extends ProverCandidate> candidates, ProofCache cache, RoutingPolicy policy,
                        @Nullable Events events, ExecutorService exe) {
        this(candidates, cache, policy, events, exe, false);
    }

    private ProverRouter(List<? extends ProverCandidate> candidates, ProofCache cache, RoutingPolicy policy,
                         @Nullable Events events, ExecutorService exe, boolean ownsExecutor) {
        this.candidates = List.copyOf(candidates);
        this.cache = requireNonNull(cache);
        this.policy = requireNonNull(policy);
        this.events = events;
        this.exe = requireNonNull(exe);
        this.ownsExecutor = ownsExecutor;
        var names = new HashSet<String>();
        for (var c : this.candidates)
            if (!names.add(c.method())) throw new IllegalArgumentException("duplicate prover method: " + c.method());
    }

    public List<ProverCandidate> candidates() {
        return candidates;
    }

    public ProofCache cache() {
        return cache;
    }

    public ProofResult route(Formula goal, List<Formula> axioms) {
        return route(goal, axioms, RouteConfig.DEFAULT);
    }

    public ProofResult route(Formula goal, List<Formula> axioms, RouteConfig cfg) {
        requireNonNull(goal);
        requireNonNull(cfg);
        axioms = List.copyOf(axioms);
        requests.incrementAndGet();
        var key = CacheKey.of(goal, axioms, cfg.method() == null ? AUTO : cfg.method(), cfg.fingerprint());
        var finalAxioms = axioms;
        var r = cache.getOrCompute(key, () -> compute(key, goal, finalAxioms, cfg));
        if (r.cached()) emit(new ProofEvent.CacheHit(key, r));
        else emit(new ProofEvent.RouteCompleted(key, r));
        return r;
    }

    private ProofResult compute(CacheKey key, Formula goal, List<Formula> axioms, RouteConfig cfg) {
        var start = System.nanoTime();
        var analysis = FormulaAnalyzer.analyze(goal, axioms);
        var ranked = new ArrayList<ProverCandidate>();
        for (var c : policy.rank(analysis, candidates))
            if ((cfg.method() == null || cfg.method().equals(c.method())) && c.available()) ranked.add(c);
        debug("Routing " + key + " (" + analysis.type() + ", complexity " + analysis.complexity() + ") to " + ranked);

        if (ranked.isEmpty()) {
            var why = cfg.method() == null ? "no prover applies to " + analysis.type() + " problems"
                    : "prover '" + cfg.method() + "' is not registered, not available or not able to handle this problem";
            return ProofResult.error(cfg.method() == null ? AUTO : cfg.method(), elapsedMs(start), why);
        }

        var tried = new ArrayList<Attempt>();
        ProofResult winner = null;
        var next = 0;
        if (cfg.race() && ranked.size() > 1) {
            var width = Math.min(cfg.raceWidth(), ranked.size());
            winner = race(key, ranked.subList(0, width), goal, axioms, cfg, tried);
            next = width;
        }
        for (; winner == null && next < ranked.size(); next++) {
            if (Thread.currentThread().isInterrupted()) break;
            var r = attempt(ranked.get(next), goal, axioms, cfg);
            record(key, r, tried);
            if (r.status().conclusive()) winner = r;
        }

        var elapsed = elapsedMs(start);
        if (winner != null) {
            wins.computeIfAbsent(winner.method(), k -> new AtomicLong()).incrementAndGet();
            message("Proof " + key + ": " + winner.status() + " by " + winner.method() + " in " + elapsed + "ms");
            return winner.withAttempts(tried).withElapsed(elapsed);
        }
        return inconclusive(tried, elapsed);
    }

    private @Nullable ProofResult race(CacheKey key, List<ProverCandidate> runners, Formula goal, List<Formula> axioms,
                                       RouteConfig cfg, List<Attempt> tried) {
        var ecs = new ExecutorCompletionService<ProofResult>(exe);
        var futures = new ArrayList<Future<ProofResult>>();
        for (var c : runners) futures.add(ecs.submit(() -> attempt(c, goal, axioms, cfg)));
        var finished = new HashSet<String>();
        var raceStart = System.nanoTime();
        ProofResult winner = null;
        var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(cfg.timeoutMs() + RACE_GRACE_MS);
        try {
            for (var pending = runners.size(); pending > 0 && winner == null; pending--) {
                var f = ecs.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (f == null) break;
                var r = f.get();
                finished.add(r.method());
                record(key, r, tried);
                if (r.status().conclusive()) winner = r;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // attempt() turns failures into results, so only an Error can get here
            throw new IllegalStateException("prover crashed", e.getCause());
        } finally {
            for (var f : futures) f.cancel(true);
        }
        for (var c : runners) {
            if (finished.contains(c.method())) continue;
            if (winner != null)
                record(key, ProofResult.unknown(c.method(), 0, "cancelled: " + winner.method() + " answered first"), tried);
            else
                record(key, ProofResult.cancelled(c.method(), elapsedMs(raceStart), "no answer within " + cfg.timeoutMs() + "ms"), tried);
        }
        return winner;
    }

    private ProofResult attempt(ProverCandidate c, Formula goal, List<Formula> axioms, RouteConfig cfg) {
        var start = System.nanoTime();
        try {
            var r = c.attempt(goal, axioms, cfg);
            return r.method().equals(c.method()) ? r : r.withMethod(c.method());
        } catch (RuntimeException e) {
            warning("Prover " + c.method() + " threw " + e);
            return ProofResult.error(c.method(), elapsedMs(start), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void record(CacheKey key, ProofResult r, List<Attempt> tried) {
        var a = Attempt.of(r);
        tried.add(a);
        attempts.computeIfAbsent(a.method(), k -> new AtomicLong()).incrementAndGet();
        emit(new ProofEvent.AttemptCompleted(key, a));
    }

    private static ProofResult inconclusive(List<Attempt> tried, long elapsed) {
        var status = tried.stream().anyMatch(a -> a.status() == ProofStatus.TIMEOUT) ? ProofStatus.TIMEOUT
                : tried.stream().anyMatch(a -> a.status() == ProofStatus.UNKNOWN) ? ProofStatus.UNKNOWN
                : ProofStatus.ERROR;
        var sb = new StringBuilder("no prover was conclusive:");
        for (var a : tried) {
            sb.append(' ').append(a.method()).append('=').append(a.status());
            if (a.message() != null) sb.append(" (").append(a.message()).append(')');
            sb.append(';');
        }
        sb.setLength(sb.length() - 1);
        var method = tried.isEmpty() ? AUTO : tried.get(tried.size() - 1).method();
        return new ProofResult(status, method, elapsed, List.of(), tried, sb.toString(), null, false);
    }

    private void emit(ProofEvent e) {
        if (events != null) events.emit(e);
    }

    public RouterStats stats() {
        return new RouterStats(requests.get(), snapshot(attempts), snapshot(wins), cache.stats());
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> m) {
        var out = new TreeMap<String, Long>();
        m.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public void close() {
        if (ownsExecutor) exe.shutdownNow();
    }
}
