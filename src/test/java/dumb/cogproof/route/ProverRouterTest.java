package dumb.cogproof.route;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.analyze.FormulaType;
import dumb.cogproof.bridge.BridgeKind;
import dumb.cogproof.bridge.CecBridge;
import dumb.cogproof.bridge.ModalTableauxBridge;
import dumb.cogproof.bridge.NativeCandidate;
import dumb.cogproof.bridge.SmtBridge;
import dumb.cogproof.bridge.StubTransport;
import dumb.cogproof.cache.ProofCache;
import dumb.cogproof.util.Events;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProverRouterTest extends AbstractProverTest {

    @Test
    void arithmeticGoesToSmt() {
        var stub = StubTransport.replying("unsat");
        try (var router = new ProverRouter(List.of(new NativeCandidate(), new SmtBridge("z3", stub)), new ProofCache())) {
            var r = router.route(parse("x + 1 > x"), List.of());
            assertStatus(ProofStatus.PROVED, r);
            assertEquals("z3", r.method());
            assertEquals(1, r.attempts().size());
            assertTrue(stub.lastRequest().contains("(declare-const x Int)"), stub.lastRequest());
        }
    }

    @Test
    void temporalGoalGoesToTableaux() {
        var candidates = List.of(new NativeCandidate(), new ModalTableauxBridge(), new CecBridge());
        try (var router = new ProverRouter(candidates, new ProofCache())) {
            var r = router.route(parse("Always(Eventually(P(x)))"), List.of());
            assertStatus(ProofStatus.DISPROVED, r);
            assertEquals(ModalTableauxBridge.METHOD, r.method());
            assertEquals(ModalTableauxBridge.METHOD, r.attempts().get(0).method());
        }
    }

    @Test
    void repeatedRequestIsCached() {
        try (var router = new ProverRouter(List.of(new NativeCandidate()), new ProofCache())) {
            var goal = parse("Q(x)");
            var axioms = parseAll("P(x)", "P(x) -> Q(x)");
            var first = router.route(goal, axioms);
            assertStatus(ProofStatus.PROVED, first);
            assertFalse(first.cached());
            assertEquals(1, first.steps().size());
            assertEquals("modus_ponens", lastStep(first).ruleName());

            var second = router.route(goal, parseAll("P(x) -> Q(x)", "P(x)"));
            assertTrue(second.cached());
            assertTrue(second.attempts().isEmpty());
            assertEquals(first.steps(), second.steps());

            var stats = router.stats();
            assertEquals(2, stats.requests());
            assertEquals(1L, stats.wins().get("native"));
            assertEquals(1L, stats.attempts().get("native"));
            assertEquals(1, stats.cache().hits());
        }
    }

    @Test
    void noCapableProver() {
        try (var router = new ProverRouter(List.of(new NativeCandidate()), new ProofCache())) {
            var r = router.route(parse("x + 1 > x"), List.of());
            assertStatus(ProofStatus.ERROR, r);
            assertEquals("no prover applies to " + FormulaType.ARITHMETIC + " problems", r.message());
            assertEquals(ProverRouter.AUTO, r.method());
        }
    }

    @Test
    void forcedMethod() {
        var candidates = List.of(new NativeCandidate(), new CecBridge());
        try (var router = new ProverRouter(candidates, new ProofCache())) {
            var goal = parse("Permitted[alice](pay(alice))");
            var axioms = parseAll("Obligatory[alice](pay(alice))");
            var r = router.route(goal, axioms, RouteConfig.DEFAULT.withMethod(CecBridge.METHOD));
            assertStatus(ProofStatus.PROVED, r);
            assertEquals(CecBridge.METHOD, r.method());
            assertEquals(1, r.attempts().size());

            var missing = router.route(goal, axioms, RouteConfig.DEFAULT.withMethod("z3"));
            assertStatus(ProofStatus.ERROR, missing);
            assertTrue(missing.message().startsWith("prover 'z3' is not registered"), missing.message());
        }
    }

    @Test
    void fallsBackUntilConclusive() {
        var first = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.UNKNOWN);
        var second = FakeCandidate.answering("z3", BridgeKind.SMT, ProofStatus.PROVED);
        var third = FakeCandidate.answering("lean", BridgeKind.INTERACTIVE, ProofStatus.PROVED);
        try (var router = new ProverRouter(List.of(first, second, third), new ProofCache())) {
            var r = router.route(parse("p"), List.of());
            assertStatus(ProofStatus.PROVED, r);
            assertEquals("z3", r.method());
            assertEquals(2, r.attempts().size());
            assertEquals(ProofStatus.UNKNOWN, r.attempts().get(0).status());
            assertEquals(0, third.calls.get());
        }
    }

    @Test
    void inconclusivePrefersTimeout() {
        var unknown = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.UNKNOWN);
        var timeout = FakeCandidate.answering("z3", BridgeKind.SMT, ProofStatus.TIMEOUT);
        var error = FakeCandidate.answering("lean", BridgeKind.INTERACTIVE, ProofStatus.ERROR);
        try (var router = new ProverRouter(List.of(unknown, timeout, error), new ProofCache())) {
            var r = router.route(parse("p"), List.of());
            assertStatus(ProofStatus.TIMEOUT, r);
            assertEquals(3, r.attempts().size());
            assertTrue(r.message().startsWith("no prover was conclusive: native=UNKNOWN (gave up);"), r.message());
            assertTrue(r.message().contains("z3=TIMEOUT"), r.message());
        }
    }

    @Test
    void inconclusiveThenUnknownThenError() {
        var unknown = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.UNKNOWN);
        var error = FakeCandidate.answering("lean", BridgeKind.INTERACTIVE, ProofStatus.ERROR);
        try (var router = new ProverRouter(List.of(unknown, error), new ProofCache())) {
            assertStatus(ProofStatus.UNKNOWN, router.route(parse("p"), List.of()));
        }
        try (var router = new ProverRouter(List.of(error), new ProofCache())) {
            assertStatus(ProofStatus.ERROR, router.route(parse("p"), List.of()));
        }
    }

    @Test
    void timeoutsAreRetried() {
        var slow = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.TIMEOUT);
        try (var router = new ProverRouter(List.of(slow), new ProofCache())) {
            router.route(parse("p"), List.of());
            router.route(parse("p"), List.of());
            assertEquals(2, slow.calls.get());
        }
    }

    @Test
    void crashingProverBecomesAnError() {
        var crashing = new FakeCandidate("native", BridgeKind.NATIVE, m -> {
            throw new IllegalStateException("boom");
        });
        var backup = FakeCandidate.answering("z3", BridgeKind.SMT, ProofStatus.PROVED);
        try (var router = new ProverRouter(List.of(crashing, backup), new ProofCache())) {
            var r = router.route(parse("p"), List.of());
            assertStatus(ProofStatus.PROVED, r);
            assertEquals(ProofStatus.ERROR, r.attempts().get(0).status());
            assertEquals("IllegalStateException: boom", r.attempts().get(0).message());
        }
    }

    @Test
    void unavailableProversAreSkipped() {
        var missing = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.PROVED).unavailable();
        var present = FakeCandidate.answering("z3", BridgeKind.SMT, ProofStatus.DISPROVED);
        try (var router = new ProverRouter(List.of(missing, present), new ProofCache())) {
            assertStatus(ProofStatus.DISPROVED, router.route(parse("p"), List.of()));
            assertEquals(0, missing.calls.get());
        }
    }

    @Test
    void raceKeepsTheFirstConclusiveAnswer() {
        var slow = new FakeCandidate("native", BridgeKind.NATIVE, m -> {
            Thread.sleep(5000);
            return ProofResult.proved(m, 5000, List.of());
        });
        var fast = FakeCandidate.answering("z3", BridgeKind.SMT, ProofStatus.PROVED);
        try (var router = new ProverRouter(List.of(slow, fast), new ProofCache())) {
            var start = System.nanoTime();
            var r = router.route(parse("p"), List.of(), RouteConfig.DEFAULT.racing(2));
            assertStatus(ProofStatus.PROVED, r);
            assertEquals("z3", r.method());
            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(4));
            var loser = r.attempts().stream().filter(a -> a.method().equals("native")).findFirst().orElseThrow();
            assertEquals(ProofStatus.UNKNOWN, loser.status());
            assertEquals("cancelled: z3 answered first", loser.message());
        }
    }

    /** Sleeps through its first call, then proves at once. */
    private static FakeCandidate slowOnce(String method, BridgeKind kind) {
        var first = new AtomicBoolean(true);
        return new FakeCandidate(method, kind, m -> {
            if (first.getAndSet(false)) Thread.sleep(1500);
            return ProofResult.proved(m, 1, List.of());
        });
    }

    @Test
    void raceDeadlineIsNotCached() {
        var a = slowOnce("native", BridgeKind.NATIVE);
        var b = slowOnce("z3", BridgeKind.SMT);
        try (var router = new ProverRouter(List.of(a, b), new ProofCache())) {
            var goal = parse("p");
            var hurried = router.route(goal, List.of(), RouteConfig.DEFAULT.withTimeout(100).racing(2));
            assertStatus(ProofStatus.TIMEOUT, hurried);
            assertEquals(2, hurried.attempts().size());
            assertTrue(hurried.attempts().stream().allMatch(t -> t.status() == ProofStatus.TIMEOUT), hurried::toJson);
            assertEquals(0, router.cache().stats().size());

            var patient = router.route(goal, List.of(), RouteConfig.DEFAULT.withTimeout(10_000).racing(2));
            assertStatus(ProofStatus.PROVED, patient);
            assertFalse(patient.cached());
        }
    }

    @Test
    void moreTimeNeverLosesAnAnswer() throws Exception {
        var slow = slowOnce("native", BridgeKind.NATIVE);
        try (var router = new ProverRouter(List.of(slow), new ProofCache())) {
            var goal = parse("p");
            var pool = Executors.newSingleThreadExecutor();
            try {
                var pending = pool.submit(() -> router.route(goal, List.of(), RouteConfig.DEFAULT.withTimeout(100)));
                Thread.sleep(200);
                pending.cancel(true);
                assertThrows(CancellationException.class, pending::get);
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
            }
            assertEquals(0, router.cache().stats().size());
            assertStatus(ProofStatus.PROVED, router.route(goal, List.of(), RouteConfig.DEFAULT.withTimeout(10_000)));
        }
    }

    @Test
    void publishesEvents() throws Exception {
        var exe = Executors.newCachedThreadPool();
        var events = new Events(exe);
        var completed = new CountDownLatch(1);
        var attempted = new CountDownLatch(1);
        events.on(ProofEvent.RouteCompleted.class, e -> completed.countDown());
        events.on(ProofEvent.AttemptCompleted.class, e -> attempted.countDown());
        try (var router = new ProverRouter(List.of(new NativeCandidate()), new ProofCache(), RoutingPolicy.DEFAULT, events, exe)) {
            router.route(parse("p"), parseAll("p"));
            assertTrue(completed.await(5, TimeUnit.SECONDS));
            assertTrue(attempted.await(5, TimeUnit.SECONDS));
        } finally {
            exe.shutdownNow();
        }
    }

    @Test
    void rejectsDuplicateMethods() {
        var a = FakeCandidate.answering("native", BridgeKind.NATIVE, ProofStatus.PROVED);
        var b = FakeCandidate.answering("native", BridgeKind.SMT, ProofStatus.PROVED);
        assertThrows(IllegalArgumentException.class, () -> new ProverRouter(List.of(a, b), new ProofCache()));
    }
}
