package dumb.cogproof;

import dumb.cogproof.bridge.CecBridge;
import dumb.cogproof.bridge.ChatModelTransport;
import dumb.cogproof.bridge.InteractiveBridge;
import dumb.cogproof.bridge.ModalTableauxBridge;
import dumb.cogproof.bridge.NativeCandidate;
import dumb.cogproof.bridge.NeuralBridge;
import dumb.cogproof.bridge.ProverCandidate;
import dumb.cogproof.bridge.SmtBridge;
import dumb.cogproof.bridge.TableauxTransport;
import dumb.cogproof.cache.JsonFileProofStore;
import dumb.cogproof.cache.ProofCache;
import dumb.cogproof.route.ProverRouter;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.route.RoutingPolicy;
import dumb.cogproof.syntax.Syntax;
import dumb.cogproof.syntax.Translator;
import dumb.cogproof.util.Events;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static dumb.cogproof.util.Log.error;
import static dumb.cogproof.util.Log.message;

/**
 * Entry point: parses requests, routes them to the registered provers and caches the answers.
 * Close it to stop its worker threads.
 */
public class CogProof implements AutoCloseable {

    private static final int EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 2;

    public final Config config;
    public final Events events;
    public final Translator translator = new Translator();
    public final ProverRouter router;

    private final ExecutorService eventExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService proverExecutor = Executors.newCachedThreadPool();

    public CogProof() {
        this(new Config());
    }

    public CogProof(Config config) {
        this.config = config;
        this.events = new Events(eventExecutor);
        var cache = new ProofCache(config.cacheCapacity(),
                config.cachePath() == null ? null : new JsonFileProofStore(Path.of(config.cachePath())));
        var candidates = candidates(config, proverExecutor);
        this.router = new ProverRouter(candidates, cache, RoutingPolicy.DEFAULT, events, proverExecutor);
        message("CogProof ready with provers " + candidates);
    }

    /** Candidates for a configuration: the in-process provers always, external ones when configured. */
    static List<ProverCandidate> candidates(Config c, ExecutorService exe) {
        var out = new ArrayList<ProverCandidate>();
        out.add(new NativeCandidate());
        out.add(new ModalTableauxBridge(new TableauxTransport(c.maxWorlds())));
        out.add(new CecBridge());
        if (c.z3() != null) out.add(SmtBridge.z3(c.z3()));
        if (c.cvc5() != null) out.add(SmtBridge.cvc5(c.cvc5()));
        if (c.lean() != null) out.add(InteractiveBridge.lean(c.lean()));
        if (c.coq() != null) out.add(InteractiveBridge.coq(c.coq()));
        if (c.neural()) out.add(new NeuralBridge("neural", ChatModelTransport.ollama(c.llmApiUrl(), c.llmModel(), exe)));
        return out;
    }

    public RouteConfig defaults() {
        return config.route();
    }

    /** Parses the goal and axioms as native text; nothing runs unless all of them parse. */
    public ProofResult prove(String goal, List<String> axioms) throws ValidationException {
        return prove(goal, axioms, defaults());
    }

    public ProofResult prove(String goal, List<String> axioms, RouteConfig cfg) throws ValidationException {
        return prove(goal, axioms, Syntax.TDFOL, cfg);
    }

    public ProofResult prove(String goal, List<String> axioms, Syntax syntax, RouteConfig cfg) throws ValidationException {
        var g = translator.parse(goal, syntax);
        var as = new ArrayList<Formula>(axioms.size());
        for (var a : axioms) as.add(translator.parse(a, syntax));
        return prove(g, as, cfg);
    }

    public ProofResult prove(Formula goal, List<Formula> axioms, RouteConfig cfg) {
        return router.route(goal, axioms, cfg);
    }

    public ProofResult prove(Formula goal, KnowledgeBase kb, RouteConfig cfg) {
        return router.route(goal, kb.facts().toList(), cfg);
    }

    @Override
    public void close() {
        router.close();
        shutdownExecutor(proverExecutor, "Prover executor");
        shutdownExecutor(eventExecutor, "Event executor");
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor.isShutdown()) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                error(name + " did not terminate gracefully, forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            error("Interrupted while waiting for " + name + " shutdown.");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
