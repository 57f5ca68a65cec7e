package dumb.cogproof.bridge;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.util.Objects.requireNonNull;

/** Sends the request as one user message to a chat model and returns the reply as standard output. */
public class ChatModelTransport implements BridgeTransport {

    static final int HTTP_TIMEOUT_SECONDS = 90;

    private final String name;
    private final ChatLanguageModel model;
    private final ExecutorService exe;

    public ChatModelTransport(String name, ChatLanguageModel model, ExecutorService exe) {
        this.name = requireNonNull(name);
        this.model = requireNonNull(model);
        this.exe = requireNonNull(exe);
    }

    /** A transport to an Ollama server; {@code baseUrl} may carry a trailing {@code /api} or {@code /api/chat}. */
    public static ChatModelTransport ollama(String baseUrl, String modelName, ExecutorService exe) {
        if (baseUrl.endsWith("/api/chat")) baseUrl = baseUrl.substring(0, baseUrl.length() - "/api/chat".length());
        else if (baseUrl.endsWith("/api")) baseUrl = baseUrl.substring(0, baseUrl.length() - "/api".length());
        var model = OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(0.0)
                .timeout(Duration.ofSeconds(HTTP_TIMEOUT_SECONDS))
                .build();
        return new ChatModelTransport("ollama:" + modelName, model, exe);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RawOutput invoke(String request, long timeoutMs) throws BridgeException, InterruptedException {
        var reply = CompletableFuture.supplyAsync(() -> model.generate(request), exe);
        try {
            return RawOutput.ok(reply.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            reply.cancel(true);
            throw BridgeException.timeout(timeoutMs);
        } catch (InterruptedException e) {
            reply.cancel(true);
            throw e;
        } catch (ExecutionException | CancellationException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            throw new BridgeException("chat model " + name + " failed: " + cause.getMessage(), cause);
        }
    }
}
