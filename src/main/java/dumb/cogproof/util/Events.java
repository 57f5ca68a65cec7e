package dumb.cogproof.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/** Asynchronous publish/subscribe bus keyed by event class. */
public class Events {

    public final ExecutorService exe;
    private final ConcurrentMap<Class<?>, CopyOnWriteArrayList<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<Object> listener, Object event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            Log.error("Error processing event listener for " + event.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public <T> void on(Class<T> eventType, Consumer<? super T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(Object event) {
        requireNonNull(event);
        if (exe.isShutdown()) return;
        exe.submit(() -> listeners.forEach((type, ls) -> {
            if (type.isInstance(event)) ls.forEach(l -> exeSafe(l, event));
        }));
    }

    public void shutdown() {
        exe.shutdown();
    }
}
