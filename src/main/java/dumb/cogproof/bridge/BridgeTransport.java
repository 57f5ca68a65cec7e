package dumb.cogproof.bridge;

/**
 * Carries a request in a back end's native syntax to the back end and returns its raw answer. Blocking;
 * an interrupt abandons the request and releases whatever it started.
 */
public interface BridgeTransport {

    String name();

    RawOutput invoke(String request, long timeoutMs) throws BridgeException, InterruptedException;

    /** Whether the back end can be reached at all, e.g. its executable is installed. */
    default boolean available() {
        return true;
    }
}
