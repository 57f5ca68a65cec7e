package dumb.cogproof.bridge;

/** A back end could not be run or its answer could not be read: missing tool, crash, garbled output, or timeout. */
public class BridgeException extends Exception {

    private final boolean timeout;

    public BridgeException(String message) {
        this(message, null, false);
    }

    public BridgeException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private BridgeException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static BridgeException timeout(long timeoutMs) {
        return new BridgeException("no answer within " + timeoutMs + "ms", null, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
