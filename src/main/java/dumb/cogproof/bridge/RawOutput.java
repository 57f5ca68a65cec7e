package dumb.cogproof.bridge;

import static java.util.Objects.requireNonNull;

/** What a transport got back: exit code (0 for in-process transports), standard output and error. */
public record RawOutput(int exitCode, String stdout, String stderr) {

    public RawOutput {
        requireNonNull(stdout);
        requireNonNull(stderr);
    }

    public static RawOutput ok(String stdout) {
        return new RawOutput(0, stdout, "");
    }

    /** Standard output and error together, for matching prover messages wherever they are printed. */
    public String combined() {
        return stderr.isEmpty() ? stdout : stdout + "\n" + stderr;
    }
}
