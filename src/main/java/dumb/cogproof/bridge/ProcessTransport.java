package dumb.cogproof.bridge;

import java.io.File;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static dumb.cogproof.util.Log.warning;

/**
 * Runs an external prover as a subprocess, passing the request on standard input or as a temporary
 * file named last on the command line. The process is killed on timeout and on interrupt.
 */
public class ProcessTransport implements BridgeTransport {

    public enum Input {
        STDIN, FILE
    }

    private final List<String> command;
    private final Input input;
    private final String suffix;

    public ProcessTransport(List<String> command, Input input, String suffix) {
        if (command.isEmpty()) throw new IllegalArgumentException("empty command");
        this.command = List.copyOf(command);
        this.input = input;
        this.suffix = suffix;
    }

    public static ProcessTransport stdin(String... command) {
        return new ProcessTransport(List.of(command), Input.STDIN, "");
    }

    public static ProcessTransport file(String suffix, String... command) {
        return new ProcessTransport(List.of(command), Input.FILE, suffix);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public String name() {
        return String.join(" ", command);
    }

    @Override
    public boolean available() {
        return executable(command.get(0));
    }

    /** Whether {@code program} is an executable path or names one on the PATH. */
    static boolean executable(String program) {
        if (program.indexOf(File.separatorChar) >= 0) return Files.isExecutable(Path.of(program));
        var path = System.getenv("PATH");
        if (path == null) return false;
        for (var dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, program))) return true;
        }
        return false;
    }

    @Override
    public RawOutput invoke(String request, long timeoutMs) throws BridgeException, InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Path in = null, out = null, err = null;
        Process p = null;
        try {
            in = Files.createTempFile("cogproof", input == Input.FILE ? suffix : ".in");
            out = Files.createTempFile("cogproof", ".out");
            err = Files.createTempFile("cogproof", ".err");
            Files.writeString(in, request, StandardCharsets.UTF_8);
            var cmd = new ArrayList<>(command);
            if (input == Input.FILE) cmd.add(in.toString());
            var pb = new ProcessBuilder(cmd).redirectOutput(out.toFile()).redirectError(err.toFile());
            // stdin is the request file, never a pipe
            if (input == Input.STDIN) pb.redirectInput(in.toFile());
            try {
                p = pb.start();
            } catch (IOException e) {
                throw new BridgeException("cannot start " + command.get(0) + ": " + e.getMessage(), e);
            }
            if (input == Input.FILE) p.getOutputStream().close();
            if (!p.waitFor(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                p.destroyForcibly();
                throw BridgeException.timeout(timeoutMs);
            }
            return new RawOutput(p.exitValue(), Files.readString(out, StandardCharsets.UTF_8), Files.readString(err, StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            if (p != null) p.destroyForcibly();
            throw e;
        } catch (ClosedByInterruptException e) {
            if (p != null) p.destroyForcibly();
            throw new InterruptedException("interrupted while writing the request for " + command.get(0));
        } catch (IOException e) {
            if (p != null) p.destroyForcibly();
            throw new BridgeException("I/O with " + command.get(0) + " failed: " + e.getMessage(), e);
        } finally {
            delete(in);
            delete(out);
            delete(err);
        }
    }

    private static void delete(Path f) {
        if (f == null) return;
        try {
            Files.deleteIfExists(f);
        } catch (IOException e) {
            warning("Could not delete temporary file " + f + ": " + e.getMessage());
        }
    }
}
