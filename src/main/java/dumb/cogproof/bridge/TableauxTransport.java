package dumb.cogproof.bridge;

import dumb.cogproof.Formula;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.modal.Tableaux;
import dumb.cogproof.syntax.ModalSyntax;

import java.util.ArrayList;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** Runs {@link Tableaux} in process on a {@link ModalTableauxBridge} request. */
public class TableauxTransport implements BridgeTransport {

    private final int maxWorlds;
    private final ModalSyntax syntax = new ModalSyntax();

    public TableauxTransport() {
        this(Tableaux.DEFAULT_MAX_WORLDS);
    }

    public TableauxTransport(int maxWorlds) {
        if (maxWorlds <= 0) throw new IllegalArgumentException("maxWorlds must be positive");
        this.maxWorlds = maxWorlds;
    }

    @Override
    public String name() {
        return "tableaux";
    }

    @Override
    public RawOutput invoke(String request, long timeoutMs) throws BridgeException, InterruptedException {
        var system = ModalSystem.K;
        var axioms = new ArrayList<Formula>();
        Formula goal = null;
        try {
            for (var line : request.lines().map(String::strip).filter(l -> !l.isEmpty()).toList()) {
                var colon = line.indexOf(':');
                if (colon < 0) throw new BridgeException("malformed request line: " + line);
                var key = line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
                var value = line.substring(colon + 1).strip();
                switch (key) {
                    case "system" -> system = ModalSystem.valueOf(value.toUpperCase(Locale.ROOT));
                    case "axiom" -> axioms.add(syntax.parse(value));
                    case "goal" -> goal = syntax.parse(value);
                    default -> throw new BridgeException("unknown request key: " + key);
                }
            }
        } catch (ValidationException e) {
            throw new BridgeException("unreadable formula: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new BridgeException("unknown modal system: " + e.getMessage(), e);
        }
        if (goal == null) throw new BridgeException("request has no goal");

        try {
            var o = new Tableaux(system, maxWorlds, timeoutMs).check(goal, axioms);
            return RawOutput.ok(switch (o.verdict()) {
                case VALID -> "valid";
                case INVALID -> "invalid\n" + o.countermodel();
                case UNKNOWN -> "unknown " + o.reason();
            });
        } catch (TimeoutException e) {
            throw BridgeException.timeout(timeoutMs);
        } catch (TranslationException e) {
            throw new BridgeException("no modal reading: " + e.getMessage(), e);
        }
    }
}
