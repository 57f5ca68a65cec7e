package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.modal.ModalSystem;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/** A rule given entirely by premise patterns and a conclusion pattern. */
public final class PatternRule implements InferenceRule {

    private final String name;
    private final RuleCategory category;
    private final List<Formula> premises;
    private final Formula conclusion;
    private final boolean goalDirected;
    private final Set<ModalSystem> systems;
    private final @Nullable Predicate<Bindings> condition;

    public PatternRule(String name, RuleCategory category, List<Formula> premises, Formula conclusion,
                       boolean goalDirected, Set<ModalSystem> systems, @Nullable Predicate<Bindings> condition) {
        this.name = requireNonNull(name);
        this.category = requireNonNull(category);
        this.premises = List.copyOf(premises);
        this.conclusion = requireNonNull(conclusion);
        this.goalDirected = goalDirected;
        this.systems = systems.isEmpty() ? EnumSet.allOf(ModalSystem.class) : EnumSet.copyOf(systems);
        this.condition = condition;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RuleCategory category() {
        return category;
    }

    @Override
    public List<Formula> premises() {
        return premises;
    }

    public Formula conclusion() {
        return conclusion;
    }

    @Override
    public boolean goalDirected() {
        return goalDirected;
    }

    @Override
    public boolean enabled(ModalSystem system) {
        return systems.contains(system);
    }

    @Override
    public List<Bindings> seeds(List<Formula> targets) {
        var out = new ArrayList<Bindings>();
        for (var t : targets) {
            var b = Unifier.match(conclusion, t, Bindings.EMPTY);
            if (b != null && !out.contains(b)) out.add(b);
        }
        return out;
    }

    @Override
    public List<Formula> conclude(Bindings bindings, List<Formula> matched, RuleContext ctx) {
        if (condition != null && !condition.test(bindings)) return List.of();
        var c = Unifier.subst(conclusion, bindings);
        return c == null ? List.of() : List.of(c);
    }

    @Override
    public String toString() {
        return name + ": " + String.join(", ", premises.stream().map(Formula::text).toList()) + " |- " + conclusion.text();
    }
}
