package dumb.cogproof.reason;

import dumb.cogproof.modal.ModalSystem;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Limits of one native proof search.
 *
 * @param maxDepth   forward-chaining iterations
 * @param timeoutMs  wall-clock budget
 * @param maxFacts   derived facts before the search gives up
 * @param categories rule categories that may fire
 */
public record ProverConfig(int maxDepth, long timeoutMs, ModalSystem system, int maxFacts, Set<RuleCategory> categories) {

    public static final ProverConfig DEFAULT = new ProverConfig(10, 5000, ModalSystem.K, 20000, EnumSet.allOf(RuleCategory.class));

    public ProverConfig {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be non-negative");
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive");
        if (maxFacts <= 0) throw new IllegalArgumentException("maxFacts must be positive");
        requireNonNull(system);
        categories = categories.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(categories));
    }

    public ProverConfig withDepth(int maxDepth) {
        return new ProverConfig(maxDepth, timeoutMs, system, maxFacts, categories);
    }

    public ProverConfig withTimeout(long timeoutMs) {
        return new ProverConfig(maxDepth, timeoutMs, system, maxFacts, categories);
    }

    public ProverConfig withSystem(ModalSystem system) {
        return new ProverConfig(maxDepth, timeoutMs, system, maxFacts, categories);
    }

    public ProverConfig withCategories(Set<RuleCategory> categories) {
        return new ProverConfig(maxDepth, timeoutMs, system, maxFacts, categories);
    }
}
