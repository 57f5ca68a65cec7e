package dumb.cogproof.analyze;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Feature vector of a formula or problem.
 *
 * @param quantifierDepth deepest nesting of quantifiers
 * @param astDepth        deepest nesting of formula nodes
 * @param modalDepth      deepest nesting of modal, temporal, deontic and cognitive operators
 * @param operators       occurrences per operator kind, e.g. {@code and}, {@code forall}, {@code always}
 * @param complexity      weighted score in [0, 100]
 */
public record Analysis(int quantifierDepth, int astDepth, int modalDepth, Map<String, Integer> operators,
                       boolean hasModal, boolean hasTemporal, boolean hasDeontic, boolean hasCognitive,
                       boolean hasArithmetic, boolean hasQuantifiers, boolean hasFunctions, boolean hasFreeVars,
                       int complexity, FormulaType type) {

    public Analysis {
        operators = Map.copyOf(operators);
    }

    public int count(String operator) {
        return operators.getOrDefault(operator, 0);
    }

    /** Number of modal operator families present: alethic, temporal, deontic, cognitive. */
    public int modalFamilies() {
        return (hasModal ? 1 : 0) + (hasTemporal ? 1 : 0) + (hasDeontic ? 1 : 0) + (hasCognitive ? 1 : 0);
    }

    public int modalOperators() {
        return operators.entrySet().stream().filter(e -> FormulaAnalyzer.MODAL_KINDS.contains(e.getKey())).mapToInt(Map.Entry::getValue).sum();
    }

    /** Free variables alone are schematic and need no first-order prover. */
    public Set<Capability> requiredCapabilities() {
        var c = EnumSet.of(Capability.PROPOSITIONAL);
        if (hasQuantifiers || hasFunctions) c.add(Capability.FOL);
        if (hasArithmetic) c.add(Capability.ARITHMETIC);
        if (modalFamilies() > 0) c.add(Capability.MODAL);
        return c;
    }
}
