package dumb.cogproof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One rule application; formulas are rendered in native TDFOL text. */
public record ProofStep(@JsonProperty("rule_name") String ruleName,
                        @JsonProperty("premises") List<String> premises,
                        @JsonProperty("conclusion") String conclusion) {

    public ProofStep {
        premises = List.copyOf(premises);
    }

    public static ProofStep of(String ruleName, List<Formula> premises, Formula conclusion) {
        return new ProofStep(ruleName, premises.stream().map(Formula::text).toList(), conclusion.text());
    }
}
