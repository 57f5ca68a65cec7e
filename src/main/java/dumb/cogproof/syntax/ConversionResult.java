package dumb.cogproof.syntax;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.Formula;

import java.util.List;

/**
 * A text rewritten from one syntax into another, with the formula it was read as.
 *
 * @param confidence 1.0 for an exact conversion, reduced for every loss and for natural-language steps
 */
public record ConversionResult(@JsonIgnore Formula formula,
                               @JsonProperty("from") Syntax from,
                               @JsonProperty("to") Syntax to,
                               @JsonProperty("text") String text,
                               @JsonProperty("warnings") List<String> warnings,
                               @JsonProperty("confidence") double confidence) {

    public ConversionResult {
        warnings = List.copyOf(warnings);
    }

    public boolean lossless() {
        return warnings.isEmpty();
    }
}
