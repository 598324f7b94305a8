package io.docutoken.compliance.documentation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of validating a documentation record against merged jurisdiction requirements.
 *
 * @param valid true when {@code errors} is empty; warnings never affect validity
 * @param errors ordered problems that make the record non-compliant
 * @param warnings ordered advisories
 * @param complianceScore weighted score in [0, 100]
 */
public record ValidationResult(
    @JsonProperty("isValid") boolean valid,
    List<String> errors,
    List<String> warnings,
    int complianceScore) {

  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }
}
