package io.docutoken.compliance.form;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating submitted form data.
 *
 * @param valid true when no field has an error
 * @param errors at most one message per field name, in field order
 */
public record FormValidationResult(
    @JsonProperty("isValid") boolean valid, Map<String, String> errors, List<String> warnings) {

  public FormValidationResult {
    errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    warnings = List.copyOf(warnings);
  }
}
