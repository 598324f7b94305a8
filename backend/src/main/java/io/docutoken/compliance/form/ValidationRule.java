package io.docutoken.compliance.form;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Field-level validation constraints. Absent constraints are null and skipped by {@link
 * FormDataValidator}.
 *
 * @param required whether an empty value is an error
 * @param minLength minimum character length of a present value
 * @param pattern regular expression a present value must contain a match for
 * @param maxDate latest instant a present date value may denote
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationRule(boolean required, Integer minLength, String pattern, Instant maxDate) {

  private static final ValidationRule NONE = new ValidationRule(false, null, null, null);

  public static ValidationRule none() {
    return NONE;
  }

  public static ValidationRule requiredWithMinLength(int minLength) {
    return new ValidationRule(true, minLength, null, null);
  }

  public ValidationRule withPattern(String pattern) {
    return new ValidationRule(required, minLength, pattern, maxDate);
  }

  public ValidationRule withMaxDate(Instant maxDate) {
    return new ValidationRule(required, minLength, pattern, maxDate);
  }
}
