package io.docutoken.compliance.form;

import io.docutoken.compliance.documentation.Timestamps;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates submitted form data against the fields of a generated {@link FormTemplate}.
 *
 * <p>Each field goes through four checks in a fixed order: required, pattern, minimum length,
 * maximum date. A failing check replaces any message already recorded for the field, so the
 * surviving message is the one from the last failing check.
 *
 * <p>The built-in phone and email patterns are precompiled. Other patterns are compiled per call;
 * one that does not compile is skipped and logged rather than failing the submission.
 */
@Component
public class FormDataValidator {

  private static final Logger log = LoggerFactory.getLogger(FormDataValidator.class);

  private static final Map<String, Pattern> KNOWN_PATTERNS =
      Map.of(
          ValidationRuleBuilder.PHONE_PATTERN, ValidationRuleBuilder.PHONE_REGEX,
          ValidationRuleBuilder.EMAIL_PATTERN, ValidationRuleBuilder.EMAIL_REGEX);

  public FormValidationResult validateFormData(Map<String, ?> formData, FormTemplate template) {
    Objects.requireNonNull(template, "template");
    Map<String, ?> data = formData != null ? formData : Map.of();
    var errors = new LinkedHashMap<String, String>();
    var warnings = new ArrayList<String>();

    for (FieldSpec field : template.allFields()) {
      Object value = data.get(field.name());
      var rule = template.validationRules().getOrDefault(field.name(), ValidationRule.none());
      boolean present = value != null && !value.toString().isEmpty();

      if ((field.required() || rule.required())
          && (value == null || value.toString().trim().isEmpty())) {
        errors.put(field.name(), field.label() + " is required");
      }

      if (present
          && rule.pattern() != null
          && compile(rule.pattern())
              .map(pattern -> !pattern.matcher(value.toString()).find())
              .orElse(false)) {
        errors.put(field.name(), field.label() + " format is invalid");
      }

      if (present
          && rule.minLength() != null
          && value instanceof CharSequence text
          && text.length() < rule.minLength()) {
        errors.put(
            field.name(),
            field.label() + " must be at least " + rule.minLength() + " characters");
      }

      if (present
          && rule.maxDate() != null
          && Timestamps.parse(value).map(date -> date.isAfter(rule.maxDate())).orElse(false)) {
        errors.put(field.name(), field.label() + " cannot be in the future");
      }
    }

    log.debug(
        "Validated {} form data: {} field errors",
        template.documentationType(),
        errors.size());
    return new FormValidationResult(errors.isEmpty(), errors, warnings);
  }

  private static Optional<Pattern> compile(String regex) {
    var known = KNOWN_PATTERNS.get(regex);
    if (known != null) {
      return Optional.of(known);
    }
    try {
      return Optional.of(Pattern.compile(regex));
    } catch (PatternSyntaxException e) {
      // an unusable pattern cannot fail a value; the other checks still run
      log.warn("Skipping pattern check, invalid pattern {}: {}", regex, e.getDescription());
      return Optional.empty();
    }
  }
}
