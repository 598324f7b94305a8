package io.docutoken.compliance.form;

import io.docutoken.compliance.requirement.MergedRequirements;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives validation rules from merged requirements. Every required category gets a required rule;
 * the phone, email and date-of-birth overlays are always added, whether or not those names are
 * required.
 */
@Component
public class ValidationRuleBuilder {

  public static final String PHONE = "phone";
  public static final String EMAIL = "email";
  public static final String DATE_OF_BIRTH = "dateOfBirth";

  /** US phone number, e.g. (404) 555-0134. {@code \z} so a trailing line break is rejected. */
  public static final String PHONE_PATTERN = "^\\(\\d{3}\\) \\d{3}-\\d{4}\\z";

  /** Single-{@code @} address; whitespace includes Unicode spaces such as U+00A0. */
  public static final String EMAIL_PATTERN = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+\\z";

  static final Pattern PHONE_REGEX = Pattern.compile(PHONE_PATTERN);
  static final Pattern EMAIL_REGEX =
      Pattern.compile(EMAIL_PATTERN, Pattern.UNICODE_CHARACTER_CLASS);

  public Map<String, ValidationRule> getValidationRules(MergedRequirements requirements) {
    var rules = new LinkedHashMap<String, ValidationRule>();

    for (String field : requirements.allRequiredFields()) {
      // case-sensitive: "physicianName" does not contain "name"
      rules.put(field, ValidationRule.requiredWithMinLength(field.contains("name") ? 2 : 1));
    }

    rules.put(PHONE, rules.getOrDefault(PHONE, ValidationRule.none()).withPattern(PHONE_PATTERN));
    rules.put(EMAIL, rules.getOrDefault(EMAIL, ValidationRule.none()).withPattern(EMAIL_PATTERN));
    rules.put(
        DATE_OF_BIRTH,
        rules.getOrDefault(DATE_OF_BIRTH, ValidationRule.none()).withMaxDate(Instant.now()));

    return Collections.unmodifiableMap(rules);
  }
}
