package io.docutoken.compliance.form;

import static org.assertj.core.api.Assertions.assertThat;

import io.docutoken.compliance.requirement.MergedRequirements;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ValidationRuleBuilderTest {

  private final ValidationRuleBuilder builder = new ValidationRuleBuilder();

  private static MergedRequirements requiring(String... fields) {
    return new MergedRequirements(Set.of(fields), Set.of(), Set.of(), Set.of(), Set.of());
  }

  @Test
  void everyRequiredCategoryGetsARequiredRule() {
    var rules = builder.getValidationRules(requiring("care_plan", "physician_name"));

    assertThat(rules.get("care_plan")).isEqualTo(new ValidationRule(true, 1, null, null));
    assertThat(rules.get("physician_name")).isEqualTo(new ValidationRule(true, 2, null, null));
  }

  @Test
  void nameMatchIsCaseSensitive() {
    var rules = builder.getValidationRules(requiring("physicianName"));

    assertThat(rules.get("physicianName").minLength()).isEqualTo(1);
  }

  @Test
  void fixedOverlaysAreAlwaysPresent() {
    var before = Instant.now();
    var rules = builder.getValidationRules(MergedRequirements.empty());

    assertThat(rules).containsOnlyKeys("phone", "email", "dateOfBirth");
    assertThat(rules.get("phone"))
        .isEqualTo(new ValidationRule(false, null, ValidationRuleBuilder.PHONE_PATTERN, null));
    assertThat(rules.get("email").pattern()).isEqualTo(ValidationRuleBuilder.EMAIL_PATTERN);
    assertThat(rules.get("email").required()).isFalse();
    assertThat(rules.get("dateOfBirth").maxDate()).isBetween(before, Instant.now());
  }

  @Test
  void overlayKeepsRequiredRuleOfSameName() {
    var rules = builder.getValidationRules(requiring("phone"));

    assertThat(rules.get("phone"))
        .isEqualTo(new ValidationRule(true, 1, ValidationRuleBuilder.PHONE_PATTERN, null));
  }
}
