package io.docutoken.compliance.documentation;

import static org.assertj.core.api.Assertions.assertThat;

import io.docutoken.compliance.requirement.MergedRequirements;
import io.docutoken.compliance.requirement.RequirementMerger;
import io.docutoken.compliance.testutil.TestJurisdictions;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentationValidatorTest {

  private static final MergedRequirements REQUIREMENTS =
      new MergedRequirements(
          Set.of("patient_demographics"), Set.of("visit_note"), Set.of(), Set.of("nurse"), Set.of());

  private DocumentationValidator validator;

  @BeforeEach
  void setUp() {
    var signatureValidator = new SignatureValidator();
    validator =
        new DocumentationValidator(
            new RequirementMerger(TestJurisdictions.repository()),
            signatureValidator,
            new ComplianceScorer(signatureValidator));
  }

  @Test
  void compliantRecordIsValidWithFullScore() {
    var now = Instant.now();
    var doc =
        DocumentationRecord.of(
            Map.of(
                "patient_demographics", "present",
                "type", "visit_note",
                "timestamp", now,
                "signature", Map.of("timestamp", now, "signerId", "n1", "data", "sig")));

    var result = validator.validateDocumentation(doc, REQUIREMENTS);

    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings()).isEmpty();
    assertThat(result.complianceScore()).isEqualTo(100);
  }

  @Test
  void incompleteRecordIsInvalidAndScoresBelow40() {
    var doc = DocumentationRecord.of(Map.of("type", "phone_call", "notes", "left voicemail"));

    var result = validator.validateDocumentation(doc, REQUIREMENTS);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).contains("Required field missing: patient demographics");
    assertThat(result.complianceScore()).isLessThan(40);
  }

  @Test
  void unknownDocumentationTypeOnlyWarns() {
    var doc = DocumentationRecord.of(Map.of("patient_demographics", "x", "type", "phone_call"));

    var result = validator.validateDocumentation(doc, REQUIREMENTS);

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings())
        .containsExactly(
            "Documentation type 'phone_call' may not be compliant in all operating states");
  }

  @Test
  void requiredSignatureMustBeValid() {
    var doc =
        DocumentationRecord.of(
            Map.of(
                "patient_demographics", "x",
                "type", "visit_note",
                "requiresSignature", true,
                "signature", Map.of("timestamp", "2026-01-01T10:00:00Z", "signerId", "", "data", "s")));

    var result = validator.validateDocumentation(doc, REQUIREMENTS);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).containsExactly("Invalid or missing required signature");
  }

  @Test
  void missingSignatureIsIgnoredWhenNotRequired() {
    var doc = DocumentationRecord.of(Map.of("patient_demographics", "x", "type", "visit_note"));

    assertThat(validator.validateDocumentation(doc, REQUIREMENTS).valid()).isTrue();
  }

  @Test
  void requiresSignatureAcceptsStringFlag() {
    var doc =
        DocumentationRecord.of(
            Map.of("patient_demographics", "x", "type", "visit_note", "requiresSignature", "TRUE"));

    assertThat(validator.validateDocumentation(doc, REQUIREMENTS).errors())
        .containsExactly("Invalid or missing required signature");
  }

  @Test
  void resolvesJurisdictionCodes() {
    Map<String, Object> doc = Map.of("type", "visit_note", "care_plan", "weekly wound care");

    var result = validator.validateDocumentation(doc, List.of("GA", "FL"));

    assertThat(result.errors())
        .containsExactlyInAnyOrder(
            "Required field missing: patient demographics",
            "Required field missing: physician orders",
            "Required field missing: emergency contacts");
  }

  @Test
  void unresolvableCodesProduceNoFieldErrors() {
    var result =
        validator.validateDocumentation(Map.of("type", "visit_note"), List.of("XX"));

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.complianceScore()).isBetween(0, 100);
  }
}
