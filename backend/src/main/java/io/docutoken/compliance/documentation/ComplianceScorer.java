package io.docutoken.compliance.documentation;

import io.docutoken.compliance.requirement.MergedRequirements;
import org.springframework.stereotype.Component;

/**
 * Computes the 0-100 compliance score of a documentation record. Five independent terms:
 *
 * <ul>
 *   <li>required-field coverage, 40
 *   <li>documentation type allowed in the operating jurisdictions, 20
 *   <li>valid signature, 20
 *   <li>valid timestamp, 10
 *   <li>share of the record's own fields that hold a value, 10
 * </ul>
 *
 * The sum is rounded half up. The result depends only on the two arguments.
 */
@Component
public class ComplianceScorer {

  static final double REQUIRED_FIELDS_WEIGHT = 40;
  static final double DOCUMENTATION_TYPE_WEIGHT = 20;
  static final double SIGNATURE_WEIGHT = 20;
  static final double TIMESTAMP_WEIGHT = 10;
  static final double COMPLETENESS_WEIGHT = 10;

  private final SignatureValidator signatureValidator;

  public ComplianceScorer(SignatureValidator signatureValidator) {
    this.signatureValidator = signatureValidator;
  }

  public int calculateComplianceScore(
      DocumentationRecord documentation, MergedRequirements requirements) {
    double score = 0;

    var requiredFields = requirements.allRequiredFields();
    if (!requiredFields.isEmpty()) {
      long filled = requiredFields.stream().filter(documentation::isFilled).count();
      score += ((double) filled / requiredFields.size()) * REQUIRED_FIELDS_WEIGHT;
    }

    if (requirements.allDocumentationTypes().contains(documentation.type())) {
      score += DOCUMENTATION_TYPE_WEIGHT;
    }

    boolean signed =
        documentation
            .signature()
            .map(
                signature ->
                    signatureValidator.validateSignature(
                        signature, requirements.allSignatureRequirements()))
            .orElse(false);
    if (signed) {
      score += SIGNATURE_WEIGHT;
    }

    if (Timestamps.isAfterEpoch(documentation.timestamp())) {
      score += TIMESTAMP_WEIGHT;
    }

    score += calculateCompleteness(documentation) * COMPLETENESS_WEIGHT;

    return (int) Math.round(score);
  }

  /**
   * Fraction of the record's keys whose value is neither null nor the empty string. Whitespace-only
   * strings count as filled here. A record with no keys has completeness 0.
   */
  public double calculateCompleteness(DocumentationRecord documentation) {
    var fieldNames = documentation.fieldNames();
    if (fieldNames.isEmpty()) {
      return 0;
    }
    long filled =
        fieldNames.stream()
            .map(documentation::get)
            .filter(value -> value != null && !"".equals(value))
            .count();
    return (double) filled / fieldNames.size();
  }
}
