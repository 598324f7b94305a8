package io.docutoken.compliance.documentation;

import io.docutoken.compliance.requirement.MergedRequirements;
import io.docutoken.compliance.requirement.RequirementMerger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates documentation records against the merged requirements of the jurisdictions an agency
 * operates in. Problems are reported in the result, never thrown.
 */
@Service
public class DocumentationValidator {

  private static final Logger log = LoggerFactory.getLogger(DocumentationValidator.class);

  private final RequirementMerger requirementMerger;
  private final SignatureValidator signatureValidator;
  private final ComplianceScorer complianceScorer;

  public DocumentationValidator(
      RequirementMerger requirementMerger,
      SignatureValidator signatureValidator,
      ComplianceScorer complianceScorer) {
    this.requirementMerger = requirementMerger;
    this.signatureValidator = signatureValidator;
    this.complianceScorer = complianceScorer;
  }

  public ValidationResult validateDocumentation(
      Map<String, ?> documentation, Collection<String> jurisdictionCodes) {
    return validateDocumentation(DocumentationRecord.of(documentation), jurisdictionCodes);
  }

  public ValidationResult validateDocumentation(
      DocumentationRecord documentation, Collection<String> jurisdictionCodes) {
    return validateDocumentation(
        documentation, requirementMerger.getMergedRequirements(jurisdictionCodes));
  }

  /**
   * Validates against already merged requirements.
   *
   * <ol>
   *   <li>every merged required field must be present and non-blank
   *   <li>a documentation type outside the merged list only warns
   *   <li>when the record requires a signature, it must pass {@link SignatureValidator}
   * </ol>
   */
  public ValidationResult validateDocumentation(
      DocumentationRecord documentation, MergedRequirements requirements) {
    var errors = new ArrayList<String>();
    var warnings = new ArrayList<String>();

    for (String field : requirements.allRequiredFields()) {
      if (!documentation.isFilled(field)) {
        errors.add("Required field missing: " + field.replace('_', ' '));
      }
    }

    if (!requirements.allDocumentationTypes().contains(documentation.type())) {
      warnings.add(
          "Documentation type '"
              + documentation.type()
              + "' may not be compliant in all operating states");
    }

    if (documentation.requiresSignature()) {
      boolean validSignature =
          documentation
              .signature()
              .map(
                  signature ->
                      signatureValidator.validateSignature(
                          signature, requirements.allSignatureRequirements()))
              .orElse(false);
      if (!validSignature) {
        errors.add("Invalid or missing required signature");
      }
    }

    int score = complianceScorer.calculateComplianceScore(documentation, requirements);
    log.debug(
        "Validated documentation: {} errors, {} warnings, score {}",
        errors.size(),
        warnings.size(),
        score);

    return new ValidationResult(errors.isEmpty(), errors, warnings, score);
  }
}
