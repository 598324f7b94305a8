package io.docutoken.compliance.engine;

import io.docutoken.compliance.documentation.ComplianceScorer;
import io.docutoken.compliance.documentation.DocumentationRecord;
import io.docutoken.compliance.documentation.DocumentationValidator;
import io.docutoken.compliance.documentation.SignatureRecord;
import io.docutoken.compliance.documentation.SignatureValidator;
import io.docutoken.compliance.documentation.ValidationResult;
import io.docutoken.compliance.form.FormDataValidator;
import io.docutoken.compliance.form.FormTemplate;
import io.docutoken.compliance.form.FormTemplateGenerator;
import io.docutoken.compliance.form.FormValidationResult;
import io.docutoken.compliance.form.ValidationRule;
import io.docutoken.compliance.form.ValidationRuleBuilder;
import io.docutoken.compliance.jurisdiction.JurisdictionRuleSet;
import io.docutoken.compliance.jurisdiction.JurisdictionSummary;
import io.docutoken.compliance.report.ComplianceReport;
import io.docutoken.compliance.report.ComplianceReportService;
import io.docutoken.compliance.requirement.MergedRequirements;
import io.docutoken.compliance.requirement.RequirementMerger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Single entry point for the transport layer. Stateless: every call is a pure function of its
 * arguments and the jurisdiction reference data loaded at startup, so one instance serves all
 * request threads without synchronization.
 */
@Service
public class ComplianceEngine {

  private final RequirementMerger requirementMerger;
  private final DocumentationValidator documentationValidator;
  private final SignatureValidator signatureValidator;
  private final ComplianceScorer complianceScorer;
  private final ValidationRuleBuilder validationRuleBuilder;
  private final FormTemplateGenerator formTemplateGenerator;
  private final FormDataValidator formDataValidator;
  private final ComplianceReportService complianceReportService;

  public ComplianceEngine(
      RequirementMerger requirementMerger,
      DocumentationValidator documentationValidator,
      SignatureValidator signatureValidator,
      ComplianceScorer complianceScorer,
      ValidationRuleBuilder validationRuleBuilder,
      FormTemplateGenerator formTemplateGenerator,
      FormDataValidator formDataValidator,
      ComplianceReportService complianceReportService) {
    this.requirementMerger = requirementMerger;
    this.documentationValidator = documentationValidator;
    this.signatureValidator = signatureValidator;
    this.complianceScorer = complianceScorer;
    this.validationRuleBuilder = validationRuleBuilder;
    this.formTemplateGenerator = formTemplateGenerator;
    this.formDataValidator = formDataValidator;
    this.complianceReportService = complianceReportService;
  }

  public List<JurisdictionRuleSet> getStateRequirements(Collection<String> jurisdictionCodes) {
    return requirementMerger.getStateRequirements(jurisdictionCodes);
  }

  public MergedRequirements getMergedRequirements(Collection<String> jurisdictionCodes) {
    return requirementMerger.getMergedRequirements(jurisdictionCodes);
  }

  public List<JurisdictionSummary> getSupportedJurisdictions() {
    return requirementMerger.getSupportedJurisdictions();
  }

  public JurisdictionRuleSet getJurisdiction(String code) {
    return requirementMerger.getJurisdiction(code);
  }

  public ValidationResult validateDocumentation(
      Map<String, ?> documentation, Collection<String> jurisdictionCodes) {
    return documentationValidator.validateDocumentation(documentation, jurisdictionCodes);
  }

  public boolean validateSignature(
      SignatureRecord signature, Collection<String> signatureRequirements) {
    return signatureValidator.validateSignature(signature, signatureRequirements);
  }

  public int calculateComplianceScore(
      Map<String, ?> documentation, MergedRequirements requirements) {
    return complianceScorer.calculateComplianceScore(
        DocumentationRecord.of(documentation), requirements);
  }

  public Map<String, ValidationRule> getValidationRules(MergedRequirements requirements) {
    return validationRuleBuilder.getValidationRules(requirements);
  }

  public FormTemplate generateFormTemplate(
      Collection<String> jurisdictionCodes, String documentationType) {
    return formTemplateGenerator.generateFormTemplate(jurisdictionCodes, documentationType);
  }

  public FormValidationResult validateFormData(Map<String, ?> formData, FormTemplate template) {
    return formDataValidator.validateFormData(formData, template);
  }

  public ComplianceReport generateComplianceReport(
      String agencyId, Collection<String> jurisdictionCodes) {
    return complianceReportService.generateComplianceReport(agencyId, jurisdictionCodes);
  }

  public ComplianceReport generateComplianceReport(
      String agencyId, Collection<String> jurisdictionCodes, int timeRangeDays) {
    return complianceReportService.generateComplianceReport(
        agencyId, jurisdictionCodes, timeRangeDays);
  }
}
