package io.docutoken.compliance.form;

import io.docutoken.compliance.requirement.MergedRequirements;
import io.docutoken.compliance.requirement.RequirementMerger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds form templates from merged requirements. Sections are emitted in a fixed order (Patient
 * Demographics, Physician Orders, Care Plan, Signatures), each only when its gating requirement is
 * present.
 */
@Service
public class FormTemplateGenerator {

  private static final Logger log = LoggerFactory.getLogger(FormTemplateGenerator.class);

  public static final String PATIENT_DEMOGRAPHICS = "patient_demographics";
  public static final String PHYSICIAN_ORDERS = "physician_orders";
  public static final String CARE_PLAN = "care_plan";

  private final RequirementMerger requirementMerger;
  private final ValidationRuleBuilder validationRuleBuilder;

  public FormTemplateGenerator(
      RequirementMerger requirementMerger, ValidationRuleBuilder validationRuleBuilder) {
    this.requirementMerger = requirementMerger;
    this.validationRuleBuilder = validationRuleBuilder;
  }

  public FormTemplate generateFormTemplate(
      Collection<String> jurisdictionCodes, String documentationType) {
    List<String> codes =
        jurisdictionCodes != null
            ? jurisdictionCodes.stream().filter(Objects::nonNull).toList()
            : List.of();
    var requirements = requirementMerger.getMergedRequirements(codes);
    var sections = buildSections(requirements);

    log.debug(
        "Generated {} form template with {} sections for {} jurisdictions",
        documentationType,
        sections.size(),
        codes.size());

    return new FormTemplate(
        documentationType,
        codes,
        sections,
        requirements.allRequiredFields(),
        validationRuleBuilder.getValidationRules(requirements));
  }

  List<FormSection> buildSections(MergedRequirements requirements) {
    var requiredFields = requirements.allRequiredFields();
    var sections = new ArrayList<FormSection>();

    if (requiredFields.contains(PATIENT_DEMOGRAPHICS)) {
      sections.add(patientDemographics());
    }
    if (requiredFields.contains(PHYSICIAN_ORDERS)) {
      sections.add(physicianOrders(List.copyOf(requirements.allVisitFrequencies())));
    }
    if (requiredFields.contains(CARE_PLAN)) {
      sections.add(carePlan());
    }
    if (!requirements.allSignatureRequirements().isEmpty()) {
      sections.add(signatures());
    }

    return sections;
  }

  private static FormSection patientDemographics() {
    return new FormSection(
        "Patient Demographics",
        List.of(
            FieldSpec.of("firstName", FieldType.TEXT, true, "First Name"),
            FieldSpec.of("lastName", FieldType.TEXT, true, "Last Name"),
            FieldSpec.of("dateOfBirth", FieldType.DATE, true, "Date of Birth"),
            FieldSpec.of("address", FieldType.TEXTAREA, true, "Address"),
            FieldSpec.of("phone", FieldType.TEL, true, "Phone Number")));
  }

  private static FormSection physicianOrders(List<String> visitFrequencies) {
    return new FormSection(
        "Physician Orders",
        List.of(
            FieldSpec.of("physicianName", FieldType.TEXT, true, "Physician Name"),
            FieldSpec.of("orderDate", FieldType.DATE, true, "Order Date"),
            FieldSpec.of("orders", FieldType.TEXTAREA, true, "Orders"),
            new FieldSpec(
                "frequency", FieldType.SELECT, true, "Visit Frequency", visitFrequencies)));
  }

  private static FormSection carePlan() {
    return new FormSection(
        "Care Plan",
        List.of(
            FieldSpec.of("goals", FieldType.TEXTAREA, true, "Care Goals"),
            FieldSpec.of("interventions", FieldType.TEXTAREA, true, "Interventions"),
            FieldSpec.of("expectedOutcomes", FieldType.TEXTAREA, true, "Expected Outcomes")));
  }

  private static FormSection signatures() {
    return new FormSection(
        "Signatures",
        List.of(
            FieldSpec.of("nurseSignature", FieldType.SIGNATURE, true, "Nurse Signature"),
            FieldSpec.of(
                "supervisorSignature", FieldType.SIGNATURE, false, "Supervisor Signature"),
            FieldSpec.of("signatureDate", FieldType.DATETIME_LOCAL, true, "Signature Date")));
  }
}
