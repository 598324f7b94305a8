package io.docutoken.compliance.form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A jurisdiction-aware form schema.
 *
 * <p>{@code requiredFields} holds the merged requirement category names (e.g. {@code
 * patient_demographics}), while {@code sections} hold the concrete input fields (e.g. {@code
 * firstName}). The two vocabularies are distinct and both are kept. {@code validationRules} is
 * keyed by either vocabulary: category names plus the fixed {@code phone}, {@code email} and
 * {@code dateOfBirth} overlays.
 */
public record FormTemplate(
    String documentationType,
    List<String> jurisdictions,
    List<FormSection> sections,
    Set<String> requiredFields,
    Map<String, ValidationRule> validationRules) {

  public FormTemplate {
    jurisdictions =
        jurisdictions != null
            ? jurisdictions.stream().filter(Objects::nonNull).toList()
            : List.of();
    sections = List.copyOf(sections);
    requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
    validationRules = Collections.unmodifiableMap(new LinkedHashMap<>(validationRules));
  }

  public List<FieldSpec> allFields() {
    return sections.stream().flatMap(section -> section.fields().stream()).toList();
  }
}
