package io.docutoken.compliance.jurisdiction;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Documentation requirements of a single jurisdiction. Each category is an insertion-ordered,
 * unmodifiable set of identifiers taken verbatim from the jurisdiction pack.
 */
public record JurisdictionRuleSet(
    String code,
    String name,
    Set<String> requiredFields,
    Set<String> documentationTypes,
    Set<String> visitFrequencyOptions,
    Set<String> signatureRequirements,
    Set<String> specialRequirements) {

  public JurisdictionRuleSet {
    Objects.requireNonNull(code, "code");
    requiredFields = freeze(requiredFields);
    documentationTypes = freeze(documentationTypes);
    visitFrequencyOptions = freeze(visitFrequencyOptions);
    signatureRequirements = freeze(signatureRequirements);
    specialRequirements = freeze(specialRequirements);
  }

  static Set<String> freeze(Collection<String> values) {
    var copy = new LinkedHashSet<String>();
    if (values != null) {
      values.stream().filter(Objects::nonNull).forEach(copy::add);
    }
    return Collections.unmodifiableSet(copy);
  }
}
