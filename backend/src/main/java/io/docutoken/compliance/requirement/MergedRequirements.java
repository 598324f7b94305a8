package io.docutoken.compliance.requirement;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deduplicated union of every requirement category across the resolved jurisdictions. Element
 * order follows first appearance but is not significant: equality is set equality.
 */
public record MergedRequirements(
    Set<String> allRequiredFields,
    Set<String> allDocumentationTypes,
    Set<String> allVisitFrequencies,
    Set<String> allSignatureRequirements,
    Set<String> allSpecialRequirements) {

  private static final MergedRequirements EMPTY =
      new MergedRequirements(Set.of(), Set.of(), Set.of(), Set.of(), Set.of());

  public MergedRequirements {
    allRequiredFields = copyOf(allRequiredFields);
    allDocumentationTypes = copyOf(allDocumentationTypes);
    allVisitFrequencies = copyOf(allVisitFrequencies);
    allSignatureRequirements = copyOf(allSignatureRequirements);
    allSpecialRequirements = copyOf(allSpecialRequirements);
  }

  public static MergedRequirements empty() {
    return EMPTY;
  }

  /** True when no category holds any element, e.g. because no requested code resolved. */
  public boolean isEmpty() {
    return allRequiredFields.isEmpty()
        && allDocumentationTypes.isEmpty()
        && allVisitFrequencies.isEmpty()
        && allSignatureRequirements.isEmpty()
        && allSpecialRequirements.isEmpty();
  }

  // LinkedHashSet rather than Set.copyOf: contains(null) must answer false, not throw
  private static Set<String> copyOf(Collection<String> values) {
    return values == null
        ? Collections.emptySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(values));
  }
}
