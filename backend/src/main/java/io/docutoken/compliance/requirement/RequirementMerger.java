package io.docutoken.compliance.requirement;

import io.docutoken.compliance.exception.JurisdictionNotFoundException;
import io.docutoken.compliance.exception.RuleRepositoryNotLoadedException;
import io.docutoken.compliance.jurisdiction.JurisdictionRuleRepository;
import io.docutoken.compliance.jurisdiction.JurisdictionRuleSet;
import io.docutoken.compliance.jurisdiction.JurisdictionSummary;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves jurisdiction codes against the {@link JurisdictionRuleRepository} and unions their
 * requirement categories. Unknown codes are dropped silently; an empty or fully unresolvable input
 * yields {@link MergedRequirements#empty()}.
 */
@Service
public class RequirementMerger {

  private static final Logger log = LoggerFactory.getLogger(RequirementMerger.class);

  private final JurisdictionRuleRepository ruleRepository;

  public RequirementMerger(JurisdictionRuleRepository ruleRepository) {
    if (ruleRepository.findAll().isEmpty()) {
      throw new RuleRepositoryNotLoadedException("Jurisdiction rule repository is empty");
    }
    this.ruleRepository = ruleRepository;
  }

  /**
   * Resolves each code in input order. Codes with no rule set are skipped, so the result may be
   * shorter than the input; a code requested twice resolves twice.
   */
  public List<JurisdictionRuleSet> getStateRequirements(Collection<String> jurisdictionCodes) {
    if (jurisdictionCodes == null || jurisdictionCodes.isEmpty()) {
      return List.of();
    }
    return jurisdictionCodes.stream()
        .filter(Objects::nonNull)
        .map(ruleRepository::findByCode)
        .flatMap(Optional::stream)
        .toList();
  }

  public MergedRequirements getMergedRequirements(Collection<String> jurisdictionCodes) {
    var ruleSets = getStateRequirements(jurisdictionCodes);
    if (ruleSets.isEmpty()) {
      if (jurisdictionCodes != null && !jurisdictionCodes.isEmpty()) {
        log.warn("None of {} requested jurisdiction codes resolved", jurisdictionCodes.size());
      }
      return MergedRequirements.empty();
    }
    if (ruleSets.size() < jurisdictionCodes.size()) {
      log.debug(
          "Dropped unresolvable jurisdiction codes: {}",
          jurisdictionCodes.stream()
              .filter(code -> code == null || ruleRepository.findByCode(code).isEmpty())
              .toList());
    }

    return new MergedRequirements(
        union(ruleSets, JurisdictionRuleSet::requiredFields),
        union(ruleSets, JurisdictionRuleSet::documentationTypes),
        union(ruleSets, JurisdictionRuleSet::visitFrequencyOptions),
        union(ruleSets, JurisdictionRuleSet::signatureRequirements),
        union(ruleSets, JurisdictionRuleSet::specialRequirements));
  }

  /** Lists every jurisdiction the engine has reference data for, ordered by code. */
  public List<JurisdictionSummary> getSupportedJurisdictions() {
    return ruleRepository.findAll().stream().map(JurisdictionSummary::from).toList();
  }

  /**
   * Looks up a single jurisdiction.
   *
   * @throws JurisdictionNotFoundException if no rule set is registered under the code
   */
  public JurisdictionRuleSet getJurisdiction(String code) {
    return ruleRepository
        .findByCode(code)
        .orElseThrow(() -> new JurisdictionNotFoundException(code));
  }

  private static Set<String> union(
      List<JurisdictionRuleSet> ruleSets, Function<JurisdictionRuleSet, Set<String>> category) {
    var merged = new LinkedHashSet<String>();
    for (var ruleSet : ruleSets) {
      merged.addAll(category.apply(ruleSet));
    }
    return merged;
  }
}
