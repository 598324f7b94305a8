package io.docutoken.compliance.jurisdiction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** DTO record for deserializing jurisdiction pack JSON files from the classpath. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JurisdictionRulePack(
    String code,
    String name,
    List<String> requiredFields,
    List<String> documentationTypes,
    List<String> visitFrequencyOptions,
    List<String> signatureRequirements,
    List<String> specialRequirements) {

  JurisdictionRuleSet toRuleSet() {
    return new JurisdictionRuleSet(
        code.trim(),
        name,
        JurisdictionRuleSet.freeze(requiredFields),
        JurisdictionRuleSet.freeze(documentationTypes),
        JurisdictionRuleSet.freeze(visitFrequencyOptions),
        JurisdictionRuleSet.freeze(signatureRequirements),
        JurisdictionRuleSet.freeze(specialRequirements));
  }
}
