package io.docutoken.compliance.jurisdiction;

public record JurisdictionSummary(String code, String name) {

  public static JurisdictionSummary from(JurisdictionRuleSet ruleSet) {
    return new JurisdictionSummary(ruleSet.code(), ruleSet.name());
  }
}
