package io.docutoken.compliance.jurisdiction;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of jurisdiction rule sets. Implementations are populated once before first use
 * and never mutated afterwards, so they are safe for concurrent reads.
 */
public interface JurisdictionRuleRepository {

  /** Returns the rule set registered under the exact (case-sensitive) code. */
  Optional<JurisdictionRuleSet> findByCode(String code);

  /** Returns every loaded rule set ordered by code. */
  List<JurisdictionRuleSet> findAll();
}
