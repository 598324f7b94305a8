package io.docutoken.compliance.report;

import java.time.Instant;
import java.util.List;

public record ComplianceReport(
    String agencyId,
    Instant reportDate,
    String timeRange,
    List<String> jurisdictions,
    ComplianceSummary summary,
    RequirementCounts requirements,
    List<ComplianceIssue> issues,
    List<String> recommendations) {

  public ComplianceReport {
    jurisdictions = List.copyOf(jurisdictions);
    issues = List.copyOf(issues);
    recommendations = List.copyOf(recommendations);
  }

  /** Sizes of the merged requirement categories the report was computed against. */
  public record RequirementCounts(
      int requiredFields, int documentationTypes, int signatureRequirements) {}
}
