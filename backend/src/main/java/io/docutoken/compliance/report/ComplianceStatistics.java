package io.docutoken.compliance.report;

import java.util.List;

public record ComplianceStatistics(ComplianceSummary summary, List<ComplianceIssue> issues) {

  public ComplianceStatistics {
    summary = summary != null ? summary : ComplianceSummary.empty();
    issues = issues != null ? List.copyOf(issues) : List.of();
  }

  public static ComplianceStatistics empty() {
    return new ComplianceStatistics(ComplianceSummary.empty(), List.of());
  }
}
