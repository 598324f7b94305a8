package io.docutoken.compliance.report;

import io.docutoken.compliance.config.ComplianceProperties;
import io.docutoken.compliance.exception.InvalidReportRequestException;
import io.docutoken.compliance.report.ComplianceReport.RequirementCounts;
import io.docutoken.compliance.requirement.RequirementMerger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assembles compliance report skeletons. Requirement counts are derived here from the merged
 * requirements; document counts and issues come from the {@link ComplianceStatisticsProvider}.
 */
@Service
public class ComplianceReportService {

  private static final Logger log = LoggerFactory.getLogger(ComplianceReportService.class);

  static final String AUTOMATED_CHECKS_RECOMMENDATION =
      "Consider implementing automated compliance checks";

  private final RequirementMerger requirementMerger;
  private final ComplianceStatisticsProvider statisticsProvider;
  private final ComplianceProperties properties;

  public ComplianceReportService(
      RequirementMerger requirementMerger,
      ComplianceStatisticsProvider statisticsProvider,
      ComplianceProperties properties) {
    this.requirementMerger = requirementMerger;
    this.statisticsProvider = statisticsProvider;
    this.properties = properties;
  }

  public ComplianceReport generateComplianceReport(
      String agencyId, Collection<String> jurisdictionCodes) {
    return generateComplianceReport(
        agencyId, jurisdictionCodes, properties.report().defaultTimeRangeDays());
  }

  /**
   * Builds the report for the last {@code timeRangeDays} days. A non-positive range falls back to
   * the configured default.
   *
   * @throws InvalidReportRequestException if {@code agencyId} is blank
   */
  public ComplianceReport generateComplianceReport(
      String agencyId, Collection<String> jurisdictionCodes, int timeRangeDays) {
    if (agencyId == null || agencyId.isBlank()) {
      throw new InvalidReportRequestException("An agency id is required");
    }
    int days = timeRangeDays > 0 ? timeRangeDays : properties.report().defaultTimeRangeDays();
    List<String> codes =
        jurisdictionCodes != null
            ? jurisdictionCodes.stream().filter(Objects::nonNull).toList()
            : List.of();

    var requirements = requirementMerger.getMergedRequirements(codes);
    var statistics = statisticsProvider.statisticsFor(agencyId, codes, Duration.ofDays(days));
    if (statistics == null) {
      statistics = ComplianceStatistics.empty();
    }

    log.debug(
        "Compliance report for agency {}: {} jurisdictions, {} days, {} issues",
        agencyId,
        codes.size(),
        days,
        statistics.issues().size());

    return new ComplianceReport(
        agencyId,
        Instant.now(),
        "Last " + days + " days",
        codes,
        statistics.summary(),
        new RequirementCounts(
            requirements.allRequiredFields().size(),
            requirements.allDocumentationTypes().size(),
            requirements.allSignatureRequirements().size()),
        statistics.issues(),
        recommendationsFor(statistics.issues()));
  }

  List<String> recommendationsFor(List<ComplianceIssue> issues) {
    var recommendations = new LinkedHashSet<String>();
    for (var issue : issues) {
      if (ComplianceIssue.MISSING_FIELD.equals(issue.type()) && issue.field() != null) {
        recommendations.add(
            "Ensure all "
                + issue.field().replace('_', ' ')
                + " information is collected during intake");
      } else if (ComplianceIssue.INVALID_SIGNATURE.equals(issue.type())) {
        recommendations.add("Review signature validation process with staff");
      }
    }
    recommendations.add(AUTOMATED_CHECKS_RECOMMENDATION);
    return new ArrayList<>(recommendations);
  }
}
