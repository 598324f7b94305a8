package io.docutoken.compliance.report;

import java.time.Duration;
import java.util.List;

/**
 * Supplies document counts for compliance reports. Implemented outside the engine by whatever
 * stores submitted documentation; the engine only shapes the report around the numbers.
 */
@FunctionalInterface
public interface ComplianceStatisticsProvider {

  ComplianceStatistics statisticsFor(
      String agencyId, List<String> jurisdictionCodes, Duration window);
}
