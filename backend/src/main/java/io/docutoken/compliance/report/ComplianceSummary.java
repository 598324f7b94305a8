package io.docutoken.compliance.report;

/**
 * Document counts and rates over a reporting window.
 *
 * @param complianceRate percentage of compliant documents, 0-100
 * @param averageComplianceScore mean compliance score of the documents in the window
 */
public record ComplianceSummary(
    long totalDocuments,
    long compliantDocuments,
    double complianceRate,
    double averageComplianceScore) {

  public static ComplianceSummary empty() {
    return new ComplianceSummary(0, 0, 0, 0);
  }
}
