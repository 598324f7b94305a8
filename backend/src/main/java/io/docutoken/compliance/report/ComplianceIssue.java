package io.docutoken.compliance.report;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An aggregated compliance problem reported by the statistics collaborator.
 *
 * @param type machine-readable issue type (e.g., "missing_field", "invalid_signature")
 * @param field the requirement field concerned, or null when not field-related
 * @param count number of documents affected in the reporting window
 * @param severity how serious the issue is
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceIssue(String type, String field, long count, IssueSeverity severity) {

  public static final String MISSING_FIELD = "missing_field";
  public static final String INVALID_SIGNATURE = "invalid_signature";
}
