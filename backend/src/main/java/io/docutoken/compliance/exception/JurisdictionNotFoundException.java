package io.docutoken.compliance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A direct lookup named a jurisdiction code that no loaded rule pack declares. */
public class JurisdictionNotFoundException extends ErrorResponseException {

  private final String jurisdictionCode;

  public JurisdictionNotFoundException(String jurisdictionCode) {
    super(HttpStatus.NOT_FOUND, createProblem(jurisdictionCode), null);
    this.jurisdictionCode = jurisdictionCode;
  }

  public String getJurisdictionCode() {
    return jurisdictionCode;
  }

  private static ProblemDetail createProblem(String jurisdictionCode) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Jurisdiction not found");
    problem.setDetail("No rules are loaded for jurisdiction code '" + jurisdictionCode + "'");
    problem.setProperty("jurisdictionCode", jurisdictionCode);
    return problem;
  }
}
