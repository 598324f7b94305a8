package io.docutoken.compliance.report;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IssueSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  @JsonValue
  public String toJson() {
    return name().toLowerCase(Locale.ROOT);
  }
}
