package io.docutoken.compliance.form;

import com.fasterxml.jackson.annotation.JsonValue;

/** Input types a generated form field can render as. */
public enum FieldType {
  TEXT("text"),
  TEXTAREA("textarea"),
  DATE("date"),
  DATETIME_LOCAL("datetime-local"),
  TEL("tel"),
  SELECT("select"),
  SIGNATURE("signature");

  private final String inputType;

  FieldType(String inputType) {
    this.inputType = inputType;
  }

  @JsonValue
  public String getInputType() {
    return inputType;
  }
}
