package io.docutoken.compliance.form;

import java.util.List;

public record FormSection(String title, List<FieldSpec> fields) {

  public FormSection {
    fields = List.copyOf(fields);
  }
}
