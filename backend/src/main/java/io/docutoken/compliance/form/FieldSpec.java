package io.docutoken.compliance.form;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A single field of a generated form section.
 *
 * @param options selectable values, only present for {@link FieldType#SELECT} fields
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldSpec(
    String name, FieldType type, boolean required, String label, List<String> options) {

  public FieldSpec {
    options = options != null ? List.copyOf(options) : null;
  }

  public static FieldSpec of(String name, FieldType type, boolean required, String label) {
    return new FieldSpec(name, type, required, label, null);
  }
}
