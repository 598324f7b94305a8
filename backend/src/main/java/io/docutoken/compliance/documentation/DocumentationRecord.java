package io.docutoken.compliance.documentation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An open, string-keyed documentation payload. Field names come from jurisdiction reference data,
 * so only the distinguished fields below have typed accessors.
 */
public final class DocumentationRecord {

  public static final String TYPE = "type";
  public static final String REQUIRES_SIGNATURE = "requiresSignature";
  public static final String SIGNATURE = "signature";
  public static final String TIMESTAMP = "timestamp";

  private final Map<String, Object> fields;

  private DocumentationRecord(Map<String, ?> fields) {
    // LinkedHashMap: payloads may carry explicit nulls
    this.fields =
        Collections.unmodifiableMap(fields != null ? new LinkedHashMap<>(fields) : Map.of());
  }

  public static DocumentationRecord of(Map<String, ?> fields) {
    return new DocumentationRecord(fields);
  }

  public Object get(String field) {
    return fields.get(field);
  }

  public Set<String> fieldNames() {
    return fields.keySet();
  }

  public Map<String, Object> asMap() {
    return fields;
  }

  /** True when the field holds a value whose text is non-empty after trimming. */
  public boolean isFilled(String field) {
    Object value = fields.get(field);
    return value != null && !value.toString().trim().isEmpty();
  }

  public String type() {
    Object value = fields.get(TYPE);
    return value != null ? value.toString() : null;
  }

  /** Accepts a boolean {@code true} or the string "true" in any case. */
  public boolean requiresSignature() {
    Object value = fields.get(REQUIRES_SIGNATURE);
    if (value instanceof Boolean flag) {
      return flag;
    }
    return value instanceof String text && Boolean.parseBoolean(text.trim());
  }

  public Optional<SignatureRecord> signature() {
    return SignatureRecord.from(fields.get(SIGNATURE));
  }

  public Object timestamp() {
    return fields.get(TIMESTAMP);
  }
}
