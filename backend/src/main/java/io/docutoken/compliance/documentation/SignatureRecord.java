package io.docutoken.compliance.documentation;

import java.util.Map;
import java.util.Optional;

/**
 * A captured signature. {@code timestamp} is kept in whatever form the payload carried it; see
 * {@link Timestamps} for the accepted shapes.
 */
public record SignatureRecord(Object timestamp, String signerId, String data) {

  /**
   * Reads a signature from a payload value: either a {@link SignatureRecord} or a map with {@code
   * timestamp}, {@code signerId} and {@code data} keys. Any other value is treated as absent.
   */
  public static Optional<SignatureRecord> from(Object value) {
    if (value instanceof SignatureRecord signature) {
      return Optional.of(signature);
    }
    if (value instanceof Map<?, ?> map) {
      return Optional.of(
          new SignatureRecord(
              map.get("timestamp"), asText(map.get("signerId")), asText(map.get("data"))));
    }
    return Optional.empty();
  }

  private static String asText(Object value) {
    return value != null ? value.toString() : null;
  }
}
