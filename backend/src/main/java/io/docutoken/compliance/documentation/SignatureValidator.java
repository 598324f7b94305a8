package io.docutoken.compliance.documentation;

import java.util.Collection;
import org.springframework.stereotype.Component;

/** Checks the structural completeness of a signature. */
@Component
public class SignatureValidator {

  /**
   * A signature is valid when its timestamp parses to an instant after the epoch and both the
   * signer id and the signature data are non-blank.
   *
   * <p>{@code signatureRequirements} is the merged signature requirement list of the operating
   * jurisdictions. It is accepted so that per-jurisdiction signer rules (e.g. a required
   * supervisor co-signature) can be added here without changing callers; it does not yet alter the
   * outcome.
   */
  public boolean validateSignature(
      SignatureRecord signature, Collection<String> signatureRequirements) {
    if (signature == null) {
      return false;
    }
    return Timestamps.isAfterEpoch(signature.timestamp())
        && hasText(signature.signerId())
        && hasText(signature.data());
  }

  private static boolean hasText(String value) {
    return value != null && !value.trim().isEmpty();
  }
}
