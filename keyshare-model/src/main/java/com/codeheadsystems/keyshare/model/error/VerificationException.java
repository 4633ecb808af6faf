package com.codeheadsystems.keyshare.model.error;

import java.util.Optional;

/**
 * A rejected store or retrieve request. Carries the {@link VerificationError} and, for the
 * signature-format outcomes, the {@link SignatureError} reason.
 */
public class VerificationException extends Exception {

  private final VerificationError error;
  private final SignatureError signatureError;

  public VerificationException(VerificationError error) {
    this(error, null, null);
  }

  public VerificationException(VerificationError error, SignatureError signatureError) {
    this(error, signatureError, null);
  }

  public VerificationException(VerificationError error, SignatureError signatureError, Throwable cause) {
    super(signatureError == null ? error.name() : error.name() + "(" + signatureError.name() + ")", cause);
    if (error.carriesSignatureReason() != (signatureError != null)) {
      throw new IllegalArgumentException(
          error + " must " + (error.carriesSignatureReason() ? "" : "not ") + "carry a signature reason");
    }
    this.error = error;
    this.signatureError = signatureError;
  }

  public VerificationError error() {
    return error;
  }

  public Optional<SignatureError> signatureError() {
    return Optional.ofNullable(signatureError);
  }
}
