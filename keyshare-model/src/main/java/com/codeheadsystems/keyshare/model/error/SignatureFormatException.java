package com.codeheadsystems.keyshare.model.error;

/**
 * Thrown when a signature string cannot be parsed into 64 signature bytes.
 */
public class SignatureFormatException extends Exception {

  private final SignatureError reason;

  public SignatureFormatException(SignatureError reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SignatureError reason() {
    return reason;
  }
}
