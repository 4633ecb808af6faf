package com.codeheadsystems.keyshare.server.attestation;

/**
 * Raised when the attestation device or the quote output cannot be read or written.
 */
public class AttestationException extends RuntimeException {

  /**
   * Instantiates a new Attestation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AttestationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
